package odec.model.matlab;

/**
 *
 * AST node:
 *
 * operand'   or   operand.'
 *
 */
public class MatlabTranspose extends MatlabExpression {

	private final String operator;
	private final MatlabExpression operand;

	public MatlabTranspose(String operator, MatlabExpression operand) {
		this.operator = operator;
		this.operand = operand;
	}

	public String getOperator() {
		return operator;
	}

	public MatlabExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 3;
		result = prime * result + ((operand == null) ? 0 : operand.hashCode());
		result = prime * result + ((operator == null) ? 0 : operator.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MatlabTranspose other = (MatlabTranspose) obj;
		if (operand == null) {
			if (other.operand != null)
				return false;
		} else if (!operand.equals(other.operand))
			return false;
		if (operator == null) {
			return other.operator == null;
		} else return operator.equals(other.operator);
	}

}
