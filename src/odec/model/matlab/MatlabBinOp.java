package odec.model.matlab;

/**
 *
 * AST node:
 *
 * lhs <op> rhs
 *
 */
public class MatlabBinOp extends MatlabExpression {

	private final String operator;
	private final MatlabExpression lhs;
	private final MatlabExpression rhs;

	public MatlabBinOp(String operator, MatlabExpression lhs, MatlabExpression rhs) {
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperator() {
		return operator;
	}

	public MatlabExpression getLHS() {
		return lhs;
	}

	public MatlabExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((lhs == null) ? 0 : lhs.hashCode());
		result = prime * result + ((operator == null) ? 0 : operator.hashCode());
		result = prime * result + ((rhs == null) ? 0 : rhs.hashCode());
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
		MatlabBinOp other = (MatlabBinOp) obj;
		if (lhs == null) {
			if (other.lhs != null)
				return false;
		} else if (!lhs.equals(other.lhs))
			return false;
		if (operator == null) {
			if (other.operator != null)
				return false;
		} else if (!operator.equals(other.operator))
			return false;
		if (rhs == null) {
			return other.rhs == null;
		} else return rhs.equals(other.rhs);
	}

}
