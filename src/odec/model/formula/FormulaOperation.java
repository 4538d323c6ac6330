package odec.model.formula;

import java.util.List;

/**
 * A built-in operator applied to one (prefix) or two (infix) operands. The operator is
 * kept as written in the formula text: {@code + - * / ^ == != < > <= >= && || !}.
 */
public class FormulaOperation extends FormulaNode {

	private final String operator;
	private final List<FormulaNode> operands;

	public FormulaOperation(String operator, List<FormulaNode> operands) {
		this.operator = operator;
		this.operands = operands;
	}

	public String getOperator() {
		return operator;
	}

	public List<FormulaNode> getOperands() {
		return operands;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 * operator.hashCode() + operands.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		FormulaOperation other = (FormulaOperation) obj;
		return operator.equals(other.operator) && operands.equals(other.operands);
	}

	@Override
	public String toString() {
		return "(" + operator + " " + operands + ")";
	}
}
