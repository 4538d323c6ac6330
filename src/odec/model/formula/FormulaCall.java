package odec.model.formula;

import java.util.List;

public class FormulaCall extends FormulaNode {

	private final String function;
	private final List<FormulaNode> arguments;

	public FormulaCall(String function, List<FormulaNode> arguments) {
		this.function = function;
		this.arguments = arguments;
	}

	public String getFunction() {
		return function;
	}

	public List<FormulaNode> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 31 * function.hashCode() + arguments.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		FormulaCall other = (FormulaCall) obj;
		return function.equals(other.function) && arguments.equals(other.arguments);
	}

	@Override
	public String toString() {
		return function + arguments;
	}
}
