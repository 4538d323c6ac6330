package odec.model.formula;

public class FormulaSymbol extends FormulaNode {

	private final String name;

	public FormulaSymbol(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return name.equals(((FormulaSymbol) obj).name);
	}

	@Override
	public String toString() {
		return name;
	}
}
