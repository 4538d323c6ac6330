package odec.model.formula;

public class FormulaNumber extends FormulaNode {

	private final String text;

	public FormulaNumber(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(FormulaNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((FormulaNumber) obj).text);
	}

	@Override
	public String toString() {
		return text;
	}
}
