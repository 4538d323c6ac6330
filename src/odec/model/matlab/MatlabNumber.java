package odec.model.matlab;

/**
 *
 * A numeric literal. The source text is kept so that formulas reproduce the
 * number exactly as it was written.
 *
 */
public class MatlabNumber extends MatlabExpression {

	private final String text;

	public MatlabNumber(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public double getValue() {
		return Double.parseDouble(text);
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((text == null) ? 0 : text.hashCode());
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
		MatlabNumber other = (MatlabNumber) obj;
		if (text == null) {
			return other.text == null;
		} else return text.equals(other.text);
	}

}
