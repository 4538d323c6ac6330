package odec.model.matlab;

public class MatlabString extends MatlabExpression {

	private final String value;

	public MatlabString(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return value == null ? 0 : value.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		MatlabString other = (MatlabString) obj;
		return value == null ? other.value == null : value.equals(other.value);
	}

}
