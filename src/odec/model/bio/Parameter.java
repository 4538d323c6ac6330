package odec.model.bio;

/**
 * A named quantity. Constant parameters come from scalar script bindings; non-constant ones
 * from flattened vectors, and from the state vector when parameters are requested instead
 * of species.
 */
public class Parameter extends ModelEntity {

	private final double value;
	private final boolean constant;

	public Parameter(String id, double value, boolean constant) {
		super(id);
		this.value = value;
		this.constant = constant;
	}

	public double getValue() {
		return value;
	}

	public boolean isConstant() {
		return constant;
	}

	@Override
	public <T, E extends Throwable> T accept(ModelEntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + (constant ? 1231 : 1237);
		result = prime * result + getId().hashCode();
		long temp = Double.doubleToLongBits(value);
		result = prime * result + (int) (temp ^ (temp >>> 32));
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
		Parameter other = (Parameter) obj;
		return constant == other.constant
				&& getId().equals(other.getId())
				&& Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
	}

	@Override
	public String toString() {
		return "Parameter [" + getId() + "=" + value + (constant ? ", constant" : "") + "]";
	}
}
