package odec.model.bio;

/**
 * A state variable living in a compartment. Species are never constant.
 */
public class Species extends ModelEntity {

	private final String compartment;
	private final double value;

	public Species(String id, String compartment, double value) {
		super(id);
		this.compartment = compartment;
		this.value = value;
	}

	public String getCompartment() {
		return compartment;
	}

	/**
	 * @return the initial concentration
	 */
	public double getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(ModelEntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + compartment.hashCode();
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
		Species other = (Species) obj;
		return compartment.equals(other.compartment)
				&& getId().equals(other.getId())
				&& Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value);
	}

	@Override
	public String toString() {
		return "Species [" + getId() + " in " + compartment + ", value=" + value + "]";
	}
}
