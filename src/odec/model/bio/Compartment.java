package odec.model.bio;

public class Compartment extends ModelEntity {

	private final double size;

	public Compartment(String id, double size) {
		super(id);
		this.size = size;
	}

	public double getSize() {
		return size;
	}

	@Override
	public <T, E extends Throwable> T accept(ModelEntityVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + getId().hashCode();
		long temp = Double.doubleToLongBits(size);
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
		Compartment other = (Compartment) obj;
		return getId().equals(other.getId())
				&& Double.doubleToLongBits(size) == Double.doubleToLongBits(other.size);
	}

	@Override
	public String toString() {
		return "Compartment [" + getId() + ", size=" + size + "]";
	}
}
