package odec.model.matlab;

/**
 *
 * AST node:
 *
 * @name
 *
 */
public class MatlabFunctionHandle extends MatlabExpression {

	private final String name;

	public MatlabFunctionHandle(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 7;
		result = prime * result + ((name == null) ? 0 : name.hashCode());
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
		MatlabFunctionHandle other = (MatlabFunctionHandle) obj;
		if (name == null) {
			return other.name == null;
		} else return name.equals(other.name);
	}

}
