package odec.model.matlab;

import java.util.List;

/**
 *
 * AST node:
 *
 * name(arg1, arg2, ...)
 *
 * Syntactically this is either an array element reference or a function call. Only the
 * enclosing scope's type information can tell which.
 *
 */
public class MatlabArrayOrCall extends MatlabExpression {

	private final String name;
	private final List<MatlabExpression> arguments;

	public MatlabArrayOrCall(String name, List<MatlabExpression> arguments) {
		this.name = name;
		this.arguments = arguments;
	}

	public String getName() {
		return name;
	}

	public List<MatlabExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((arguments == null) ? 0 : arguments.hashCode());
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
		MatlabArrayOrCall other = (MatlabArrayOrCall) obj;
		if (arguments == null) {
			if (other.arguments != null)
				return false;
		} else if (!arguments.equals(other.arguments))
			return false;
		if (name == null) {
			return other.name == null;
		} else return name.equals(other.name);
	}

}
