package odec.model.matlab;

import java.util.List;

/**
 *
 * AST node:
 *
 * @(p1, p2, ...) body
 *
 */
public class MatlabAnonymousFunction extends MatlabExpression {

	private final List<String> parameters;
	private final MatlabExpression body;

	public MatlabAnonymousFunction(List<String> parameters, MatlabExpression body) {
		this.parameters = parameters;
		this.body = body;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public MatlabExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((body == null) ? 0 : body.hashCode());
		result = prime * result + ((parameters == null) ? 0 : parameters.hashCode());
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
		MatlabAnonymousFunction other = (MatlabAnonymousFunction) obj;
		if (body == null) {
			if (other.body != null)
				return false;
		} else if (!body.equals(other.body))
			return false;
		if (parameters == null) {
			return other.parameters == null;
		} else return parameters.equals(other.parameters);
	}

}
