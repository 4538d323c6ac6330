package odec.model.matlab;

/**
 *
 * An explicitly parenthesized expression:
 *
 * ( inner )
 *
 */
public class MatlabGroup extends MatlabExpression {

	private final MatlabExpression inner;

	public MatlabGroup(MatlabExpression inner) {
		this.inner = inner;
	}

	public MatlabExpression getInner() {
		return inner;
	}

	/**
	 * @return the expression with any number of enclosing parentheses removed
	 */
	public static MatlabExpression strip(MatlabExpression expression) {
		while (expression instanceof MatlabGroup) {
			expression = ((MatlabGroup) expression).getInner();
		}
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return 17 + ((inner == null) ? 0 : inner.hashCode());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MatlabGroup other = (MatlabGroup) obj;
		if (inner == null) {
			return other.inner == null;
		} else return inner.equals(other.inner);
	}

}
