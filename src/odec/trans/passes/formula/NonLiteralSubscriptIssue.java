package odec.trans.passes.formula;

import odec.errors.Issue;
import odec.errors.IssueVisitor;
import odec.model.matlab.MatlabExpression;

/**
 * A vector subscript that is not a positive integer literal and does not resolve to one.
 */
public class NonLiteralSubscriptIssue extends Issue {

	private final String vector;
	private final MatlabExpression subscript;

	public NonLiteralSubscriptIssue(String vector, MatlabExpression subscript) {
		super();
		this.vector = vector;
		this.subscript = subscript;
	}

	public String getVector() {
		return vector;
	}

	public MatlabExpression getSubscript() {
		return subscript;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
