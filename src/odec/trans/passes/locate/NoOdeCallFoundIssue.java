package odec.trans.passes.locate;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

public class NoOdeCallFoundIssue extends Issue {

	public NoOdeCallFoundIssue() {
		super();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
