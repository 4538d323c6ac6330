package odec.trans.passes.resolve;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

public class UnresolvedIdentifierIssue extends Issue {

	private final String identifier;

	public UnresolvedIdentifierIssue(String identifier) {
		super();
		this.identifier = identifier;
	}

	public String getIdentifier() {
		return identifier;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
