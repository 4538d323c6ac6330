package odec.trans.passes.resolve;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

public class MalformedDerivativeBodyIssue extends Issue {

	private final String functionName;
	private final String reason;

	public MalformedDerivativeBodyIssue(String functionName, String reason) {
		super();
		this.functionName = functionName;
		this.reason = reason;
	}

	public String getFunctionName() {
		return functionName;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
