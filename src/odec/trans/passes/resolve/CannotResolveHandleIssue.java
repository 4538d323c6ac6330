package odec.trans.passes.resolve;

import odec.errors.Issue;
import odec.errors.IssueVisitor;
import odec.model.matlab.MatlabExpression;

public class CannotResolveHandleIssue extends Issue {

	private final String odeFunction;
	private final MatlabExpression argument;
	private final String reason;

	public CannotResolveHandleIssue(String odeFunction, MatlabExpression argument, String reason) {
		super();
		this.odeFunction = odeFunction;
		this.argument = argument;
		this.reason = reason;
	}

	public String getOdeFunction() {
		return odeFunction;
	}

	public MatlabExpression getArgument() {
		return argument;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
