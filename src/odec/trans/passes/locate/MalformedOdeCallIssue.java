package odec.trans.passes.locate;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

/**
 * The solver call was found but is not of the form {@code [t, y] = odeXX(f, tspan, y0, ...)}.
 */
public class MalformedOdeCallIssue extends Issue {

	private final String odeFunction;
	private final String reason;

	public MalformedOdeCallIssue(String odeFunction, String reason) {
		super();
		this.odeFunction = odeFunction;
		this.reason = reason;
	}

	public String getOdeFunction() {
		return odeFunction;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
