package odec.trans.passes.assemble;

import odec.errors.Issue;
import odec.errors.IssueVisitor;
import odec.model.matlab.MatlabExpression;

public class MalformedInitialConditionIssue extends Issue {

	private final String variable;
	private final MatlabExpression value;

	/**
	 * @param value the offending expression, or null when the initial conditions are not
	 *              passed through a variable at all
	 */
	public MalformedInitialConditionIssue(String variable, MatlabExpression value) {
		super();
		this.variable = variable;
		this.value = value;
	}

	public String getVariable() {
		return variable;
	}

	public MatlabExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
