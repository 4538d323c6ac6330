package odec.trans.passes.formula;

import odec.errors.Issue;
import odec.errors.IssueVisitor;
import odec.model.matlab.MatlabExpression;

public class UnsupportedExpressionIssue extends Issue {

	private final MatlabExpression expression;

	public UnsupportedExpressionIssue(MatlabExpression expression) {
		super();
		this.expression = expression;
	}

	public MatlabExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
