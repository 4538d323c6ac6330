package odec.trans.passes.emit;

import odec.errors.Issue;
import odec.errors.IssueVisitor;
import odec.trans.passes.emit.sbml.ModelBuilderException;

public class ModelBuilderIssue extends Issue {

	private final String operation;
	private final String reason;

	public ModelBuilderIssue(String operation, String reason) {
		super();
		this.operation = operation;
		this.reason = reason;
	}

	public ModelBuilderIssue(String operation, ModelBuilderException cause) {
		this(operation, cause.getMessage());
		initCause(cause);
	}

	/**
	 * @return what the builder was asked to do, e.g. "create rate rule for x_1"
	 */
	public String getOperation() {
		return operation;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
