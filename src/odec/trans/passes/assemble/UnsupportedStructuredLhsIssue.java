package odec.trans.passes.assemble;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

/**
 * An indexed or destructuring assignment target such as {@code v(2) = 1}. Such bindings are
 * left out of the model; this issue is only ever reported as a warning.
 */
public class UnsupportedStructuredLhsIssue extends Issue {

	private final String lhs;

	public UnsupportedStructuredLhsIssue(String lhs) {
		super();
		this.lhs = lhs;
	}

	public String getLhs() {
		return lhs;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
