package odec.trans.passes.parse;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

/**
 * The serialized scope tree handed over by the MATLAB parser could not be read.
 */
public class ScopeTreeParsingIssue extends Issue {

	private final String path;
	private final String reason;

	public ScopeTreeParsingIssue(String path, String reason) {
		super();
		this.path = path;
		this.reason = reason;
	}

	/**
	 * @return a JSON-pointer-like path to the offending element, e.g. "/functions/0/assignments/2"
	 */
	public String getPath() {
		return path;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
