package odec.errors;

public abstract class IssueContext {

	public abstract void error(Issue err);

	/**
	 * Records a limitation that does not abort the translation.
	 */
	public abstract void warning(Issue warning);

	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
