package odec.trans.passes.formula;

import odec.errors.Issue;
import odec.errors.IssueVisitor;

/**
 * Only row and column vectors can be flattened into scalar entities.
 */
public class UnsupportedMatrixShapeIssue extends Issue {

	private final String name;
	private final String shape;

	public UnsupportedMatrixShapeIssue(String name, String shape) {
		super();
		this.name = name;
		this.shape = shape;
	}

	public String getName() {
		return name;
	}

	public String getShape() {
		return shape;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
