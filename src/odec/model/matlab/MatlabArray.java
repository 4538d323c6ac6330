package odec.model.matlab;

import java.util.List;

/**
 *
 * AST node:
 *
 * [a b c; d e f]   or, for cell arrays,   {a b c; d e f}
 *
 * Stored as a list of rows, each a list of entries.
 *
 */
public class MatlabArray extends MatlabExpression {

	private final List<List<MatlabExpression>> rows;
	private final boolean cell;

	public MatlabArray(List<List<MatlabExpression>> rows, boolean cell) {
		this.rows = rows;
		this.cell = cell;
	}

	public List<List<MatlabExpression>> getRows() {
		return rows;
	}

	public boolean isCell() {
		return cell;
	}

	@Override
	public <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + (cell ? 1231 : 1237);
		result = prime * result + ((rows == null) ? 0 : rows.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		MatlabArray other = (MatlabArray) obj;
		if (cell != other.cell)
			return false;
		if (rows == null) {
			return other.rows == null;
		} else return rows.equals(other.rows);
	}

}
