package odec.trans.passes.formula;

import odec.model.matlab.MatlabArray;
import odec.model.matlab.MatlabExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class VectorFlattening {

	private VectorFlattening() {}

	/**
	 * Lists the entries of a row vector {@code [a b c]} or a column vector {@code [a; b; c]}
	 * in 1-based index order.
	 *
	 * @param name the variable the array is bound to, for error reporting
	 * @throws UnsupportedMatrixShapeIssue when the array has several rows and several columns
	 */
	public static List<MatlabExpression> entries(String name, MatlabArray array) {
		List<List<MatlabExpression>> rows = array.getRows();
		if (rows.isEmpty()) {
			return Collections.emptyList();
		}
		if (rows.size() == 1) {
			return new ArrayList<>(rows.get(0));
		}
		List<MatlabExpression> column = new ArrayList<>();
		for (List<MatlabExpression> row : rows) {
			if (row.size() != 1) {
				throw new UnsupportedMatrixShapeIssue(name, "two-dimensional matrix");
			}
			column.add(row.get(0));
		}
		return column;
	}
}
