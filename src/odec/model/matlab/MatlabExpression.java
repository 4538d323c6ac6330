package odec.model.matlab;

import odec.formatters.IndentingWriter;
import odec.formatters.MatlabExpressionFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * Base class of the expression trees produced by the MATLAB parser. The set of
 * subclasses is closed: every consumer dispatches through {@link MatlabExpressionVisitor}.
 *
 */
public abstract class MatlabExpression {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new MatlabExpressionFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(MatlabExpressionVisitor<T, E> v) throws E;

}
