package odec.errors;

import odec.Unreachable;
import odec.formatters.IndentingWriter;
import odec.formatters.IssueFormattingVisitor;
import odec.trans.OdecTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends OdecTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
