package odec.formatters;

import odec.errors.ContextVisitor;
import odec.trans.passes.assemble.WhileTranslatingEntry;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileTranslatingEntry whileTranslatingEntry) throws IOException {
		out.write("while translating the ");
		out.write(whileTranslatingEntry.getKind().getDescription());
		out.write(" of ");
		out.write(whileTranslatingEntry.getEntityId());
		return null;
	}

}
