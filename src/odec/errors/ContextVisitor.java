package odec.errors;

import odec.trans.passes.assemble.WhileTranslatingEntry;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(WhileTranslatingEntry whileTranslatingEntry) throws E;

}
