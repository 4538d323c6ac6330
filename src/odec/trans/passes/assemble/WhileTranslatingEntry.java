package odec.trans.passes.assemble;

import odec.errors.Context;
import odec.errors.ContextVisitor;

/**
 * Issue context naming the model entity whose formula was being produced.
 */
public class WhileTranslatingEntry extends Context {

	public enum Kind {
		INITIAL_VALUE("initial value"),
		RATE_RULE("rate rule"),
		PARAMETER("parameter");

		private final String description;

		Kind(String description) {
			this.description = description;
		}

		public String getDescription() {
			return description;
		}
	}

	private final Kind kind;
	private final String entityId;

	public WhileTranslatingEntry(Kind kind, String entityId) {
		this.kind = kind;
		this.entityId = entityId;
	}

	public Kind getKind() {
		return kind;
	}

	public String getEntityId() {
		return entityId;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
