package odec.model.bio;

/**
 * A named element of the assembled model. Ids are unique across all entity kinds.
 */
public abstract class ModelEntity {

	private final String id;

	protected ModelEntity(String id) {
		this.id = id;
	}

	public String getId() {
		return id;
	}

	public abstract <T, E extends Throwable> T accept(ModelEntityVisitor<T, E> v) throws E;

}
