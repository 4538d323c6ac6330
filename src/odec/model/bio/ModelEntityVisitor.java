package odec.model.bio;

public abstract class ModelEntityVisitor<T, E extends Throwable> {
	public abstract T visit(Compartment compartment) throws E;
	public abstract T visit(Parameter parameter) throws E;
	public abstract T visit(Species species) throws E;
}
