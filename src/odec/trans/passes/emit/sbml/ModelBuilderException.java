package odec.trans.passes.emit.sbml;

public class ModelBuilderException extends Exception {

	private static final long serialVersionUID = -2207466812440383521L;

	public ModelBuilderException(String message) {
		super(message);
	}

	public ModelBuilderException(String message, Throwable cause) {
		super(message, cause);
	}
}
