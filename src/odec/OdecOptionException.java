package odec;

/**
 * Thrown when the command line or the configuration file cannot be understood.
 */
public class OdecOptionException extends Exception {

	private static final long serialVersionUID = 2201975120963421180L;

	public OdecOptionException(String msg) {
		super(msg);
	}

}
