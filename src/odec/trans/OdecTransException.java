package odec.trans;

import odec.OdecException;

/**
 * Exception during scope tree to biological model translation
 *
 */
public class OdecTransException extends OdecException {

	private static final long serialVersionUID = -4127306638890275512L;
	private static final String prefix = "Translation Error";

	public OdecTransException(String msg) {
		super(prefix, msg);
	}

}
