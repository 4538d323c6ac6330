package odec.trans.passes.formula;

/**
 * Formula text that {@link InfixFormulaParser} does not accept.
 */
public class FormulaParseException extends Exception {

	private static final long serialVersionUID = 3318095725317452619L;

	private final int position;

	public FormulaParseException(String message, int position) {
		super(message + " at offset " + position);
		this.position = position;
	}

	public int getPosition() {
		return position;
	}
}
