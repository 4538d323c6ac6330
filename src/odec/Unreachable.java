package odec;

/**
 * Thrown where a checked exception is declared but cannot occur, such as I/O on a string writer.
 */
public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}
}
