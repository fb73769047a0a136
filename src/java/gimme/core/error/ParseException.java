package gimme.core.error;

/**
 * Thrown when a record of an input file cannot be turned into an annotation
 *
 */
public class ParseException extends RuntimeException {

	private static final long serialVersionUID = 3914853306312640218L;

	public ParseException(String message) {
		super(message);
	}

	public ParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
