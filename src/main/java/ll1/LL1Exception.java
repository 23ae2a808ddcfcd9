package ll1;

/**
 * Base class of all errors reported by the grammar analysis.
 */
public class LL1Exception extends RuntimeException {

	public LL1Exception(String message) {
		super(message);
	}

	public LL1Exception(String message, Throwable cause) {
		super(message, cause);
	}
}
