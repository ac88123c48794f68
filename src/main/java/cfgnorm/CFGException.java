package cfgnorm;

/**
 * Base class of all exceptions thrown by this project.
 */
public class CFGException extends RuntimeException {

	public CFGException(String message) {
		super(message);
	}
}
