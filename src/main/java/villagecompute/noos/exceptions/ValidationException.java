package villagecompute.noos.exceptions;

/**
 * Exception thrown when input validation fails (e.g., malformed feed URL, unknown command, missing argument).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to exit status 2 by the command dispatcher.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
