package villagecompute.noos.exceptions;

/**
 * Exception thrown when adding something that is already present (e.g., a channel URL already subscribed).
 *
 * <p>
 * Extends RuntimeException per project standards. The command layer reports it and exits with a usage error.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
