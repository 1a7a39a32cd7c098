package villagecompute.noos.exceptions;

/**
 * Exception thrown when a requested resource is not found (e.g., removing a channel that is not subscribed).
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
