package villagecompute.noos.exceptions;

/**
 * Exception thrown when template text cannot be read from its configured source.
 *
 * <p>
 * Fatal for the current command: the dispatcher logs it and exits with status 1. Template <i>content</i> problems
 * (missing placeholders) are never reported this way; they are logged and rendering degrades instead.
 */
public class TemplateLoadException extends RuntimeException {

    public TemplateLoadException(String message) {
        super(message);
    }

    public TemplateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
