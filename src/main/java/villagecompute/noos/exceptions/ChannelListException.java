package villagecompute.noos.exceptions;

/**
 * Exception thrown when the channel list file cannot be read or written, or an OPML document cannot be processed.
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ChannelListException extends RuntimeException {

    public ChannelListException(String message) {
        super(message);
    }

    public ChannelListException(String message, Throwable cause) {
        super(message, cause);
    }
}
