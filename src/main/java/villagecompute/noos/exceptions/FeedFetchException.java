package villagecompute.noos.exceptions;

/**
 * Exception thrown when a feed cannot be fetched or parsed (HTTP error status, network failure, invalid XML).
 *
 * <p>
 * Feed refresh catches it per feed, logs it and continues with the remaining channels.
 */
public class FeedFetchException extends RuntimeException {

    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
