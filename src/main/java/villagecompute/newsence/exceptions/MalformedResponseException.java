package villagecompute.newsence.exceptions;

/**
 * Exception thrown when an AI completion does not contain the JSON shape a caller asked for.
 *
 * <p>
 * Extends RuntimeException per project standards. Callers catch it and fall back to values derived from the item's own
 * fields.
 */
public class MalformedResponseException extends RuntimeException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
