package villagecompute.newsence.exceptions;

/**
 * Exception thrown when a page, post or platform API cannot be fetched or parsed.
 *
 * <p>
 * Extends RuntimeException per project standards. Treated as transient inside workflow steps and as a per-URL error
 * string by the submission endpoint.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
