package villagecompute.newsence.exceptions;

/**
 * Exception thrown when input fails validation (empty URL list, content below the minimum length, unparseable URL).
 *
 * <p>
 * Extends RuntimeException per project standards. Terminal for the affected item: workflow steps do not retry it and
 * REST resources map it to HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
