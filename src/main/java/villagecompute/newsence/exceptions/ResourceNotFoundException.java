package villagecompute.newsence.exceptions;

/**
 * Exception thrown when a requested item, topic or workflow instance does not exist.
 *
 * <p>
 * Extends RuntimeException per project standards. A workflow that hits this while loading its item terminates with
 * reason {@code not_found}.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
