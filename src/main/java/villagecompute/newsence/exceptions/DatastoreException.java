package villagecompute.newsence.exceptions;

/**
 * Exception thrown when a store write fails (insert, partial update, batch topic assignment).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 500 by REST resources.
 */
public class DatastoreException extends RuntimeException {

    public DatastoreException(String message) {
        super(message);
    }

    public DatastoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
