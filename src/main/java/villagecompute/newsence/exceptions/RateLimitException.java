package villagecompute.newsence.exceptions;

/**
 * Exception thrown when admission control rejects a submission.
 *
 * <p>
 * Carries the number of seconds the caller should wait before retrying; REST resources copy it into the
 * {@code Retry-After} header of the 429 response.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class RateLimitException extends RuntimeException {

    private final long retryAfterSeconds;

    public RateLimitException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
