package villagecompute.newsence.services;

import java.util.UUID;

/**
 * Outcome of one submitted URL. Either {@code itemId} or {@code error} is set.
 */
public record SubmissionResult(String url, UUID itemId, String title, boolean alreadyExists, String error) {

    static SubmissionResult stored(String url, UUID itemId, String title) {
        return new SubmissionResult(url, itemId, title, false, null);
    }

    static SubmissionResult existing(String url, UUID itemId, String title) {
        return new SubmissionResult(url, itemId, title, true, null);
    }

    static SubmissionResult failed(String url, String error) {
        return new SubmissionResult(url, null, null, false, error);
    }
}
