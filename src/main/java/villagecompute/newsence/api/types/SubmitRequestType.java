package villagecompute.newsence.api.types;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * Request type for URL submission.
 *
 * <p>
 * Accepts a single {@code url} or a list of {@code urls}; when both are present {@code urls} wins.
 *
 * <pre>{@code
 * {
 *   "urls": ["https://example.com/a", "https://example.com/b"],
 *   "userId": "user-123"
 * }
 * }</pre>
 */
public record SubmitRequestType(@JsonProperty("url") @Size(
        max = 2048) String url,

        @JsonProperty("urls") List<@Size(
                max = 2048) String> urls,

        @JsonProperty("userId") @Size(
                max = 128) String userId) {

    /**
     * The URLs to process, in request order.
     */
    public List<String> effectiveUrls() {
        if (urls != null) {
            return urls;
        }
        List<String> single = new ArrayList<>();
        if (url != null && !url.isBlank()) {
            single.add(url);
        }
        return single;
    }
}
