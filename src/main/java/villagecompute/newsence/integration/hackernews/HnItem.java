package villagecompute.newsence.integration.hackernews;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hacker News story or comment as returned by the Algolia items API. Comments nest under {@code children}.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record HnItem(long id, String type, String author, String title, String url, String text, Integer points,
        @JsonProperty("created_at") String createdAt, List<HnItem> children) {

    public List<HnItem> childrenOrEmpty() {
        return children == null ? List.of() : children;
    }

    public String discussionUrl() {
        return HackerNewsClient.DISCUSSION_URL_PREFIX + id;
    }
}
