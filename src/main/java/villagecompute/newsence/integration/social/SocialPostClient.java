package villagecompute.newsence.integration.social;

import java.time.Instant;
import java.util.List;

/**
 * Lists recent posts of a curated social list.
 */
public interface SocialPostClient {

    boolean isConfigured();

    /**
     * Returns the posts of {@code listId} created at or after {@code since}, replies excluded, following pagination
     * until the API reports no further page.
     *
     * @throws villagecompute.newsence.exceptions.ExtractionException
     *             when the API cannot be reached or reports an error
     */
    List<SocialPost> listPosts(String listId, Instant since);
}
