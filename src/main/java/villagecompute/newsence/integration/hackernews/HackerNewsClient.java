package villagecompute.newsence.integration.hackernews;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.util.HtmlText;

/**
 * HTTP client for the Hacker News Algolia items API.
 *
 * <p>
 * One call returns the story together with its full comment tree, which is why this endpoint is used instead of the
 * Firebase API (one request per comment there).
 */
@ApplicationScoped
public class HackerNewsClient {

    private static final Logger LOG = Logger.getLogger(HackerNewsClient.class);

    static final String ITEMS_URL = "https://hn.algolia.com/api/v1/items/";
    public static final String DISCUSSION_URL_PREFIX = "https://news.ycombinator.com/item?id=";
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(15);

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public HackerNewsClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    /**
     * Fetches a story or comment with its nested comments.
     *
     * @param itemId
     *            numeric Hacker News id
     * @return the item, or empty when the API reports it missing
     * @throws ExtractionException
     *             on network failure, a non-200/404 status or an unparseable body
     */
    public Optional<HnItem> fetchItem(String itemId) {
        LOG.debugf("Fetching Hacker News item %s", itemId);
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(ITEMS_URL + itemId)).timeout(HTTP_TIMEOUT)
                    .GET().build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 404) {
                LOG.warnf("Hacker News item %s not found", itemId);
                return Optional.empty();
            }
            if (response.statusCode() != 200) {
                throw new ExtractionException("Hacker News API returned status " + response.statusCode());
            }
            return Optional.of(objectMapper.readValue(response.body(), HnItem.class));
        } catch (ExtractionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted fetching Hacker News item " + itemId, e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to fetch Hacker News item %s", itemId);
            throw new ExtractionException("Failed to fetch Hacker News item " + itemId, e);
        }
    }

    /**
     * Flattens a comment tree depth-first, parents before their replies. Deleted or empty comments are dropped but
     * their replies are kept.
     */
    public static List<HnComment> collectComments(List<HnItem> children) {
        List<HnComment> comments = new ArrayList<>();
        if (children == null) {
            return comments;
        }
        for (HnItem child : children) {
            if (child.text() != null) {
                String clean = HtmlText.clean(child.text());
                if (!clean.isBlank()) {
                    comments.add(new HnComment(child.id(), child.author(), clean));
                }
            }
            comments.addAll(collectComments(child.children()));
        }
        return comments;
    }
}
