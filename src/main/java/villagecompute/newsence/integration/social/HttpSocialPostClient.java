package villagecompute.newsence.integration.social;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.exceptions.ExtractionException;

/**
 * {@link SocialPostClient} over the twitterapi.io list timeline endpoint.
 *
 * <p>
 * The API pages 20 posts at a time with an opaque cursor. Pagination stops at {@link #MAX_PAGES} so a misbehaving
 * cursor cannot loop forever.
 */
@ApplicationScoped
public class HttpSocialPostClient implements SocialPostClient {

    private static final Logger LOG = Logger.getLogger(HttpSocialPostClient.class);

    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(20);
    private static final int MAX_PAGES = 25;
    private static final DateTimeFormatter TWITTER_DATE = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy",
            Locale.ENGLISH);

    @ConfigProperty(
            name = "newsence.social.api-base-url")
    String baseUrl;

    @ConfigProperty(
            name = "newsence.social.api-key")
    Optional<String> apiKey;

    @Inject
    ObjectMapper objectMapper;

    private final HttpClient httpClient;

    public HttpSocialPostClient() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
    }

    @Override
    public boolean isConfigured() {
        return apiKey.filter(k -> !k.isBlank()).isPresent();
    }

    @Override
    public List<SocialPost> listPosts(String listId, Instant since) {
        if (!isConfigured()) {
            throw new ExtractionException("Social API key not configured");
        }

        List<SocialPost> posts = new ArrayList<>();
        String cursor = null;
        int page = 0;
        do {
            JsonNode body = fetchPage(listId, since, cursor);
            for (JsonNode node : body.path("tweets")) {
                posts.add(toPost(node));
            }
            cursor = body.path("has_next_page").asBoolean(false) ? body.path("next_cursor").asText(null) : null;
            page++;
        } while (cursor != null && !cursor.isBlank() && page < MAX_PAGES);

        LOG.debugf("Fetched %d posts from list %s over %d pages", (Object) posts.size(), listId, page);
        return posts;
    }

    private JsonNode fetchPage(String listId, Instant since, String cursor) {
        StringBuilder uri = new StringBuilder(baseUrl).append("/twitter/list/tweets?listId=")
                .append(URLEncoder.encode(listId, StandardCharsets.UTF_8)).append("&sinceTime=")
                .append(since.getEpochSecond()).append("&includeReplies=false&limit=20");
        if (cursor != null) {
            uri.append("&cursor=").append(URLEncoder.encode(cursor, StandardCharsets.UTF_8));
        }

        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(uri.toString())).timeout(HTTP_TIMEOUT)
                    .header("X-API-Key", apiKey.orElseThrow()).GET().build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ExtractionException("Social API returned status " + response.statusCode());
            }
            JsonNode body = objectMapper.readTree(response.body());
            if (!"success".equals(body.path("status").asText())) {
                throw new ExtractionException("Social API error: " + body.path("message").asText("unknown"));
            }
            return body;
        } catch (ExtractionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted fetching social list " + listId, e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to fetch social list %s", listId);
            throw new ExtractionException("Failed to fetch social list " + listId, e);
        }
    }

    private static SocialPost toPost(JsonNode node) {
        JsonNode author = node.path("author");
        List<String> hashtags = new ArrayList<>();
        node.path("hashTags").forEach(tag -> hashtags.add(tag.asText()));
        List<String> media = new ArrayList<>();
        node.path("media").forEach(m -> {
            String url = m.path("url").asText(null);
            if (url != null) {
                media.add(url);
            }
        });
        return new SocialPost(node.path("id").asText(null), node.path("url").asText(null),
                node.path("text").asText(""), author.path("userName").asText(null), author.path("name").asText(null),
                node.path("viewCount").asLong(0), node.path("likeCount").asLong(0),
                node.path("retweetCount").asLong(0), hashtags, media, parseDate(node.path("createdAt").asText(null)));
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value, TWITTER_DATE).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException again) {
                LOG.debugf("Unparseable post date: %s", value);
                return null;
            }
        }
    }
}
