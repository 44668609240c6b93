package villagecompute.newsence.services;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.hackernews.HackerNewsClient;
import villagecompute.newsence.integration.hackernews.HnItem;
import villagecompute.newsence.util.PlatformDetector;

/**
 * Resolves the source type and platform metadata of a URL.
 *
 * <p>
 * Metadata follows the shape {@code {type, fetchedAt, data}}. Hacker News metadata is fetched from the Algolia API
 * (author, points, comment count); YouTube and Twitter metadata carry the ids parsed from the URL. A web URL whose
 * discussion link points at Hacker News is classified as a Hacker News item.
 */
@ApplicationScoped
public class PlatformMetadataService {

    private static final Logger LOG = Logger.getLogger(PlatformMetadataService.class);

    @Inject
    HackerNewsClient hackerNewsClient;

    /**
     * @param url
     *            normalized item URL
     * @param discussionUrl
     *            optional comments link published alongside the item (RSS {@code <comments>})
     * @param fallback
     *            type used when the URL is not on a known platform
     */
    public PlatformResolution resolve(String url, String discussionUrl, SourceType fallback) {
        SourceType platform = PlatformDetector.detect(url);
        switch (platform) {
            case HACKERNEWS:
                return resolveHackerNews(url, fallback);
            case YOUTUBE:
                return new PlatformResolution(SourceType.YOUTUBE,
                        PlatformDetector.extractYoutubeVideoId(url).map(id -> envelope("youtube", Map.of("videoId", id)))
                                .orElse(null));
            case TWITTER:
                return new PlatformResolution(SourceType.TWITTER,
                        PlatformDetector.extractTweetId(url).map(id -> envelope("twitter", Map.of("tweetId", id)))
                                .orElse(null));
            default:
                if (discussionUrl != null && PlatformDetector.isHackerNewsUrl(discussionUrl)) {
                    LOG.debugf("Using Hacker News discussion %s for %s", discussionUrl, url);
                    return resolveHackerNews(discussionUrl, fallback);
                }
                return new PlatformResolution(fallback, null);
        }
    }

    /**
     * Hacker News metadata for a discussion link, used when a feed rediscovers an already stored item.
     *
     * @return metadata of type {@code hackernews}, or empty when the link is not a Hacker News item
     */
    public Optional<Map<String, Object>> discussionMetadata(String discussionUrl) {
        if (discussionUrl == null || !PlatformDetector.isHackerNewsUrl(discussionUrl)) {
            return Optional.empty();
        }
        PlatformResolution resolution = resolveHackerNews(discussionUrl, SourceType.WEB);
        if (resolution.metadata() == null) {
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) resolution.metadata().get("data");
        data.put("storyUrl", discussionUrl);
        return Optional.of(resolution.metadata());
    }

    /**
     * Hacker News metadata for a discussion URL. The item id alone is kept when the API call fails, so the processor
     * can still fetch the thread later.
     */
    private PlatformResolution resolveHackerNews(String discussionUrl, SourceType fallback) {
        Optional<String> itemId = PlatformDetector.extractHackerNewsId(discussionUrl);
        if (itemId.isEmpty()) {
            return new PlatformResolution(fallback, null);
        }

        Map<String, Object> data = new HashMap<>();
        data.put("itemId", itemId.get());
        try {
            Optional<HnItem> item = hackerNewsClient.fetchItem(itemId.get());
            item.ifPresent(hn -> {
                data.put("author", hn.author() == null ? "" : hn.author());
                data.put("points", hn.points() == null ? 0 : hn.points());
                data.put("commentCount", HackerNewsClient.collectComments(hn.children()).size());
                data.put("itemType", hn.type() == null ? "story" : hn.type());
            });
        } catch (ExtractionException e) {
            LOG.warnf("Hacker News metadata unavailable for item %s: %s", itemId.get(), e.getMessage());
        }
        return new PlatformResolution(SourceType.HACKERNEWS, envelope("hackernews", data));
    }

    static Map<String, Object> envelope(String type, Map<String, Object> data) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("type", type);
        metadata.put("fetchedAt", Instant.now().toString());
        metadata.put("data", new HashMap<>(data));
        return metadata;
    }
}
