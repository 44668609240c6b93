package villagecompute.newsence.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.social.SocialPost;
import villagecompute.newsence.integration.social.SocialPostClient;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.services.IngestionCandidate;
import villagecompute.newsence.services.IngestionReport;
import villagecompute.newsence.services.IngestionService;

/**
 * Polls the configured social lists and ingests posts whose view count exceeds
 * {@code newsence.social.view-threshold}.
 *
 * <p>
 * The poll window starts one hour before the newest stored {@code twitter} item, or 24 hours back when none exists.
 * Overlapping windows are harmless because ingestion deduplicates by URL. Each list is polled independently; a failing
 * list is logged and the others continue.
 */
@ApplicationScoped
public class SocialFeedRefreshJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(SocialFeedRefreshJobHandler.class);

    static final String PRODUCER = "social";

    static final String SOURCE_LABEL = "Twitter";

    static final Duration WINDOW_OVERLAP = Duration.ofHours(1);

    static final Duration INITIAL_WINDOW = Duration.ofHours(24);

    static final int TITLE_TEXT_LENGTH = 100;

    @Inject
    SocialPostClient socialPostClient;

    @Inject
    ItemStore itemStore;

    @Inject
    IngestionService ingestionService;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "newsence.social.lists")
    Optional<List<String>> lists;

    @ConfigProperty(
            name = "newsence.social.view-threshold",
            defaultValue = "10000")
    long viewThreshold;

    Clock clock = Clock.systemUTC();

    @Override
    public JobType handlesType() {
        return JobType.SOCIAL_FEED_REFRESH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        List<String> listIds = lists.orElse(List.of());
        if (!socialPostClient.isConfigured() || listIds.isEmpty()) {
            LOG.debugf("Social polling not configured, skipping job %d", jobId);
            return;
        }

        Span span = tracer.spanBuilder("job.social_feed_refresh").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.SOCIAL_FEED_REFRESH.name())
                .setAttribute("lists_count", listIds.size()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);

            Instant since = pollWindowStart();
            span.setAttribute("since", since.toString());

            int inserted = 0;
            for (String listId : listIds) {
                try {
                    inserted += refreshList(listId, since).inserted();
                } catch (ExtractionException e) {
                    span.recordException(e);
                    LOG.errorf(e, "Failed to poll social list %s", listId);
                }
            }
            span.setAttribute("items_new", inserted);
            LOG.infof("Social refresh job %d completed: %d new posts from %d lists", jobId, inserted, listIds.size());
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    Instant pollWindowStart() {
        return itemStore.latestIngestedAt(SourceType.TWITTER.value()).map(latest -> latest.minus(WINDOW_OVERLAP))
                .orElseGet(() -> clock.instant().minus(INITIAL_WINDOW));
    }

    IngestionReport refreshList(String listId, Instant since) {
        List<SocialPost> posts = socialPostClient.listPosts(listId, since);
        List<IngestionCandidate> candidates = new ArrayList<>();
        for (SocialPost post : posts) {
            if (post.viewCount() <= viewThreshold || post.url() == null) {
                continue;
            }
            candidates.add(new IngestionCandidate(post.url(), null, (url, platform) -> draftFor(post, listId)));
        }
        LOG.debugf("List %s: %d posts, %d above %d views", listId, posts.size(), candidates.size(), viewThreshold);
        return ingestionService.ingest(PRODUCER, SOURCE_LABEL, SourceType.TWITTER, candidates);
    }

    ContentItem draftFor(SocialPost post, String listId) {
        String text = post.text() == null ? "" : post.text();
        ContentItem item = new ContentItem();
        item.sourceType = SourceType.TWITTER.value();
        item.title = "@" + post.authorHandle() + ": "
                + (text.length() > TITLE_TEXT_LENGTH ? text.substring(0, TITLE_TEXT_LENGTH) + "..." : text);
        item.summary = text;
        item.content = payloadJson(post, listId);
        item.keywords = post.hashtags() == null ? new ArrayList<>() : new ArrayList<>(post.hashtags());
        item.ogImageUrl = post.mediaUrls() == null || post.mediaUrls().isEmpty() ? null : post.mediaUrls().get(0);
        item.publishedAt = post.createdAt() != null ? post.createdAt() : clock.instant();
        return item;
    }

    /**
     * Structured post payload stored as the item's content. The processor reads its {@code text} field.
     */
    private String payloadJson(SocialPost post, String listId) {
        Map<String, Object> author = new LinkedHashMap<>();
        author.put("userName", post.authorHandle());
        author.put("name", post.authorName());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("viewCount", post.viewCount());
        metrics.put("likeCount", post.likeCount());
        metrics.put("retweetCount", post.repostCount());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("listId", listId);
        metadata.put("hashtags", post.hashtags() == null ? List.of() : post.hashtags());
        metadata.put("mediaUrls", post.mediaUrls() == null ? List.of() : post.mediaUrls());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", post.text());
        payload.put("author", author);
        payload.put("metrics", metrics);
        payload.put("metadata", metadata);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Failed to serialize post %s, storing text only", post.id());
            return post.text();
        }
    }
}
