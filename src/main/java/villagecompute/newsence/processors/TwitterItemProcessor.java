package villagecompute.newsence.processors;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.services.AnalysisInput;
import villagecompute.newsence.services.ContentAnalysisService;
import villagecompute.newsence.services.TweetTranslation;

/**
 * Enrichment of social posts.
 *
 * <p>
 * Three paths, first match wins:
 * <ol>
 * <li>Long-form post (content over 200 characters): full article analysis.</li>
 * <li>Link share (text without URLs is at most 50 characters and the first link is off-platform): the linked page is
 * extracted and, when it has more than 100 characters of content, stored as content and analysed.</li>
 * <li>Regular post: direct translation with tags and keywords.</li>
 * </ol>
 */
@ApplicationScoped
public class TwitterItemProcessor implements ItemProcessor {

    private static final Logger LOG = Logger.getLogger(TwitterItemProcessor.class);

    static final int FULL_CONTENT_THRESHOLD = 200;
    static final int LINK_SHARE_MAX_TEXT = 50;
    static final int LINKED_CONTENT_MIN = 100;

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern SOCIAL_HOST = Pattern.compile("(?:twitter\\.com|x\\.com)");

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    ContentExtractor contentExtractor;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public SourceType sourceType() {
        return SourceType.TWITTER;
    }

    @Override
    public ProcessorResult process(ContentItem item) {
        ItemUpdate.Builder update = ItemUpdate.builder();

        if (item.content != null && item.content.length() > FULL_CONTENT_THRESHOLD && !isPostPayload(item.content)) {
            LOG.debugf("Processing long-form post %s", item.id);
            AnalysisFill.apply(item, analysisService.analyze(AnalysisInput.from(item)), update);
            return ProcessorResult.of(update.build());
        }

        String postText = postText(item);
        if (AnalysisFill.isBlank(item.summary)) {
            update.summary(postText);
        }

        String linkedUrl = extractLinkedUrl(postText);
        if (linkedUrl != null) {
            try {
                ExtractedContent linked = contentExtractor.extract(linkedUrl);
                if (linked.contentLength() > LINKED_CONTENT_MIN) {
                    LOG.debugf("Post %s links to \"%s\", analysing the linked page", item.id, linked.title());
                    update.content(linked.content());
                    AnalysisInput input = AnalysisInput.from(item).withArticle(
                            linked.title() != null ? linked.title() : item.title, linked.content(), linked.summary());
                    AnalysisFill.apply(item, analysisService.analyze(input), update);
                    return ProcessorResult.of(update.build());
                }
            } catch (ExtractionException e) {
                LOG.warnf("Failed to extract linked URL %s of post %s: %s", linkedUrl, item.id, e.getMessage());
            }
        }

        TweetTranslation translation = analysisService.translateTweet(postText);
        if (AnalysisFill.isBlank(item.summaryLocalized)) {
            update.summaryLocalized(translation.summaryLocalized());
        }
        if (item.tags == null || item.tags.isEmpty()) {
            update.tags(translation.tags());
        }
        if (item.keywords == null || item.keywords.isEmpty()) {
            update.keywords(translation.keywords());
        }
        return ProcessorResult.of(update.build());
    }

    /**
     * Post text: the stored summary, else the {@code text} field of a JSON post payload, else the raw content.
     */
    String postText(ContentItem item) {
        if (!AnalysisFill.isBlank(item.summary)) {
            return item.summary.trim();
        }
        if (item.content == null) {
            return "";
        }
        JsonNode payload = readPayload(item.content);
        if (payload != null && payload.path("text").isTextual()) {
            return payload.path("text").asText();
        }
        return item.content;
    }

    /**
     * The first URL of a link-share post, or null when the post has its own text or only links back to the platform.
     */
    static String extractLinkedUrl(String text) {
        if (text == null) {
            return null;
        }
        String withoutUrls = URL.matcher(text).replaceAll("").trim();
        if (withoutUrls.length() > LINK_SHARE_MAX_TEXT) {
            return null;
        }
        Matcher matcher = URL.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String url = matcher.group();
        return SOCIAL_HOST.matcher(url).find() ? null : url;
    }

    private boolean isPostPayload(String content) {
        JsonNode payload = readPayload(content);
        return payload != null && payload.has("text");
    }

    private JsonNode readPayload(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            LOG.debugf("Post content is not a JSON payload: %s", e.getOriginalMessage());
            return null;
        }
    }
}
