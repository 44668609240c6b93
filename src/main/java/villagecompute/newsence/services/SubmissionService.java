package villagecompute.newsence.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.exceptions.RateLimitException;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.queue.ItemProcessMessage;
import villagecompute.newsence.queue.ItemQueue;
import villagecompute.newsence.services.AdmissionControlService.AdmissionResult;
import villagecompute.newsence.util.HtmlText;
import villagecompute.newsence.util.PlatformDetector;
import villagecompute.newsence.util.UrlNormalizer;

/**
 * Manual URL submission: admission control, then per-URL store-and-queue without waiting for enrichment.
 *
 * <p>
 * A batch of N URLs is charged as one admission of cost N, so it is accepted or rejected as a whole. Each URL is then
 * handled on its own:
 * <ul>
 * <li>already stored: reported with {@code alreadyExists}; re-queued when it has no localized title yet</li>
 * <li>page cannot be fetched: reported with the extraction error</li>
 * <li>content shorter than {@value #MIN_CONTENT_LENGTH} characters (YouTube and Twitter exempt): {@code Content too
 * short}</li>
 * <li>otherwise inserted and queued as {@code item_process}</li>
 * </ul>
 * URLs that normalize to one already handled in the same request reuse that outcome, so a new item is queued once.
 */
@ApplicationScoped
public class SubmissionService {

    private static final Logger LOG = Logger.getLogger(SubmissionService.class);

    static final int MIN_CONTENT_LENGTH = 50;

    static final String DEFAULT_SOURCE = "External";

    @Inject
    ItemStore itemStore;

    @Inject
    ItemQueue itemQueue;

    @Inject
    ContentExtractor contentExtractor;

    @Inject
    AdmissionControlService admissionControl;

    @ConfigProperty(
            name = "newsence.submit.max-batch-size",
            defaultValue = "20")
    int maxBatchSize;

    @ConfigProperty(
            name = "newsence.submit.rate-limit.max",
            defaultValue = "20")
    int rateLimitMax;

    @ConfigProperty(
            name = "newsence.submit.rate-limit.window-seconds",
            defaultValue = "60")
    int rateLimitWindowSeconds;

    Clock clock = Clock.systemUTC();

    public int maxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Admits and processes a batch of URLs.
     *
     * @param urls
     *            raw URLs, at most {@link #maxBatchSize()}
     * @param userId
     *            optional caller id, used for the admission bucket
     * @param clientIp
     *            caller address, used for the admission bucket when there is no user id
     * @return one result per URL, in request order
     * @throws ValidationException
     *             if the batch is empty or larger than the cap
     * @throws RateLimitException
     *             if admission is denied; nothing is processed
     */
    public List<SubmissionResult> submit(List<String> urls, String userId, String clientIp) {
        if (urls == null || urls.isEmpty()) {
            throw new ValidationException("Missing url or urls field");
        }
        if (urls.size() > maxBatchSize) {
            throw new ValidationException(
                    String.format("Maximum %d URLs per request, got %d", maxBatchSize, urls.size()));
        }

        String bucket = AdmissionControlService.bucketKey(userId, clientIp);
        AdmissionResult admission = admissionControl.hit(bucket, rateLimitMax, rateLimitWindowSeconds, urls.size());
        if (!admission.admitted()) {
            throw new RateLimitException(
                    String.format("Too many submit requests. Retry in %ds", admission.retryAfterSeconds()),
                    admission.retryAfterSeconds());
        }

        List<SubmissionResult> results = new ArrayList<>(urls.size());
        Map<String, SubmissionResult> handled = new HashMap<>();
        for (String url : urls) {
            String normalized = UrlNormalizer.normalize(url);
            SubmissionResult earlier = HtmlText.isBlank(normalized) ? null : handled.get(normalized);
            if (earlier != null) {
                results.add(earlier.itemId() == null ? earlier
                        : SubmissionResult.existing(normalized, earlier.itemId(), earlier.title()));
                continue;
            }
            SubmissionResult result = submitOne(url);
            if (!HtmlText.isBlank(normalized)) {
                handled.put(normalized, result);
            }
            results.add(result);
        }
        LOG.infof("Processed submission of %d URLs for bucket %s", urls.size(), bucket);
        return results;
    }

    SubmissionResult submitOne(String rawUrl) {
        String url = UrlNormalizer.normalize(rawUrl);
        if (HtmlText.isBlank(url)) {
            return SubmissionResult.failed(rawUrl, "Invalid URL");
        }

        Optional<ContentItem> existing;
        try {
            existing = itemStore.findByUrl(url);
        } catch (DatastoreException e) {
            LOG.errorf(e, "Lookup failed for submitted URL %s", url);
            return SubmissionResult.failed(url, "Lookup failed");
        }
        if (existing.isPresent()) {
            ContentItem item = existing.get();
            if (HtmlText.isBlank(item.titleLocalized)) {
                LOG.infof("Re-queuing unprocessed item %s", item.id);
                enqueue(item);
            }
            return SubmissionResult.existing(url, item.id, item.title);
        }

        SourceType platform = PlatformDetector.detect(url);
        ExtractedContent extracted;
        try {
            extracted = contentExtractor.extract(url);
        } catch (ExtractionException e) {
            LOG.warnf("Scrape failed for submitted URL %s: %s", url, e.getMessage());
            return SubmissionResult.failed(url, "Scrape failed: " + e.getMessage());
        }

        boolean skipContentCheck = platform == SourceType.YOUTUBE || platform == SourceType.TWITTER;
        if (!skipContentCheck && extracted.contentLength() < MIN_CONTENT_LENGTH) {
            return SubmissionResult.failed(url, "Content too short");
        }

        ContentItem item = draftFrom(url, platform, extracted);
        try {
            itemStore.insert(item);
        } catch (DatastoreException e) {
            LOG.errorf(e, "Insert failed for submitted URL %s", url);
            return SubmissionResult.failed(url, "Failed to store item");
        }
        enqueue(item);
        LOG.infof("Stored submitted item %s (%s): %s", item.id, item.sourceType, url);
        return SubmissionResult.stored(url, item.id, item.title);
    }

    private ContentItem draftFrom(String url, SourceType platform, ExtractedContent extracted) {
        ContentItem item = new ContentItem();
        item.url = url;
        item.sourceType = platform.value();
        item.title = HtmlText.isBlank(extracted.title()) ? url : extracted.title();
        item.source = HtmlText.isBlank(extracted.siteName()) ? DEFAULT_SOURCE : extracted.siteName();
        item.summary = extracted.summary();
        item.content = HtmlText.isBlank(extracted.content()) ? null : extracted.content();
        item.ogImageUrl = extracted.ogImageUrl();
        item.publishedAt = extracted.publishedAt() != null ? extracted.publishedAt() : clock.instant();
        item.platformMetadata = extracted.platformMetadata() == null ? new HashMap<>()
                : new HashMap<>(extracted.platformMetadata());
        return item;
    }

    private void enqueue(ContentItem item) {
        try {
            itemQueue.send(new ItemProcessMessage(item.id, item.sourceType));
        } catch (RuntimeException e) {
            // The incomplete-item sweep picks the row up later
            LOG.errorf(e, "Failed to queue item %s", item.id);
        }
    }
}
