package villagecompute.newsence.services;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.google.common.collect.Lists;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.observability.PipelineMetrics;
import villagecompute.newsence.queue.ItemProcessMessage;
import villagecompute.newsence.queue.ItemQueue;
import villagecompute.newsence.util.UrlNormalizer;

/**
 * Normalizes, deduplicates and stores the entries of one producer run.
 *
 * <p>
 * <b>Flow:</b>
 * <ol>
 * <li>Normalize every URL; a URL repeated within the batch keeps its first entry.</li>
 * <li>Look up the normalized URLs in chunks of {@code newsence.ingestion.dedup-chunk-size}.</li>
 * <li>Stored URLs are offered a source-priority upgrade ({@link SourcePriority}); nothing is re-queued.</li>
 * <li>New URLs are classified, built by the candidate's draft factory, inserted, and queued as
 * {@code item_process}.</li>
 * </ol>
 *
 * <p>
 * Every entry is isolated: a failure to classify, build, insert or upgrade is logged and counted, and the run
 * continues with the next entry. The existence lookup completes before any insert decision is made.
 */
@ApplicationScoped
public class IngestionService {

    private static final Logger LOG = Logger.getLogger(IngestionService.class);

    @Inject
    ItemStore itemStore;

    @Inject
    ItemQueue itemQueue;

    @Inject
    PlatformMetadataService platformMetadataService;

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "newsence.ingestion.dedup-chunk-size",
            defaultValue = "50")
    int dedupChunkSize;

    /**
     * Ingests one producer batch.
     *
     * @param producer
     *            producer name for logs and metrics ({@code rss}, {@code social})
     * @param sourceLabel
     *            provenance label stored on new items and compared for upgrades
     * @param fallbackType
     *            source type for URLs that are not on a known platform
     * @param candidates
     *            batch entries
     * @return outcome counts
     */
    public IngestionReport ingest(String producer, String sourceLabel, SourceType fallbackType,
            List<IngestionCandidate> candidates) {
        Map<String, IngestionCandidate> byUrl = new LinkedHashMap<>();
        int duplicates = 0;
        int failed = 0;

        for (IngestionCandidate candidate : candidates) {
            String normalized = UrlNormalizer.normalize(candidate.url());
            if (normalized == null || normalized.isBlank()) {
                failed++;
                metrics.recordIngestion(producer, "failed");
                continue;
            }
            if (byUrl.putIfAbsent(normalized, candidate) != null) {
                duplicates++;
                metrics.recordIngestion(producer, "duplicate");
            }
        }

        Map<String, ContentItem> existing = findExisting(new ArrayList<>(byUrl.keySet()));

        int upgraded = 0;
        int inserted = 0;
        List<UUID> insertedIds = new ArrayList<>();
        for (Map.Entry<String, IngestionCandidate> entry : byUrl.entrySet()) {
            String url = entry.getKey();
            IngestionCandidate candidate = entry.getValue();
            ContentItem stored = existing.get(url);

            if (stored != null) {
                if (tryUpgrade(stored, sourceLabel, candidate.discussionUrl())) {
                    upgraded++;
                    metrics.recordIngestion(producer, "upgraded");
                } else {
                    duplicates++;
                    metrics.recordIngestion(producer, "duplicate");
                }
                continue;
            }

            Optional<UUID> id = insertNew(producer, url, candidate, sourceLabel, fallbackType);
            if (id.isPresent()) {
                inserted++;
                insertedIds.add(id.get());
                metrics.recordIngestion(producer, "inserted");
            } else {
                failed++;
                metrics.recordIngestion(producer, "failed");
            }
        }

        IngestionReport report = new IngestionReport(inserted, duplicates, upgraded, failed, insertedIds);
        LOG.infof("Ingested %s batch from %s: inserted=%d, duplicates=%d, upgraded=%d, failed=%d", producer,
                sourceLabel, inserted, duplicates, upgraded, failed);
        return report;
    }

    /**
     * Batch existence check, chunked to bound the size of each {@code IN} clause.
     */
    Map<String, ContentItem> findExisting(List<String> normalizedUrls) {
        Map<String, ContentItem> existing = new HashMap<>();
        for (List<String> chunk : Lists.partition(normalizedUrls, Math.max(dedupChunkSize, 1))) {
            for (ContentItem item : itemStore.findByUrls(chunk)) {
                existing.put(item.url, item);
            }
        }
        return existing;
    }

    /**
     * Re-attributes a stored item when the incoming source outranks it. Richer platform metadata is attached when the
     * entry carries a Hacker News discussion link.
     */
    boolean tryUpgrade(ContentItem stored, String sourceLabel, String discussionUrl) {
        if (!SourcePriority.shouldUpgrade(sourceLabel, stored.source)) {
            return false;
        }
        try {
            Map<String, Object> metadata = platformMetadataService.discussionMetadata(discussionUrl).orElse(null);
            itemStore.updateSource(stored.id, sourceLabel, metadata);
            LOG.infof("Upgraded source of %s from %s to %s", stored.url, stored.source, sourceLabel);
            return true;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to upgrade source of %s", stored.url);
            return false;
        }
    }

    private Optional<UUID> insertNew(String producer, String url, IngestionCandidate candidate, String sourceLabel,
            SourceType fallbackType) {
        ContentItem item;
        try {
            PlatformResolution platform = platformMetadataService.resolve(url, candidate.discussionUrl(),
                    fallbackType);
            item = candidate.draftFactory().create(url, platform);
            item.url = url;
            if (item.sourceType == null) {
                item.sourceType = platform.sourceType().value();
            }
            if (item.source == null) {
                item.source = sourceLabel;
            }
            if (item.platformMetadata == null || item.platformMetadata.isEmpty()) {
                item.platformMetadata = platform.metadata() == null ? new HashMap<>() : platform.metadata();
            }
            itemStore.insert(item);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to ingest %s from %s", url, producer);
            return Optional.empty();
        }

        try {
            itemQueue.send(new ItemProcessMessage(item.id, item.sourceType));
        } catch (RuntimeException e) {
            // Stored rows without localized fields are re-queued by the incomplete-item sweep
            LOG.errorf(e, "Inserted %s but failed to queue it for processing", item.id);
        }
        return Optional.of(item.id);
    }
}
