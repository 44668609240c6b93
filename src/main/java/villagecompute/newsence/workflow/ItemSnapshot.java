package villagecompute.newsence.workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.stores.ItemUpdate;

/**
 * The item as read by the {@code fetch-item} step. Checkpointed, so replays of later steps see the same input the
 * first run saw.
 */
public record ItemSnapshot(UUID id, String url, String sourceType, String source, String title, String titleLocalized,
        String summary, String summaryLocalized, String content, String contentLocalized, List<String> tags,
        List<String> keywords, Map<String, Object> platformMetadata, String ogImageUrl, Instant publishedAt,
        Instant ingestedAt) {

    public static ItemSnapshot from(ContentItem item) {
        return new ItemSnapshot(item.id, item.url, item.sourceType, item.source, item.title, item.titleLocalized,
                item.summary, item.summaryLocalized, item.content, item.contentLocalized, copy(item.tags),
                copy(item.keywords), item.platformMetadata == null ? null : new HashMap<>(item.platformMetadata),
                item.ogImageUrl, item.publishedAt, item.ingestedAt);
    }

    /**
     * Detached item carrying the snapshot fields, for processors and text builders. Never persisted.
     */
    public ContentItem toItem() {
        ContentItem item = new ContentItem();
        item.id = id;
        item.url = url;
        item.sourceType = sourceType;
        item.source = source;
        item.title = title;
        item.titleLocalized = titleLocalized;
        item.summary = summary;
        item.summaryLocalized = summaryLocalized;
        item.content = content;
        item.contentLocalized = contentLocalized;
        item.tags = copy(tags);
        item.keywords = copy(keywords);
        item.platformMetadata = platformMetadata == null ? new HashMap<>() : new HashMap<>(platformMetadata);
        item.ogImageUrl = ogImageUrl;
        item.publishedAt = publishedAt;
        item.ingestedAt = ingestedAt;
        return item;
    }

    /**
     * Detached item with the non-null fields of {@code update} applied, i.e. the row as it is after update-store.
     */
    public ContentItem merged(ItemUpdate update) {
        ContentItem item = toItem();
        if (update.title() != null) {
            item.title = update.title();
        }
        if (update.titleLocalized() != null) {
            item.titleLocalized = update.titleLocalized();
        }
        if (update.summary() != null) {
            item.summary = update.summary();
        }
        if (update.summaryLocalized() != null) {
            item.summaryLocalized = update.summaryLocalized();
        }
        if (update.content() != null) {
            item.content = update.content();
        }
        if (update.contentLocalized() != null) {
            item.contentLocalized = update.contentLocalized();
        }
        if (update.tags() != null) {
            item.tags = copy(update.tags());
        }
        if (update.keywords() != null) {
            item.keywords = copy(update.keywords());
        }
        return item;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
