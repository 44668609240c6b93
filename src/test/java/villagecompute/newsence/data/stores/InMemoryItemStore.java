package villagecompute.newsence.data.stores;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.util.VectorMath;

/**
 * Map-backed {@link ItemStore} for unit tests. Similarity search computes real cosine similarity.
 */
public class InMemoryItemStore implements ItemStore {

    public final Map<UUID, ContentItem> items = new LinkedHashMap<>();

    /** When set, {@link #assignTopic} throws. */
    public boolean failAssignTopic;

    /** When set, {@link #insert} throws. */
    public boolean failInsert;

    public int updateFieldsCalls;

    public ContentItem put(ContentItem item) {
        if (item.id == null) {
            item.id = UUID.randomUUID();
        }
        items.put(item.id, item);
        return item;
    }

    @Override
    public Optional<ContentItem> findById(UUID id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public Optional<ContentItem> findByUrl(String normalizedUrl) {
        return items.values().stream().filter(i -> normalizedUrl.equals(i.url)).findFirst();
    }

    @Override
    public List<ContentItem> findByUrls(Collection<String> normalizedUrls) {
        return items.values().stream().filter(i -> normalizedUrls.contains(i.url)).toList();
    }

    @Override
    public ContentItem insert(ContentItem item) {
        if (failInsert) {
            throw new DatastoreException("insert failed");
        }
        if (findByUrl(item.url).isPresent()) {
            throw new DatastoreException("duplicate url " + item.url);
        }
        if (item.ingestedAt == null) {
            item.ingestedAt = Instant.now();
        }
        return put(item);
    }

    @Override
    public void updateFields(UUID id, ItemUpdate update) {
        updateFieldsCalls++;
        ContentItem item = require(id);
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
            item.tags = new ArrayList<>(update.tags());
        }
        if (update.keywords() != null) {
            item.keywords = new ArrayList<>(update.keywords());
        }
    }

    @Override
    public void updatePlatformMetadata(UUID id, Map<String, Object> platformMetadata) {
        require(id).platformMetadata = new HashMap<>(platformMetadata);
    }

    @Override
    public void updateSource(UUID id, String source, Map<String, Object> platformMetadata) {
        ContentItem item = require(id);
        item.source = source;
        if (platformMetadata != null) {
            item.platformMetadata = new HashMap<>(platformMetadata);
        }
    }

    @Override
    public void saveEmbedding(UUID id, float[] embedding) {
        require(id).embedding = embedding;
    }

    @Override
    public List<SimilarItem> findSimilar(UUID excludeId, float[] embedding, double threshold, Instant publishedSince,
            int limit) {
        List<SimilarItem> result = new ArrayList<>();
        for (ContentItem item : items.values()) {
            if (item.id.equals(excludeId) || item.embedding == null || item.publishedAt == null
                    || item.publishedAt.isBefore(publishedSince)) {
                continue;
            }
            double similarity = VectorMath.cosineSimilarity(embedding, item.embedding);
            if (similarity >= threshold) {
                result.add(new SimilarItem(item.id, item.topicId, similarity));
            }
        }
        result.sort(Comparator.comparingDouble(SimilarItem::similarity).reversed());
        return result.size() > limit ? result.subList(0, limit) : result;
    }

    @Override
    public int assignTopic(Collection<UUID> itemIds, UUID topicId) {
        if (failAssignTopic) {
            throw new DatastoreException("assign failed");
        }
        int updated = 0;
        for (UUID id : itemIds) {
            ContentItem item = items.get(id);
            if (item != null && item.topicId == null) {
                item.topicId = topicId;
                updated++;
            }
        }
        return updated;
    }

    @Override
    public TopicStats computeTopicStats(UUID topicId) {
        List<ContentItem> members = items.values().stream().filter(i -> topicId.equals(i.topicId)).toList();
        Instant first = members.stream().map(i -> i.publishedAt).filter(p -> p != null).min(Comparator.naturalOrder())
                .orElse(null);
        Instant last = members.stream().map(i -> i.publishedAt).filter(p -> p != null).max(Comparator.naturalOrder())
                .orElse(null);
        return new TopicStats(members.size(), first, last);
    }

    @Override
    public List<ContentItem> findByTopic(UUID topicId, int limit) {
        return items.values().stream().filter(i -> topicId.equals(i.topicId))
                .sorted(Comparator.comparing((ContentItem i) -> i.publishedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(limit).toList();
    }

    @Override
    public Map<UUID, String> findSourceTypes(Collection<UUID> itemIds) {
        Map<UUID, String> result = new HashMap<>();
        for (UUID id : itemIds) {
            ContentItem item = items.get(id);
            if (item != null) {
                result.put(id, item.sourceType);
            }
        }
        return result;
    }

    @Override
    public List<UUID> findIncompleteIds(Instant since) {
        return items.values().stream().filter(i -> i.ingestedAt != null && !i.ingestedAt.isBefore(since))
                .filter(i -> i.titleLocalized == null || i.summaryLocalized == null || i.embedding == null
                        || (i.content != null && i.contentLocalized == null))
                .map(i -> i.id).toList();
    }

    @Override
    public Optional<Instant> latestIngestedAt(String sourceType) {
        return items.values().stream().filter(i -> sourceType.equals(i.sourceType)).map(i -> i.ingestedAt)
                .filter(t -> t != null).max(Comparator.naturalOrder());
    }

    private ContentItem require(UUID id) {
        ContentItem item = items.get(id);
        if (item == null) {
            throw new ResourceNotFoundException("Item not found: " + id);
        }
        return item;
    }
}
