package villagecompute.newsence.data.stores;

import villagecompute.newsence.data.models.ContentItem;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam for content items.
 *
 * <p>
 * Every mutation is a field-level partial update of a single row, except {@link #assignTopic(Collection, UUID)} which
 * updates a set of rows in one statement.
 */
public interface ItemStore {

    Optional<ContentItem> findById(UUID id);

    Optional<ContentItem> findByUrl(String normalizedUrl);

    /**
     * Returns the stored items whose normalized URL is in {@code normalizedUrls}. Callers bound the collection size.
     */
    List<ContentItem> findByUrls(Collection<String> normalizedUrls);

    /**
     * Inserts a new item. Assigns {@code id} and {@code ingestedAt} when absent.
     *
     * @throws villagecompute.newsence.exceptions.DatastoreException
     *             on constraint violation or write failure
     */
    ContentItem insert(ContentItem item);

    /**
     * Merges the non-null fields of {@code update} into the row.
     */
    void updateFields(UUID id, ItemUpdate update);

    /**
     * Replaces the platform metadata column.
     */
    void updatePlatformMetadata(UUID id, Map<String, Object> platformMetadata);

    /**
     * Re-attributes an item to a new source label, optionally attaching richer platform metadata.
     */
    void updateSource(UUID id, String source, Map<String, Object> platformMetadata);

    void saveEmbedding(UUID id, float[] embedding);

    /**
     * Nearest neighbours by cosine similarity.
     *
     * @param excludeId
     *            item to leave out (the query item itself)
     * @param embedding
     *            query vector
     * @param threshold
     *            minimum cosine similarity, inclusive
     * @param publishedSince
     *            lower bound on candidate {@code publishedAt}
     * @param limit
     *            max candidates
     * @return candidates ordered by descending similarity
     */
    List<SimilarItem> findSimilar(UUID excludeId, float[] embedding, double threshold, Instant publishedSince,
            int limit);

    /**
     * Sets {@code topicId} on every listed item that has no topic yet, in one update. Items already carrying a topic
     * keep it.
     *
     * @return rows updated
     */
    int assignTopic(Collection<UUID> itemIds, UUID topicId);

    TopicStats computeTopicStats(UUID topicId);

    /**
     * Topic members ordered by {@code publishedAt} descending.
     */
    List<ContentItem> findByTopic(UUID topicId, int limit);

    /**
     * Maps item ids to their stored source type; ids that do not exist are absent from the result.
     */
    Map<UUID, String> findSourceTypes(Collection<UUID> itemIds);

    /**
     * Ids of items ingested since {@code since} that lack a localized title, localized summary or embedding, or that
     * have content without localized content.
     */
    List<UUID> findIncompleteIds(Instant since);

    Optional<Instant> latestIngestedAt(String sourceType);
}
