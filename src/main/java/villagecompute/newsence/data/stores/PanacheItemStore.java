package villagecompute.newsence.data.stores;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.util.PgVectorType;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * PostgreSQL implementation of {@link ItemStore} on Panache entities.
 *
 * <p>
 * Writes run in their own transaction ({@code QuarkusTransaction.requiringNew()}) so that each partial update commits
 * before the caller moves on. Similarity search is a native pgvector query using the cosine distance operator
 * {@code <=>}.
 */
@ApplicationScoped
public class PanacheItemStore implements ItemStore {

    private static final Logger LOG = Logger.getLogger(PanacheItemStore.class);

    private static final String SQL_FIND_SIMILAR = """
            SELECT id, topic_id, 1 - (embedding <=> CAST(:vec AS vector)) AS similarity
            FROM content_items
            WHERE id <> :excludeId
              AND embedding IS NOT NULL
              AND published_at >= :since
              AND 1 - (embedding <=> CAST(:vec AS vector)) >= :threshold
            ORDER BY embedding <=> CAST(:vec AS vector)
            LIMIT :limit
            """;

    @Override
    @Transactional
    public Optional<ContentItem> findById(UUID id) {
        return ContentItem.findByIdOptional(id);
    }

    @Override
    @Transactional
    public Optional<ContentItem> findByUrl(String normalizedUrl) {
        return ContentItem.find("#" + ContentItem.QUERY_FIND_BY_URL, Parameters.with("url", normalizedUrl))
                .firstResultOptional();
    }

    @Override
    @Transactional
    public List<ContentItem> findByUrls(Collection<String> normalizedUrls) {
        if (normalizedUrls.isEmpty()) {
            return List.of();
        }
        return ContentItem.find("#" + ContentItem.QUERY_FIND_BY_URLS, Parameters.with("urls", normalizedUrls))
                .list();
    }

    @Override
    public ContentItem insert(ContentItem item) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                if (item.id == null) {
                    item.id = UUID.randomUUID();
                }
                if (item.ingestedAt == null) {
                    item.ingestedAt = Instant.now();
                }
                item.persist();
            });
        } catch (RuntimeException e) {
            throw new DatastoreException("Failed to insert item " + item.url, e);
        }
        return item;
    }

    @Override
    public void updateFields(UUID id, ItemUpdate update) {
        if (update == null || update.isEmpty()) {
            return;
        }
        mutate(id, item -> {
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
        });
    }

    @Override
    public void updatePlatformMetadata(UUID id, Map<String, Object> platformMetadata) {
        mutate(id, item -> item.platformMetadata = new HashMap<>(platformMetadata));
    }

    @Override
    public void updateSource(UUID id, String source, Map<String, Object> platformMetadata) {
        mutate(id, item -> {
            item.source = source;
            if (platformMetadata != null) {
                item.platformMetadata = new HashMap<>(platformMetadata);
            }
        });
    }

    @Override
    public void saveEmbedding(UUID id, float[] embedding) {
        mutate(id, item -> item.embedding = embedding);
    }

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public List<SimilarItem> findSimilar(UUID excludeId, float[] embedding, double threshold, Instant publishedSince,
            int limit) {
        Query query = ContentItem.getEntityManager().createNativeQuery(SQL_FIND_SIMILAR);
        query.setParameter("vec", PgVectorType.toLiteral(embedding));
        query.setParameter("excludeId", excludeId);
        query.setParameter("since", Timestamp.from(publishedSince));
        query.setParameter("threshold", threshold);
        query.setParameter("limit", limit);

        List<Object[]> rows = query.getResultList();
        List<SimilarItem> results = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            results.add(new SimilarItem(toUuid(row[0]), toUuid(row[1]), ((Number) row[2]).doubleValue()));
        }
        return results;
    }

    @Override
    public int assignTopic(Collection<UUID> itemIds, UUID topicId) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> ContentItem.update(
                    "#" + ContentItem.QUERY_ASSIGN_TOPIC, Parameters.with("topicId", topicId).and("ids", itemIds)));
        } catch (RuntimeException e) {
            throw new DatastoreException("Failed to assign topic " + topicId + " to " + itemIds.size() + " items", e);
        }
    }

    @Override
    @Transactional
    public TopicStats computeTopicStats(UUID topicId) {
        Object[] row = (Object[]) ContentItem.getEntityManager().createNamedQuery(ContentItem.QUERY_TOPIC_STATS)
                .setParameter("topicId", topicId).getSingleResult();
        int count = ((Number) row[0]).intValue();
        return new TopicStats(count, toInstant(row[1]), toInstant(row[2]));
    }

    @Override
    @Transactional
    public List<ContentItem> findByTopic(UUID topicId, int limit) {
        return ContentItem.find("#" + ContentItem.QUERY_FIND_BY_TOPIC, Parameters.with("topicId", topicId))
                .page(0, limit).list();
    }

    @Override
    @Transactional
    public Map<UUID, String> findSourceTypes(Collection<UUID> itemIds) {
        if (itemIds.isEmpty()) {
            return Map.of();
        }
        List<?> rows = ContentItem.getEntityManager().createNamedQuery(ContentItem.QUERY_FIND_SOURCE_TYPES)
                .setParameter("ids", itemIds).getResultList();
        Map<UUID, String> result = new HashMap<>();
        for (Object row : rows) {
            Object[] columns = (Object[]) row;
            result.put((UUID) columns[0], (String) columns[1]);
        }
        return result;
    }

    @Override
    @Transactional
    public List<UUID> findIncompleteIds(Instant since) {
        return ContentItem.getEntityManager().createNamedQuery(ContentItem.QUERY_FIND_INCOMPLETE, UUID.class)
                .setParameter("since", since).getResultList();
    }

    @Override
    @Transactional
    public Optional<Instant> latestIngestedAt(String sourceType) {
        Instant latest = ContentItem.getEntityManager()
                .createNamedQuery(ContentItem.QUERY_LATEST_INGESTED, Instant.class)
                .setParameter("sourceType", sourceType).getSingleResult();
        return Optional.ofNullable(latest);
    }

    private void mutate(UUID id, Consumer<ContentItem> change) {
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                ContentItem item = ContentItem.findById(id);
                if (item == null) {
                    throw new ResourceNotFoundException("Item not found: " + id);
                }
                change.accept(item);
            });
        } catch (ResourceNotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to update item %s", id);
            throw new DatastoreException("Failed to update item " + id, e);
        }
    }

    private static UUID toUuid(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof UUID uuid ? uuid : UUID.fromString(value.toString());
    }

    private static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        throw new IllegalStateException("Unexpected timestamp type: " + value.getClass());
    }
}
