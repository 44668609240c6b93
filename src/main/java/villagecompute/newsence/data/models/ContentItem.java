package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.Type;
import org.hibernate.type.SqlTypes;
import villagecompute.newsence.util.PgVectorType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Content item entity: one ingested article, post, video or discussion.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - assigned by the application at insert</li>
 * <li>{@code url} (TEXT, UNIQUE) - normalized URL, see {@link villagecompute.newsence.util.UrlNormalizer}</li>
 * <li>{@code source_type} (TEXT) - {@link SourceType#value()}, immutable after insert</li>
 * <li>{@code source} (TEXT) - provenance label (feed name, {@code Twitter}, site name); mutable through
 * source-priority upgrades</li>
 * <li>{@code title} / {@code title_localized}, {@code summary} / {@code summary_localized}, {@code content} /
 * {@code content_localized} (TEXT) - enrichment fields</li>
 * <li>{@code tags}, {@code keywords} (JSONB) - string arrays</li>
 * <li>{@code embedding} (vector(1024)) - L2-normalized embedding, null until generated</li>
 * <li>{@code topic_id} (UUID, FK) - set at most once by topic clustering</li>
 * <li>{@code platform_metadata} (JSONB) - {@code {type, fetchedAt, data, enrichments}}</li>
 * <li>{@code og_image_url} (TEXT), {@code published_at}, {@code ingested_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * Reads and writes go through {@link villagecompute.newsence.data.stores.ItemStore}; the named queries here back the
 * Panache implementation.
 */
@Entity
@Table(
        name = "content_items")
@NamedQuery(
        name = ContentItem.QUERY_FIND_BY_URL,
        query = ContentItem.JPQL_FIND_BY_URL)
@NamedQuery(
        name = ContentItem.QUERY_FIND_BY_URLS,
        query = ContentItem.JPQL_FIND_BY_URLS)
@NamedQuery(
        name = ContentItem.QUERY_FIND_BY_TOPIC,
        query = ContentItem.JPQL_FIND_BY_TOPIC)
@NamedQuery(
        name = ContentItem.QUERY_FIND_INCOMPLETE,
        query = ContentItem.JPQL_FIND_INCOMPLETE)
@NamedQuery(
        name = ContentItem.QUERY_LATEST_INGESTED,
        query = ContentItem.JPQL_LATEST_INGESTED)
@NamedQuery(
        name = ContentItem.QUERY_FIND_SOURCE_TYPES,
        query = ContentItem.JPQL_FIND_SOURCE_TYPES)
@NamedQuery(
        name = ContentItem.QUERY_TOPIC_STATS,
        query = ContentItem.JPQL_TOPIC_STATS)
@NamedQuery(
        name = ContentItem.QUERY_ASSIGN_TOPIC,
        query = ContentItem.JPQL_ASSIGN_TOPIC)
public class ContentItem extends PanacheEntityBase {

    public static final String JPQL_FIND_BY_URL = "FROM ContentItem WHERE url = :url";
    public static final String QUERY_FIND_BY_URL = "ContentItem.findByUrl";

    public static final String JPQL_FIND_BY_URLS = "FROM ContentItem WHERE url IN :urls";
    public static final String QUERY_FIND_BY_URLS = "ContentItem.findByUrls";

    public static final String JPQL_FIND_BY_TOPIC = "FROM ContentItem WHERE topicId = :topicId ORDER BY publishedAt DESC";
    public static final String QUERY_FIND_BY_TOPIC = "ContentItem.findByTopic";

    public static final String JPQL_FIND_INCOMPLETE = "SELECT i.id FROM ContentItem i WHERE i.ingestedAt >= :since AND "
            + "(i.titleLocalized IS NULL OR i.summaryLocalized IS NULL OR i.embedding IS NULL "
            + "OR (i.content IS NOT NULL AND i.contentLocalized IS NULL)) ORDER BY i.ingestedAt DESC";
    public static final String QUERY_FIND_INCOMPLETE = "ContentItem.findIncomplete";

    public static final String JPQL_LATEST_INGESTED = "SELECT MAX(i.ingestedAt) FROM ContentItem i WHERE i.sourceType = :sourceType";
    public static final String QUERY_LATEST_INGESTED = "ContentItem.latestIngested";

    public static final String JPQL_FIND_SOURCE_TYPES = "SELECT i.id, i.sourceType FROM ContentItem i WHERE i.id IN :ids";
    public static final String QUERY_FIND_SOURCE_TYPES = "ContentItem.findSourceTypes";

    public static final String JPQL_TOPIC_STATS = "SELECT COUNT(i), MIN(i.publishedAt), MAX(i.publishedAt) FROM ContentItem i "
            + "WHERE i.topicId = :topicId";
    public static final String QUERY_TOPIC_STATS = "ContentItem.topicStats";

    public static final String JPQL_ASSIGN_TOPIC = "UPDATE ContentItem SET topicId = :topicId WHERE id IN :ids AND topicId IS NULL";
    public static final String QUERY_ASSIGN_TOPIC = "ContentItem.assignTopic";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false,
            unique = true)
    public String url;

    @Column(
            name = "source_type",
            nullable = false,
            updatable = false)
    public String sourceType;

    @Column
    public String source;

    @Column
    public String title;

    @Column(
            name = "title_localized")
    public String titleLocalized;

    @Column
    public String summary;

    @Column(
            name = "summary_localized")
    public String summaryLocalized;

    @Column
    public String content;

    @Column(
            name = "content_localized")
    public String contentLocalized;

    @Column(
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> tags = new ArrayList<>();

    @Column(
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> keywords = new ArrayList<>();

    @Column(
            columnDefinition = "vector(1024)")
    @Type(PgVectorType.class)
    public float[] embedding;

    @Column(
            name = "topic_id")
    public UUID topicId;

    @Column(
            name = "platform_metadata",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> platformMetadata = new HashMap<>();

    @Column(
            name = "og_image_url")
    public String ogImageUrl;

    @Column(
            name = "published_at")
    public Instant publishedAt;

    @Column(
            name = "ingested_at",
            nullable = false)
    public Instant ingestedAt;

    public SourceType sourceTypeEnum() {
        return SourceType.fromValue(sourceType);
    }

    /**
     * Returns the {@code type} discriminator of the platform metadata, or null when none is attached.
     */
    public String platformType() {
        if (platformMetadata == null) {
            return null;
        }
        Object type = platformMetadata.get("type");
        return type == null ? null : type.toString();
    }

    /**
     * Returns the platform-specific {@code data} section of the metadata, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> platformData() {
        if (platformMetadata != null && platformMetadata.get("data") instanceof Map<?, ?> data) {
            return (Map<String, Object>) data;
        }
        return Map.of();
    }
}
