package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * RSS/Atom feed registry entry, Panache ActiveRecord.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK)</li>
 * <li>{@code name} (TEXT) - provenance label written to {@code content_items.source}; also drives source
 * priority</li>
 * <li>{@code url} (TEXT, UNIQUE) - feed URL</li>
 * <li>{@code summary_source} (TEXT) - {@link SummarySource}</li>
 * <li>{@code content_source} (TEXT) - {@link ContentSource}</li>
 * <li>{@code is_active} (BOOLEAN)</li>
 * <li>{@code last_scraped_at} (TIMESTAMPTZ) - last refresh attempt that parsed the feed</li>
 * <li>{@code error_count} (INT), {@code last_error_message} (TEXT) - consecutive failures</li>
 * </ul>
 */
@Entity
@Table(
        name = "feed_sources")
@NamedQuery(
        name = FeedSource.QUERY_FIND_ACTIVE,
        query = FeedSource.JPQL_FIND_ACTIVE)
public class FeedSource extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(FeedSource.class);

    public static final String JPQL_FIND_ACTIVE = "FROM FeedSource WHERE isActive = true ORDER BY name";
    public static final String QUERY_FIND_ACTIVE = "FeedSource.findActive";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            nullable = false)
    public String name;

    @Column(
            nullable = false,
            unique = true)
    public String url;

    @Column(
            name = "summary_source",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SummarySource summarySource = SummarySource.DESCRIPTION;

    @Column(
            name = "content_source",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ContentSource contentSource = ContentSource.SCRAPE;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            name = "last_scraped_at")
    public Instant lastScrapedAt;

    @Column(
            name = "error_count",
            nullable = false)
    public int errorCount;

    @Column(
            name = "last_error_message")
    public String lastErrorMessage;

    /**
     * Where an item's stored summary comes from.
     */
    public enum SummarySource {
        /**
         * The feed entry's description, with HTML stripped.
         */
        DESCRIPTION,

        /**
         * Left empty for the AI analysis step to write.
         */
        AI
    }

    /**
     * Where an item's stored content comes from.
     */
    public enum ContentSource {
        CONTENT_ENCODED, DESCRIPTION, SCRAPE, SKIP
    }

    public static List<FeedSource> findActive() {
        return find("#" + QUERY_FIND_ACTIVE).list();
    }

    /**
     * Stamps a successful refresh and resets the error counter.
     */
    public static void recordSuccess(UUID sourceId) {
        QuarkusTransaction.requiringNew().run(() -> {
            FeedSource source = findById(sourceId);
            if (source != null) {
                source.lastScrapedAt = Instant.now();
                source.errorCount = 0;
                source.lastErrorMessage = null;
            }
        });
    }

    /**
     * Records a failed refresh.
     */
    public static void recordError(UUID sourceId, String errorMessage) {
        QuarkusTransaction.requiringNew().run(() -> {
            FeedSource source = findById(sourceId);
            if (source != null) {
                source.errorCount++;
                source.lastErrorMessage = errorMessage;
                LOG.warnf("Recorded error for feed %s (%s): %s (error_count=%d)", source.id, source.name,
                        errorMessage, source.errorCount);
            }
        });
    }
}
