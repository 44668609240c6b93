package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Topic entity: a cluster of semantically similar items.
 *
 * <p>
 * Created by {@link villagecompute.newsence.services.TopicClusteringService} with the founding item's title, then
 * mutated by member joins (count, first/last seen) and by headline synthesis (title and description fields). A topic
 * is only ever deleted as the rollback of a failed founding assignment.
 */
@Entity
@Table(
        name = "topics")
public class Topic extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column
    public String title;

    @Column(
            name = "title_localized")
    public String titleLocalized;

    @Column
    public String description;

    @Column(
            name = "description_localized")
    public String descriptionLocalized;

    @Column(
            name = "canonical_item_id")
    public UUID canonicalItemId;

    @Column(
            name = "member_count",
            nullable = false)
    public int memberCount;

    @Column(
            name = "first_seen_at")
    public Instant firstSeenAt;

    @Column(
            name = "last_seen_at")
    public Instant lastSeenAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
