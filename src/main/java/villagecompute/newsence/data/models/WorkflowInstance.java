package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * One run of the enrichment workflow for a single item.
 *
 * <p>
 * The {@code id} is the handle returned to callers of the status endpoint. {@code itemId} and {@code sourceType} are
 * the only trigger parameters; every other input is read from the item row while the workflow runs.
 */
@Entity
@Table(
        name = "workflow_instances")
public class WorkflowInstance extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "item_id",
            nullable = false)
    public UUID itemId;

    @Column(
            name = "source_type",
            nullable = false)
    public String sourceType;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public WorkflowStatus status;

    @Column(
            name = "current_step")
    public String currentStep;

    @Column(
            name = "failure_reason")
    public String failureReason;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    /**
     * Workflow lifecycle statuses.
     */
    public enum WorkflowStatus {
        /**
         * Created and waiting for a worker.
         */
        QUEUED,

        /**
         * A worker is executing steps.
         */
        RUNNING,

        /**
         * Every step completed or was skipped.
         */
        COMPLETE,

        /**
         * A step exhausted its retries.
         */
        ERRORED,

        /**
         * Stopped early on a terminal condition such as the item no longer existing.
         */
        TERMINATED;

        public boolean isFinished() {
            return this == COMPLETE || this == ERRORED || this == TERMINATED;
        }
    }
}
