package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted completion record of one workflow step, keyed by {@code (instance_id, step_name)}.
 *
 * <p>
 * The step result is stored as {@code {"value": ...}} so that scalar, null and structured results share one column. A
 * {@link CheckpointStatus#DONE} row is authoritative: replays return its result instead of running the step again.
 */
@Entity
@Table(
        name = "workflow_checkpoints",
        uniqueConstraints = @UniqueConstraint(
                columnNames = {"instance_id", "step_name"}))
@NamedQuery(
        name = WorkflowCheckpoint.QUERY_FIND_BY_STEP,
        query = WorkflowCheckpoint.JPQL_FIND_BY_STEP)
@NamedQuery(
        name = WorkflowCheckpoint.QUERY_FIND_BY_INSTANCE,
        query = WorkflowCheckpoint.JPQL_FIND_BY_INSTANCE)
public class WorkflowCheckpoint extends PanacheEntityBase {

    public static final String JPQL_FIND_BY_STEP = "FROM WorkflowCheckpoint WHERE instanceId = :instanceId AND stepName = :stepName";
    public static final String QUERY_FIND_BY_STEP = "WorkflowCheckpoint.findByStep";

    public static final String JPQL_FIND_BY_INSTANCE = "FROM WorkflowCheckpoint WHERE instanceId = :instanceId ORDER BY id";
    public static final String QUERY_FIND_BY_INSTANCE = "WorkflowCheckpoint.findByInstance";

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "instance_id",
            nullable = false)
    public UUID instanceId;

    @Column(
            name = "step_name",
            nullable = false)
    public String stepName;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public CheckpointStatus status;

    @Column(
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> result;

    @Column(
            nullable = false)
    public int attempts;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public enum CheckpointStatus {
        PENDING, DONE, FAILED
    }
}
