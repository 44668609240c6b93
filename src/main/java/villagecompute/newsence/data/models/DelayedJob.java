package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.LockModeType;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jboss.logging.Logger;
import villagecompute.newsence.jobs.JobQueue;
import villagecompute.newsence.jobs.JobType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Database-backed job queue entry.
 *
 * <p>
 * This table is the durable queue between producers (feed refresh, social poll, submission, sweeps) and the workflow
 * orchestrator. Workers poll for ready rows, lock them, and move them to COMPLETED, back to PENDING with a backoff, or
 * to FAILED once {@code max_attempts} is used up.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code job_type} / {@code queue} (TEXT) - {@link JobType} and its {@link JobQueue}</li>
 * <li>{@code priority} (INT) - queue priority, lower polls first</li>
 * <li>{@code payload} (JSONB) - handler parameters</li>
 * <li>{@code status} (TEXT) - PENDING, PROCESSING, COMPLETED, FAILED</li>
 * <li>{@code attempts} / {@code max_attempts} (INT)</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - earliest execution time, pushed forward by backoff</li>
 * <li>{@code locked_at} / {@code locked_by} - worker claim</li>
 * <li>{@code completed_at}, {@code failed_at}, {@code last_error}, {@code created_at}, {@code updated_at}</li>
 * </ul>
 */
@Entity
@Table(
        name = "delayed_jobs")
@NamedQuery(
        name = DelayedJob.QUERY_FIND_READY_JOBS,
        query = DelayedJob.JPQL_FIND_READY_JOBS)
@NamedQuery(
        name = DelayedJob.QUERY_COUNT_PENDING,
        query = DelayedJob.JPQL_COUNT_PENDING)
public class DelayedJob extends PanacheEntityBase {

    private static final Logger LOG = Logger.getLogger(DelayedJob.class);

    public static final String JPQL_FIND_READY_JOBS = "FROM DelayedJob WHERE queue = :queue AND scheduledAt <= :now "
            + "AND (status = :pending OR (status = :processing AND lockedAt < :staleThreshold)) "
            + "ORDER BY priority ASC, scheduledAt ASC";
    public static final String QUERY_FIND_READY_JOBS = "DelayedJob.findReadyJobs";

    public static final String JPQL_COUNT_PENDING = "SELECT COUNT(j) FROM DelayedJob j WHERE j.queue = :queue "
            + "AND j.status = :status";
    public static final String QUERY_COUNT_PENDING = "DelayedJob.countPending";

    /**
     * A PROCESSING job whose lock is older than this is assumed abandoned by a crashed worker and is claimable again.
     * Longer than the worst-case workflow run (every step exhausting its retries).
     */
    public static final Duration STALE_LOCK_TIMEOUT = Duration.ofMinutes(30);

    private static final String SKIP_LOCKED_HINT = "jakarta.persistence.lock.timeout";
    private static final int LOCK_TIMEOUT_SKIP_LOCKED = -2;

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "queue",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobQueue queue;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "payload",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            name = "locked_at")
    public Instant lockedAt;

    @Column(
            name = "locked_by")
    public String lockedBy;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "failed_at")
    public Instant failedAt;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses.
     */
    public enum JobStatus {
        PENDING, PROCESSING, COMPLETED, FAILED
    }

    /**
     * Claims candidates for a queue: due PENDING jobs plus PROCESSING jobs whose lock went stale. Rows locked by another
     * poller are skipped.
     *
     * @param queue
     *            the queue to poll
     * @param limit
     *            max jobs to return
     * @return ready jobs ordered by priority then scheduled time
     */
    public static List<DelayedJob> findReadyJobs(JobQueue queue, int limit) {
        if (queue == null) {
            return List.of();
        }
        Instant now = Instant.now();
        return find("#" + QUERY_FIND_READY_JOBS,
                Parameters.with("queue", queue).and("pending", JobStatus.PENDING)
                        .and("processing", JobStatus.PROCESSING).and("now", now)
                        .and("staleThreshold", now.minus(STALE_LOCK_TIMEOUT)))
                .withLock(LockModeType.PESSIMISTIC_WRITE).withHint(SKIP_LOCKED_HINT, LOCK_TIMEOUT_SKIP_LOCKED)
                .page(0, limit).list();
    }

    public static long countPending(JobQueue queue) {
        return count("#" + QUERY_COUNT_PENDING, Parameters.with("queue", queue).and("status", JobStatus.PENDING));
    }

    /**
     * Creates and persists a new job, due immediately, with the type's default attempt budget.
     *
     * @param jobType
     *            the job type
     * @param payload
     *            handler parameters
     * @return persisted job
     */
    public static DelayedJob create(JobType jobType, Map<String, Object> payload) {
        return create(jobType, payload, Instant.now(), jobType.getMaxAttempts());
    }

    public static DelayedJob create(JobType jobType, Map<String, Object> payload, Instant scheduledAt,
            int maxAttempts) {
        DelayedJob job = new DelayedJob();
        job.jobType = jobType;
        job.queue = jobType.getQueue();
        job.priority = jobType.getQueue().getPriority();
        job.payload = payload;
        job.status = JobStatus.PENDING;
        job.attempts = 0;
        job.maxAttempts = maxAttempts;
        job.scheduledAt = scheduledAt;
        job.createdAt = Instant.now();
        job.updatedAt = job.createdAt;

        job.persist();
        LOG.debugf("Created job %d (type: %s, queue: %s, scheduled: %s)", job.id, jobType, job.queue, scheduledAt);
        return job;
    }

    public void lock(String workerId) {
        this.status = JobStatus.PROCESSING;
        this.lockedAt = Instant.now();
        this.lockedBy = workerId;
        this.attempts++;
        this.updatedAt = Instant.now();
    }

    public void markCompleted() {
        this.status = JobStatus.COMPLETED;
        this.completedAt = Instant.now();
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = Instant.now();
    }

    public void markFailed(String errorMessage) {
        this.status = JobStatus.FAILED;
        this.failedAt = Instant.now();
        this.lastError = errorMessage;
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = Instant.now();
        LOG.errorf("Job %d (%s) marked FAILED after %d attempts: %s", this.id, this.jobType, this.attempts,
                errorMessage);
    }

    /**
     * Returns the job to PENDING with a delayed {@code scheduled_at}.
     *
     * @param backoffSeconds
     *            seconds to wait before the next attempt
     */
    public void scheduleRetry(long backoffSeconds, String errorMessage) {
        this.status = JobStatus.PENDING;
        this.scheduledAt = Instant.now().plusSeconds(backoffSeconds);
        this.lastError = errorMessage;
        this.lockedAt = null;
        this.lockedBy = null;
        this.updatedAt = Instant.now();
        LOG.infof("Job %d scheduled for retry in %d seconds (attempt %d/%d)", this.id, backoffSeconds, this.attempts,
                this.maxAttempts);
    }

    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }
}
