package villagecompute.newsence.services;

import java.lang.management.ManagementFactory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.DelayedJob;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.jobs.JobHandler;
import villagecompute.newsence.jobs.JobQueue;
import villagecompute.newsence.jobs.JobType;
import villagecompute.newsence.observability.LoggingConfig;

/**
 * Database-backed job queue: enqueue, poll, dispatch, retry.
 *
 * <p>
 * Each queue family is polled on its own {@code @Scheduled} cadence. A poll claims up to
 * {@code newsence.jobs.poll-batch-size} due jobs in one short transaction ({@code FOR UPDATE SKIP LOCKED}), marks them
 * PROCESSING, then hands each one to a shared pool of {@code newsence.jobs.worker-threads} workers outside that
 * transaction. Jobs run concurrently, so one slow workflow never delays the others, and a poll claims no more jobs than
 * there are idle workers.
 *
 * <p>
 * <b>Retry Strategy:</b> a failed job is rescheduled with {@code delay = 2^attempt * 30s} and a random jitter in
 * [0.75, 1.25] until it reaches its {@code max_attempts}. {@link ValidationException} and
 * {@link ResourceNotFoundException} are terminal and fail the job immediately.
 *
 * @see JobHandler for handler contract
 * @see JobType for job-to-queue mappings
 */
@ApplicationScoped
public class DelayedJobService {

    private static final Logger LOG = Logger.getLogger(DelayedJobService.class);

    /**
     * Base delay in seconds for retry backoff calculation.
     */
    private static final int BASE_DELAY_SECONDS = 30;

    private static final int MAX_ERROR_LENGTH = 2000;

    private final Map<JobType, JobHandler> handlerRegistry;

    private final String workerId = ManagementFactory.getRuntimeMXBean().getName();

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "newsence.jobs.poll-batch-size",
            defaultValue = "10")
    int pollBatchSize;

    @ConfigProperty(
            name = "newsence.jobs.worker-threads",
            defaultValue = "8")
    int workerThreads;

    private Semaphore capacity;

    private ExecutorService workers;

    @Inject
    public DelayedJobService(Instance<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized DelayedJobService with %d registered handlers", handlerRegistry.size());
    }

    @PostConstruct
    void startWorkers() {
        capacity = new Semaphore(workerThreads);
        AtomicInteger counter = new AtomicInteger();
        workers = Context.taskWrapping(Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }));
        LOG.infof("Started %d job workers", workerThreads);
    }

    @PreDestroy
    void stopWorkers() {
        workers.shutdownNow();
    }

    /**
     * Discovers all CDI-managed {@link JobHandler} beans and builds a type to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s (queue: %s)", handler.getClass().getSimpleName(), type,
                    type.getQueue());
        }
        return registry;
    }

    /**
     * Persists a new job, committed independently of any caller transaction.
     *
     * @param jobType
     *            the type of job to enqueue
     * @param payload
     *            job parameters, stored as JSONB
     * @return generated job id
     * @throws DatastoreException
     *             when the job row could not be written
     */
    public long enqueue(JobType jobType, Map<String, Object> payload) {
        try {
            long id = QuarkusTransaction.requiringNew().call(() -> DelayedJob.create(jobType, payload).id);
            LOG.debugf("Enqueued JobType.%s as job %d on queue %s", jobType, id, jobType.getQueue());
            return id;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to enqueue JobType.%s", jobType);
            throw new DatastoreException("Failed to enqueue " + jobType, e);
        }
    }

    @Scheduled(
            every = "5s",
            identity = "jobs-high",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollHigh() {
        processQueue(JobQueue.HIGH);
    }

    @Scheduled(
            every = "15s",
            identity = "jobs-default",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollDefault() {
        processQueue(JobQueue.DEFAULT);
    }

    @Scheduled(
            every = "60s",
            identity = "jobs-low",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollLow() {
        processQueue(JobQueue.LOW);
    }

    /**
     * Claims up to one batch of due jobs from {@code queue} and starts them on idle workers.
     *
     * @return number of jobs started
     */
    public int processQueue(JobQueue queue) {
        int reserved = reserve(pollBatchSize);
        if (reserved == 0) {
            LOG.debugf("All %d job workers busy, skipping poll of queue %s", workerThreads, queue);
            return 0;
        }

        List<ClaimedJob> claimed;
        try {
            claimed = QuarkusTransaction.requiringNew().call(() -> claim(queue, reserved));
        } catch (RuntimeException e) {
            capacity.release(reserved);
            LOG.errorf(e, "Failed to claim jobs from queue %s", queue);
            return 0;
        }

        capacity.release(reserved - claimed.size());
        claimed.forEach(this::dispatch);
        return claimed.size();
    }

    /**
     * Takes up to {@code wanted} idle worker slots without blocking.
     */
    int reserve(int wanted) {
        int reserved = 0;
        while (reserved < wanted && capacity.tryAcquire()) {
            reserved++;
        }
        return reserved;
    }

    /**
     * Runs a claimed job on the worker pool. The caller holds one reserved slot, released when the job ends.
     */
    void dispatch(ClaimedJob job) {
        try {
            CompletableFuture.runAsync(() -> runClaimed(job), workers)
                    .whenComplete((ignored, error) -> capacity.release());
        } catch (RejectedExecutionException e) {
            capacity.release();
            // The stale-lock sweep in findReadyJobs picks the job up again
            LOG.warnf("Job worker pool rejected job %d: %s", job.id(), e.getMessage());
        }
    }

    private void runClaimed(ClaimedJob job) {
        try {
            executeJob(job.jobType(), job.id(), job.payload(), job.attempt());
        } catch (Exception e) {
            recordFailure(job, e);
            return;
        }
        try {
            markCompleted(job.id());
        } catch (RuntimeException e) {
            // Left PROCESSING; the stale-lock sweep re-runs it and workflow checkpoints make that a replay
            LOG.errorf(e, "Failed to mark job %d completed", job.id());
        }
    }

    void markCompleted(Long jobId) {
        QuarkusTransaction.requiringNew()
                .run(() -> DelayedJob.<DelayedJob> findByIdOptional(jobId).ifPresent(DelayedJob::markCompleted));
    }

    private List<ClaimedJob> claim(JobQueue queue, int limit) {
        List<ClaimedJob> claimed = new ArrayList<>();
        for (DelayedJob job : DelayedJob.findReadyJobs(queue, limit)) {
            job.lock(workerId);
            claimed.add(new ClaimedJob(job.id, job.jobType, job.payload, job.attempts));
        }
        if (!claimed.isEmpty()) {
            LOG.debugf("Claimed %d jobs from queue %s", claimed.size(), queue);
        }
        return claimed;
    }

    void recordFailure(ClaimedJob job, Exception error) {
        String message = truncate(error.getClass().getSimpleName() + ": " + error.getMessage());
        boolean terminal = error instanceof ValidationException || error instanceof ResourceNotFoundException;
        try {
            QuarkusTransaction.requiringNew().run(() -> {
                DelayedJob row = DelayedJob.findById(job.id());
                if (row == null) {
                    return;
                }
                if (!terminal && row.hasAttemptsRemaining()) {
                    row.scheduleRetry(calculateBackoffDelay(row.attempts), message);
                } else {
                    row.markFailed(message);
                }
            });
        } catch (RuntimeException e) {
            // The stale-lock sweep in findReadyJobs picks the job up again
            LOG.errorf(e, "Failed to record failure of job %d", job.id());
        }
    }

    /**
     * Executes a single job by dispatching to its registered handler inside a {@code job.execute} span.
     *
     * @throws Exception
     *             whatever the handler throws, after recording it on the span
     * @throws IllegalStateException
     *             if no handler is registered for {@code jobType}
     */
    public void executeJob(JobType jobType, Long jobId, Map<String, Object> payload, int attempt) throws Exception {
        JobHandler handler = handlerRegistry.get(jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + jobType);
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", jobId)
                .setAttribute("job.type", jobType.name()).setAttribute("job.queue", jobType.getQueue().name())
                .setAttribute("job.attempt", attempt).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);

            handler.execute(jobId, payload);
            span.addEvent("job.completed");
            LOG.infof("Job %d (type: %s) completed successfully on attempt %d", jobId, jobType, attempt);

        } catch (Exception e) {
            span.recordException(e);
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed on attempt %d", jobId, jobType, attempt);
            throw e;

        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Calculates the next retry delay using exponential backoff with jitter.
     *
     * <p>
     * <b>Formula:</b> {@code delay = (2^attempt) * BASE_DELAY_SECONDS * [0.75, 1.25]}
     *
     * @param attempt
     *            attempts made so far (1-indexed)
     * @return delay in seconds before the next attempt
     */
    public long calculateBackoffDelay(int attempt) {
        double baseDelay = Math.pow(2, attempt) * BASE_DELAY_SECONDS;
        double jitter = 0.75 + (Math.random() * 0.5);
        return (long) (baseDelay * jitter);
    }

    public boolean hasHandler(JobType jobType) {
        return handlerRegistry.containsKey(jobType);
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    record ClaimedJob(Long id, JobType jobType, Map<String, Object> payload, int attempt) {
    }
}
