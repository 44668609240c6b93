package villagecompute.newsence.jobs;

import java.util.Map;

/**
 * Contract for delayed job handlers.
 *
 * <p>
 * Implementations are {@code @ApplicationScoped} beans discovered by
 * {@link villagecompute.newsence.services.DelayedJobService} through CDI. Handlers must be idempotent: a job that
 * throws is retried with exponential backoff until its attempt budget runs out.
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     */
    JobType handlesType();

    /**
     * Executes the job.
     *
     * @param jobId
     *            job primary key, used for logging and tracing
     * @param payload
     *            job parameters from the {@code payload} JSONB column
     * @throws Exception
     *             any failure; the job is rescheduled or marked FAILED
     */
    void execute(Long jobId, Map<String, Object> payload) throws Exception;
}
