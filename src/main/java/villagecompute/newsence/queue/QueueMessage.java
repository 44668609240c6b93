package villagecompute.newsence.queue;

import java.util.Map;

import villagecompute.newsence.jobs.JobType;

/**
 * Message handed from a producer to the workflow orchestrator.
 *
 * <p>
 * The closed set of kinds is {@link ItemProcessMessage} and {@link BatchProcessMessage}. Each maps to a job type and
 * serializes to the job's JSON payload.
 */
public interface QueueMessage {

    String KIND_FIELD = "kind";

    JobType jobType();

    Map<String, Object> toPayload();
}
