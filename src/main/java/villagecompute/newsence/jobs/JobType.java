package villagecompute.newsence.jobs;

/**
 * Enumeration of async job types with their queue assignments.
 *
 * <p>
 * Each job type maps to exactly one {@link JobQueue} family and exactly one {@link JobHandler} bean.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Queue message {@code item_process}: launch the enrichment workflow for one item.
     */
    ITEM_PROCESS(JobQueue.HIGH, "Launch workflow for one item", 5),

    /**
     * Queue message {@code batch_process}: resolve source types and launch one workflow per item.
     */
    BATCH_PROCESS(JobQueue.HIGH, "Fan out workflows for a batch of items", 5),

    /**
     * Executes one workflow instance. Redelivery replays from checkpoints.
     */
    WORKFLOW_RUN(JobQueue.HIGH, "Execute a workflow instance", 3),

    /**
     * Fetches all active RSS/Atom feeds.
     * <p>
     * <b>Cadence:</b> every 10 minutes
     */
    RSS_FEED_REFRESH(JobQueue.DEFAULT, "Feed refresh (10min)", 1),

    /**
     * Polls configured social lists for high-engagement posts.
     * <p>
     * <b>Cadence:</b> every 15 minutes
     */
    SOCIAL_FEED_REFRESH(JobQueue.DEFAULT, "Social list poll (15min)", 1),

    /**
     * Re-queues recently ingested items whose enrichment is incomplete.
     * <p>
     * <b>Cadence:</b> hourly
     */
    RETRY_INCOMPLETE(JobQueue.LOW, "Incomplete item sweep (hourly)", 1);

    private final JobQueue queue;
    private final String description;
    private final int maxAttempts;

    JobType(JobQueue queue, String description, int maxAttempts) {
        this.queue = queue;
        this.description = description;
        this.maxAttempts = maxAttempts;
    }

    public JobQueue getQueue() {
        return queue;
    }

    public String getDescription() {
        return description;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
