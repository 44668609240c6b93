package villagecompute.newsence.jobs;

/**
 * Queue families for delayed jobs. Lower priority numbers are polled first.
 */
public enum JobQueue {

    /**
     * Workflow execution and item fan-out; user-visible latency depends on it.
     */
    HIGH(0, "Item processing and workflow runs"),

    /**
     * Producers: feed and social polling.
     */
    DEFAULT(5, "Periodic ingestion tasks"),

    /**
     * Maintenance sweeps.
     */
    LOW(7, "Background re-queue sweeps");

    private final int priority;
    private final String description;

    JobQueue(int priority, String description) {
        this.priority = priority;
        this.description = description;
    }

    public int getPriority() {
        return priority;
    }

    public String getDescription() {
        return description;
    }
}
