package villagecompute.newsence.workflow;

import java.time.Duration;

/**
 * Steps of the item enrichment workflow, in execution order, with their retry and timeout policy.
 *
 * <p>
 * {@code retries} counts retries after the first attempt. The delay before retry {@code n} is
 * {@code delay * 2^(n-1)}. Every attempt is bounded by {@code timeout}.
 */
public enum WorkflowStep {

    FETCH_ITEM("fetch-item", 3, Duration.ofSeconds(5), Duration.ofSeconds(30)),

    AI_ANALYSIS("ai-analysis", 3, Duration.ofSeconds(10), Duration.ofSeconds(180)),

    TRANSLATE_CONTENT("translate-content", 2, Duration.ofSeconds(10), Duration.ofSeconds(180)),

    UPDATE_STORE("update-store", 3, Duration.ofSeconds(5), Duration.ofSeconds(30)),

    GENERATE_HIGHLIGHTS("generate-highlights", 2, Duration.ofSeconds(10), Duration.ofSeconds(60)),

    GENERATE_EMBEDDING("generate-embedding", 3, Duration.ofSeconds(5), Duration.ofSeconds(30)),

    SAVE_EMBEDDING("save-embedding", 3, Duration.ofSeconds(5), Duration.ofSeconds(30)),

    ASSIGN_TOPIC("assign-topic", 2, Duration.ofSeconds(5), Duration.ofSeconds(30)),

    SYNTHESIZE_TOPIC("synthesize-topic", 2, Duration.ofSeconds(5), Duration.ofSeconds(60));

    private final String stepName;
    private final int retries;
    private final Duration delay;
    private final Duration timeout;

    WorkflowStep(String stepName, int retries, Duration delay, Duration timeout) {
        this.stepName = stepName;
        this.retries = retries;
        this.delay = delay;
        this.timeout = timeout;
    }

    /**
     * Checkpoint key of the step.
     */
    public String stepName() {
        return stepName;
    }

    public int retries() {
        return retries;
    }

    public Duration delay() {
        return delay;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Delay before the given retry (1-indexed).
     */
    public Duration backoff(int retry) {
        return delay.multipliedBy(1L << (retry - 1));
    }
}
