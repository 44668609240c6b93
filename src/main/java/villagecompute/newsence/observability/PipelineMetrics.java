package villagecompute.newsence.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.newsence.data.models.DelayedJob;
import villagecompute.newsence.jobs.JobQueue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer metrics for the ingestion, enrichment and clustering pipeline.
 *
 * <p>
 * <b>Metrics:</b>
 * <ul>
 * <li>{@code newsence_ingest_items_total} (Counter) - tagged by {@code producer} and {@code outcome}
 * ({@code inserted|duplicate|upgraded|failed})</li>
 * <li>{@code newsence_admission_total} (Counter) - tagged by {@code decision} ({@code admitted|rejected})</li>
 * <li>{@code newsence_workflow_steps_total} (Counter) - tagged by {@code step} and {@code outcome}</li>
 * <li>{@code newsence_workflow_step_duration} (Timer) - tagged by {@code step}</li>
 * <li>{@code newsence_workflow_instances_total} (Counter) - tagged by terminal {@code status}</li>
 * <li>{@code newsence_topic_assignments_total} (Counter) - tagged by {@code outcome}
 * ({@code joined|created|singleton|skipped|rolled_back})</li>
 * <li>{@code newsence_feed_fetch_total} (Counter) and {@code newsence_feed_fetch_duration} (Timer) - tagged by
 * {@code result} ({@code success|failure})</li>
 * <li>{@code newsence_jobs_depth} (Gauge) - pending jobs per queue</li>
 * </ul>
 *
 * <p>
 * Counters are cached by tag combination so hot paths avoid re-registering meters.
 */
@ApplicationScoped
public class PipelineMetrics {

    private static final Logger LOG = Logger.getLogger(PipelineMetrics.class);

    private final MeterRegistry registry;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Inject
    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    void registerGauges(@Observes StartupEvent event) {
        for (JobQueue queue : JobQueue.values()) {
            Gauge.builder("newsence_jobs_depth", this, m -> jobDepth(queue))
                    .description("Number of pending jobs in the " + queue.name() + " queue")
                    .tags(List.of(Tag.of("queue", queue.name()))).register(registry);
        }
        LOG.info("Registered pipeline gauges. Access metrics at /q/metrics");
    }

    private double jobDepth(JobQueue queue) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> DelayedJob.countPending(queue));
        } catch (RuntimeException e) {
            LOG.debugf("Job depth unavailable for queue %s: %s", queue, e.getMessage());
            return Double.NaN;
        }
    }

    public void recordIngestion(String producer, String outcome) {
        counter("newsence_ingest_items_total", "producer", producer, "outcome", outcome).increment();
    }

    public void recordAdmission(boolean admitted) {
        counter("newsence_admission_total", "decision", admitted ? "admitted" : "rejected").increment();
    }

    public void recordStep(String step, String outcome, Duration duration) {
        counter("newsence_workflow_steps_total", "step", step, "outcome", outcome).increment();
        if (duration != null) {
            Timer.builder("newsence_workflow_step_duration").tag("step", step).register(registry).record(duration);
        }
    }

    public void recordWorkflowFinished(String status) {
        counter("newsence_workflow_instances_total", "status", status).increment();
    }

    public void recordTopicAssignment(String outcome) {
        counter("newsence_topic_assignments_total", "outcome", outcome).increment();
    }

    public void recordFeedFetch(String result, Duration duration) {
        counter("newsence_feed_fetch_total", "result", result).increment();
        if (duration != null) {
            Timer.builder("newsence_feed_fetch_duration").tag("result", result).register(registry).record(duration);
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String... tags) {
        String key = name + String.join("|", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(name).tags(tags).register(registry));
    }
}
