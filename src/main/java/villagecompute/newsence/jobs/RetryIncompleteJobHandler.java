package villagecompute.newsence.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.google.common.collect.Lists;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.queue.BatchProcessMessage;
import villagecompute.newsence.queue.ItemQueue;

/**
 * Sweeps recently ingested items whose enrichment never completed and re-queues them as {@code batch_process}
 * messages.
 *
 * <p>
 * An item is incomplete when it lacks a localized title, a localized summary or an embedding, or has content without
 * localized content. Items older than {@code newsence.retry.lookback-hours} are left alone.
 */
@ApplicationScoped
public class RetryIncompleteJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RetryIncompleteJobHandler.class);

    public static final String TRIGGERED_BY = "retry_cron";

    @Inject
    ItemStore itemStore;

    @Inject
    ItemQueue itemQueue;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "newsence.retry.lookback-hours",
            defaultValue = "48")
    int lookbackHours;

    @ConfigProperty(
            name = "newsence.retry.batch-size",
            defaultValue = "20")
    int batchSize;

    Clock clock = Clock.systemUTC();

    @Override
    public JobType handlesType() {
        return JobType.RETRY_INCOMPLETE;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        Span span = tracer.spanBuilder("job.retry_incomplete").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.RETRY_INCOMPLETE.name()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            int queued = requeueIncomplete();
            span.setAttribute("items_queued", queued);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Re-queues incomplete items in chunks of {@code newsence.retry.batch-size}.
     *
     * @return number of items queued
     */
    public int requeueIncomplete() {
        Instant since = clock.instant().minus(Duration.ofHours(lookbackHours));
        List<UUID> incomplete = itemStore.findIncompleteIds(since);
        if (incomplete.isEmpty()) {
            LOG.debugf("No incomplete items since %s", since);
            return 0;
        }

        int queued = 0;
        for (List<UUID> chunk : Lists.partition(incomplete, Math.max(batchSize, 1))) {
            itemQueue.send(new BatchProcessMessage(chunk, TRIGGERED_BY));
            queued += chunk.size();
        }
        LOG.infof("Re-queued %d incomplete items ingested since %s", queued, since);
        return queued;
    }
}
