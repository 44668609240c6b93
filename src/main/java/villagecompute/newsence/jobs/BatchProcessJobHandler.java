package villagecompute.newsence.jobs;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import com.google.common.collect.Lists;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.queue.BatchProcessMessage;
import villagecompute.newsence.workflow.WorkflowLauncher;

/**
 * Consumes {@code batch_process} messages: resolves each item's source type and launches one workflow per item.
 *
 * <p>
 * Source types are looked up in chunks of {@value #LOOKUP_CHUNK_SIZE}. Ids missing from the store fall back to
 * {@code default}; their workflow terminates at the fetch step. A launch failure is logged and does not stop the
 * remaining items, and the job is not retried for it, since a retry would relaunch the items that did start.
 */
@ApplicationScoped
public class BatchProcessJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(BatchProcessJobHandler.class);

    static final int LOOKUP_CHUNK_SIZE = 200;

    @Inject
    ItemStore itemStore;

    @Inject
    WorkflowLauncher launcher;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.BATCH_PROCESS;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        BatchProcessMessage message;
        try {
            message = BatchProcessMessage.fromPayload(payload);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid batch_process payload: " + e.getMessage(), e);
        }

        Span span = tracer.spanBuilder("job.batch_process").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.BATCH_PROCESS.name())
                .setAttribute("batch.size", message.itemIds().size())
                .setAttribute("batch.triggered_by", String.valueOf(message.triggeredBy())).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);

            int launched = 0;
            int failed = 0;
            for (List<UUID> chunk : Lists.partition(message.itemIds(), LOOKUP_CHUNK_SIZE)) {
                Map<UUID, String> sourceTypes = itemStore.findSourceTypes(chunk);
                for (UUID itemId : chunk) {
                    String sourceType = sourceTypes.getOrDefault(itemId, SourceType.DEFAULT.value());
                    try {
                        launcher.launch(itemId, sourceType);
                        launched++;
                    } catch (RuntimeException e) {
                        failed++;
                        span.recordException(e);
                        LOG.errorf(e, "Failed to launch workflow for item %s in batch job %d", itemId, jobId);
                    }
                }
            }

            span.setAttribute("batch.launched", launched);
            span.setAttribute("batch.failed", failed);
            LOG.infof("Batch job %d (%s) launched %d workflows, %d failed", jobId, message.triggeredBy(), launched,
                    failed);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }
}
