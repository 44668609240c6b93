package villagecompute.newsence.jobs;

import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.queue.ItemProcessMessage;
import villagecompute.newsence.workflow.WorkflowLauncher;

/**
 * Consumes {@code item_process} messages by launching one enrichment workflow for the item.
 *
 * <p>
 * A payload without a parsable {@code itemId} is a {@link ValidationException} and fails the job without retries.
 */
@ApplicationScoped
public class ItemProcessJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(ItemProcessJobHandler.class);

    @Inject
    WorkflowLauncher launcher;

    @Inject
    Tracer tracer;

    @Override
    public JobType handlesType() {
        return JobType.ITEM_PROCESS;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        ItemProcessMessage message;
        try {
            message = ItemProcessMessage.fromPayload(payload);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid item_process payload: " + e.getMessage(), e);
        }

        Span span = tracer.spanBuilder("job.item_process").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.ITEM_PROCESS.name())
                .setAttribute("item.id", message.itemId().toString())
                .setAttribute("item.source_type", message.sourceType()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);
            LoggingConfig.setItemId(message.itemId().toString());

            UUID instanceId = launcher.launch(message.itemId(), message.sourceType());
            span.setAttribute("workflow.instance", instanceId.toString());
            LOG.infof("Launched workflow %s for item %s (%s)", instanceId, message.itemId(), message.sourceType());
        } catch (Exception e) {
            span.recordException(e);
            throw e;
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }
}
