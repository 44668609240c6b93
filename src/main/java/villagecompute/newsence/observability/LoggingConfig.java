package villagecompute.newsence.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Structured logging helpers for MDC enrichment.
 *
 * <p>
 * Every job handler, workflow run and REST filter enriches the MDC on entry and calls {@link #clearMDC()} in a
 * {@code finally} block so that pooled worker threads never leak context between executions.
 *
 * <p>
 * <b>MDC Keys:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry trace context</li>
 * <li>{@code request_origin} - Originating component (resource, job handler, scheduler)</li>
 * <li>{@code rate_limit_bucket} - Admission control key for submission requests</li>
 * <li>{@code job_id} - Delayed job primary key</li>
 * <li>{@code item_id} - Content item being ingested or enriched</li>
 * <li>{@code workflow_instance} / {@code workflow_step} - Enrichment workflow position</li>
 * <li>{@code feed_source} - Feed currently being refreshed</li>
 * </ul>
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    public static final String MDC_RATE_LIMIT_BUCKET = "rate_limit_bucket";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_ITEM_ID = "item_id";

    public static final String MDC_WORKFLOW_INSTANCE = "workflow_instance";

    public static final String MDC_WORKFLOW_STEP = "workflow_step";

    public static final String MDC_FEED_SOURCE = "feed_source";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies the current span's trace and span ids into the MDC. Empty strings are written when no span is active so
     * the log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    public static void setRateLimitBucket(String rateLimitBucket) {
        if (rateLimitBucket != null) {
            MDC.put(MDC_RATE_LIMIT_BUCKET, rateLimitBucket);
        }
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setItemId(String itemId) {
        if (itemId != null) {
            MDC.put(MDC_ITEM_ID, itemId);
        }
    }

    public static void setWorkflowInstance(String instanceId) {
        if (instanceId != null) {
            MDC.put(MDC_WORKFLOW_INSTANCE, instanceId);
        }
    }

    public static void setWorkflowStep(String stepName) {
        if (stepName != null) {
            MDC.put(MDC_WORKFLOW_STEP, stepName);
        } else {
            MDC.remove(MDC_WORKFLOW_STEP);
        }
    }

    public static void setFeedSource(String feedSource) {
        if (feedSource != null) {
            MDC.put(MDC_FEED_SOURCE, feedSource);
        }
    }

    /**
     * Removes every key this class manages.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_REQUEST_ORIGIN);
        MDC.remove(MDC_RATE_LIMIT_BUCKET);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_ITEM_ID);
        MDC.remove(MDC_WORKFLOW_INSTANCE);
        MDC.remove(MDC_WORKFLOW_STEP);
        MDC.remove(MDC_FEED_SOURCE);
    }
}
