package villagecompute.newsence.workflow;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.models.WorkflowInstance;
import villagecompute.newsence.data.models.WorkflowInstance.WorkflowStatus;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.data.stores.WorkflowStore;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.exceptions.WorkflowStepException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.observability.PipelineMetrics;
import villagecompute.newsence.processors.ProcessorRegistry;
import villagecompute.newsence.processors.ProcessorResult;
import villagecompute.newsence.services.ContentAnalysisService;
import villagecompute.newsence.services.EmbeddingService;
import villagecompute.newsence.services.TopicAssignmentResult;
import villagecompute.newsence.services.TopicClusteringService;
import villagecompute.newsence.services.TopicSynthesisService;
import villagecompute.newsence.services.VideoHighlightsService;

/**
 * Drives one item through the enrichment workflow.
 *
 * <p>
 * Steps run strictly in {@link WorkflowStep} order through the {@link StepExecutor}, so each one is checkpointed
 * before the next begins and a re-run of the same instance resumes at the first step that is not done. Outcomes:
 * <ul>
 * <li>{@code COMPLETE}: every applicable step finished (highlights and synthesis failures are tolerated)</li>
 * <li>{@code TERMINATED}: the item vanished ({@code not_found}) or failed validation</li>
 * <li>{@code ERRORED}: a step exhausted its retries; later steps are not attempted</li>
 * </ul>
 */
@ApplicationScoped
public class WorkflowOrchestrator {

    private static final Logger LOG = Logger.getLogger(WorkflowOrchestrator.class);

    static final int MIN_TRANSLATABLE_CONTENT = 100;
    static final String NOT_FOUND = "not_found";

    @Inject
    WorkflowStore workflowStore;

    @Inject
    ItemStore itemStore;

    @Inject
    StepExecutor steps;

    @Inject
    ProcessorRegistry processors;

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    VideoHighlightsService highlightsService;

    @Inject
    EmbeddingService embeddingService;

    @Inject
    TopicClusteringService clusteringService;

    @Inject
    TopicSynthesisService synthesisService;

    @Inject
    PipelineMetrics metrics;

    @Inject
    Tracer tracer;

    Clock clock = Clock.systemUTC();

    /**
     * Runs (or resumes) a workflow instance. Finished instances are left alone.
     *
     * @return the instance status after this run
     * @throws ResourceNotFoundException
     *             if the instance itself does not exist
     */
    public WorkflowStatus run(UUID instanceId) {
        WorkflowInstance instance = workflowStore.findInstance(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow instance not found: " + instanceId));
        if (instance.status.isFinished()) {
            LOG.infof("Workflow %s already finished with %s, nothing to do", instanceId, instance.status);
            return instance.status;
        }

        Span span = tracer.spanBuilder("workflow.run").setAttribute("workflow.instance", instanceId.toString())
                .setAttribute("item.id", instance.itemId.toString())
                .setAttribute("item.source_type", instance.sourceType).startSpan();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setWorkflowInstance(instanceId.toString());
            LoggingConfig.setItemId(instance.itemId.toString());

            WorkflowStatus status = execute(instance);
            span.setAttribute("workflow.status", status.name());
            return status;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private WorkflowStatus execute(WorkflowInstance instance) {
        UUID instanceId = instance.id;
        UUID itemId = instance.itemId;
        String sourceType = instance.sourceType;
        LOG.infof("Starting workflow %s for item %s (%s)", instanceId, itemId, sourceType);
        workflowStore.updateInstance(instanceId, WorkflowStatus.RUNNING, null, null);

        try {
            runSteps(instanceId, itemId, sourceType);
        } catch (ResourceNotFoundException e) {
            LOG.warnf("Item %s not found, terminating workflow %s", itemId, instanceId);
            return finish(instanceId, WorkflowStatus.TERMINATED, WorkflowStep.FETCH_ITEM.stepName(), NOT_FOUND);
        } catch (ValidationException e) {
            LOG.warnf("Workflow %s terminated on validation failure: %s", instanceId, e.getMessage());
            return finish(instanceId, WorkflowStatus.TERMINATED, null, e.getMessage());
        } catch (WorkflowStepException e) {
            LOG.errorf(e, "Workflow %s failed at step %s", instanceId, e.getStepName());
            return finish(instanceId, WorkflowStatus.ERRORED, e.getStepName(), e.getMessage());
        }

        LOG.infof("Workflow %s completed for item %s", instanceId, itemId);
        return finish(instanceId, WorkflowStatus.COMPLETE, null, null);
    }

    private void runSteps(UUID instanceId, UUID itemId, String sourceType) {
        ItemSnapshot snapshot = steps.execute(instanceId, WorkflowStep.FETCH_ITEM, ItemSnapshot.class,
                () -> itemStore.findById(itemId).map(ItemSnapshot::from)
                        .orElseThrow(() -> new ResourceNotFoundException("Item not found: " + itemId)));
        ContentItem item = snapshot.toItem();

        ProcessorResult processed = steps.execute(instanceId, WorkflowStep.AI_ANALYSIS, ProcessorResult.class,
                () -> processors.forType(sourceType).process(item));

        ItemUpdate update = processed.update();
        String contentToTranslate = update.content() != null ? update.content() : item.content;
        if (needsTranslation(contentToTranslate, update, item)) {
            String translated = steps.execute(instanceId, WorkflowStep.TRANSLATE_CONTENT, String.class,
                    () -> analysisService.translateContent(contentToTranslate));
            if (translated != null) {
                update = update.withContentLocalized(translated);
            }
        } else {
            skipped(WorkflowStep.TRANSLATE_CONTENT);
        }

        ItemUpdate fields = update;
        if (!fields.isEmpty() || processed.hasEnrichments()) {
            steps.execute(instanceId, WorkflowStep.UPDATE_STORE, Boolean.class, () -> {
                if (!fields.isEmpty()) {
                    itemStore.updateFields(itemId, fields);
                }
                if (processed.hasEnrichments()) {
                    itemStore.updatePlatformMetadata(itemId,
                            mergeEnrichments(snapshot.platformMetadata(), processed.enrichments(), clock));
                }
                return Boolean.TRUE;
            });
        } else {
            skipped(WorkflowStep.UPDATE_STORE);
        }

        generateHighlights(instanceId, sourceType, item);

        String embeddingText = EmbeddingService.prepareText(snapshot.merged(fields));
        float[] embedding = steps.execute(instanceId, WorkflowStep.GENERATE_EMBEDDING, float[].class,
                () -> embeddingService.embed(embeddingText));
        if (embedding == null) {
            LOG.infof("No embedding for item %s, skipping topic assignment", itemId);
            skipped(WorkflowStep.SAVE_EMBEDDING);
            skipped(WorkflowStep.ASSIGN_TOPIC);
            skipped(WorkflowStep.SYNTHESIZE_TOPIC);
            return;
        }

        steps.execute(instanceId, WorkflowStep.SAVE_EMBEDDING, Boolean.class, () -> {
            itemStore.saveEmbedding(itemId, embedding);
            return Boolean.TRUE;
        });

        TopicAssignmentResult topic = steps.execute(instanceId, WorkflowStep.ASSIGN_TOPIC,
                TopicAssignmentResult.class, () -> clusteringService.assignTopic(itemId));

        if (topic != null && topic.needsSynthesis() && topic.assigned() && synthesisService.isAvailable()) {
            try {
                steps.execute(instanceId, WorkflowStep.SYNTHESIZE_TOPIC, Boolean.class,
                        () -> synthesisService.synthesize(topic.topicId()));
            } catch (WorkflowStepException e) {
                LOG.warnf("Topic %s keeps its previous headline, synthesis failed: %s", topic.topicId(),
                        e.getMessage());
            }
        } else {
            skipped(WorkflowStep.SYNTHESIZE_TOPIC);
        }
    }

    private void generateHighlights(UUID instanceId, String sourceType, ContentItem item) {
        Object videoId = item.platformData().get("videoId");
        if (SourceType.fromValue(sourceType) != SourceType.YOUTUBE
                || !SourceType.YOUTUBE.value().equals(item.platformType()) || videoId == null) {
            skipped(WorkflowStep.GENERATE_HIGHLIGHTS);
            return;
        }
        try {
            steps.execute(instanceId, WorkflowStep.GENERATE_HIGHLIGHTS, Integer.class,
                    () -> highlightsService.generate(videoId.toString()));
        } catch (WorkflowStepException e) {
            LOG.warnf("Highlights for video %s skipped: %s", videoId, e.getMessage());
        }
    }

    static boolean needsTranslation(String content, ItemUpdate update, ContentItem item) {
        if (content == null || content.length() <= MIN_TRANSLATABLE_CONTENT) {
            return false;
        }
        return update.contentLocalized() == null
                && (item.contentLocalized == null || item.contentLocalized.isBlank() || update.content() != null);
    }

    /**
     * Platform metadata with {@code enrichments} merged into its {@code enrichments} bag and stamped
     * {@code processedAt}. Existing bag entries not in {@code enrichments} are kept.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> mergeEnrichments(Map<String, Object> base, Map<String, Object> enrichments,
            Clock clock) {
        Map<String, Object> merged = base == null ? new HashMap<>() : new HashMap<>(base);
        Map<String, Object> bag = new HashMap<>();
        if (merged.get("enrichments") instanceof Map<?, ?> existing) {
            bag.putAll((Map<String, Object>) existing);
        }
        bag.putAll(enrichments);
        bag.put("processedAt", clock.instant().toString());
        merged.put("enrichments", bag);
        return merged;
    }

    private WorkflowStatus finish(UUID instanceId, WorkflowStatus status, String step, String reason) {
        workflowStore.updateInstance(instanceId, status, step, reason);
        metrics.recordWorkflowFinished(status.name().toLowerCase());
        return status;
    }

    private void skipped(WorkflowStep step) {
        metrics.recordStep(step.stepName(), "skipped", null);
    }
}
