package villagecompute.newsence.data.stores;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.newsence.data.models.WorkflowCheckpoint;
import villagecompute.newsence.data.models.WorkflowCheckpoint.CheckpointStatus;
import villagecompute.newsence.data.models.WorkflowInstance;
import villagecompute.newsence.data.models.WorkflowInstance.WorkflowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of {@link WorkflowStore}.
 */
@ApplicationScoped
public class PanacheWorkflowStore implements WorkflowStore {

    @Override
    public WorkflowInstance createInstance(UUID itemId, String sourceType) {
        WorkflowInstance instance = new WorkflowInstance();
        QuarkusTransaction.requiringNew().run(() -> {
            instance.id = UUID.randomUUID();
            instance.itemId = itemId;
            instance.sourceType = sourceType;
            instance.status = WorkflowStatus.QUEUED;
            instance.createdAt = Instant.now();
            instance.updatedAt = instance.createdAt;
            instance.persist();
        });
        return instance;
    }

    @Override
    @Transactional
    public Optional<WorkflowInstance> findInstance(UUID instanceId) {
        return WorkflowInstance.findByIdOptional(instanceId);
    }

    @Override
    public void updateInstance(UUID instanceId, WorkflowStatus status, String currentStep, String failureReason) {
        QuarkusTransaction.requiringNew().run(() -> {
            WorkflowInstance instance = WorkflowInstance.findById(instanceId);
            if (instance == null) {
                return;
            }
            instance.status = status;
            instance.currentStep = currentStep;
            instance.failureReason = failureReason;
            instance.updatedAt = Instant.now();
            if (status.isFinished()) {
                instance.finishedAt = instance.updatedAt;
            }
        });
    }

    @Override
    @Transactional
    public Optional<WorkflowCheckpoint> findCheckpoint(UUID instanceId, String stepName) {
        return WorkflowCheckpoint.find("#" + WorkflowCheckpoint.QUERY_FIND_BY_STEP,
                Parameters.with("instanceId", instanceId).and("stepName", stepName)).firstResultOptional();
    }

    @Override
    @Transactional
    public List<WorkflowCheckpoint> findCheckpoints(UUID instanceId) {
        return WorkflowCheckpoint
                .find("#" + WorkflowCheckpoint.QUERY_FIND_BY_INSTANCE, Parameters.with("instanceId", instanceId))
                .list();
    }

    @Override
    public void saveCheckpoint(UUID instanceId, String stepName, CheckpointStatus status, Map<String, Object> result,
            int attempts, String lastError) {
        QuarkusTransaction.requiringNew().run(() -> {
            WorkflowCheckpoint checkpoint = WorkflowCheckpoint
                    .<WorkflowCheckpoint> find("#" + WorkflowCheckpoint.QUERY_FIND_BY_STEP,
                            Parameters.with("instanceId", instanceId).and("stepName", stepName))
                    .firstResult();
            if (checkpoint == null) {
                checkpoint = new WorkflowCheckpoint();
                checkpoint.instanceId = instanceId;
                checkpoint.stepName = stepName;
            }
            checkpoint.status = status;
            checkpoint.result = result;
            checkpoint.attempts = attempts;
            checkpoint.lastError = lastError;
            checkpoint.updatedAt = Instant.now();
            checkpoint.persist();
        });
    }
}
