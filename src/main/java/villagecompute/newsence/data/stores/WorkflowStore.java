package villagecompute.newsence.data.stores;

import villagecompute.newsence.data.models.WorkflowCheckpoint;
import villagecompute.newsence.data.models.WorkflowCheckpoint.CheckpointStatus;
import villagecompute.newsence.data.models.WorkflowInstance;
import villagecompute.newsence.data.models.WorkflowInstance.WorkflowStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam for workflow instances and their step checkpoints.
 *
 * <p>
 * Checkpoints are keyed by {@code (instanceId, stepName)}; {@link #saveCheckpoint} upserts. Every call commits on its
 * own so that a crash between steps never loses a completed checkpoint.
 */
public interface WorkflowStore {

    WorkflowInstance createInstance(UUID itemId, String sourceType);

    Optional<WorkflowInstance> findInstance(UUID instanceId);

    void updateInstance(UUID instanceId, WorkflowStatus status, String currentStep, String failureReason);

    Optional<WorkflowCheckpoint> findCheckpoint(UUID instanceId, String stepName);

    List<WorkflowCheckpoint> findCheckpoints(UUID instanceId);

    void saveCheckpoint(UUID instanceId, String stepName, CheckpointStatus status, Map<String, Object> result,
            int attempts, String lastError);
}
