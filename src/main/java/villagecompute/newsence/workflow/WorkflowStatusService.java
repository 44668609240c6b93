package villagecompute.newsence.workflow;

import java.util.Locale;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.WorkflowInstance;
import villagecompute.newsence.data.models.WorkflowInstance.WorkflowStatus;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.data.stores.WorkflowStore;
import villagecompute.newsence.exceptions.ResourceNotFoundException;

/**
 * Resolves a workflow handle to its status and, once complete, the enriched item.
 */
@ApplicationScoped
public class WorkflowStatusService {

    @Inject
    WorkflowStore workflowStore;

    @Inject
    ItemStore itemStore;

    /**
     * @throws ResourceNotFoundException
     *             if no instance has this id
     */
    public WorkflowStatusView status(UUID instanceId) {
        WorkflowInstance instance = workflowStore.findInstance(instanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow instance not found: " + instanceId));

        String status = instance.status.name().toLowerCase(Locale.ROOT);
        if (instance.status != WorkflowStatus.COMPLETE || instance.itemId == null) {
            return new WorkflowStatusView(status, instance.failureReason, null);
        }
        WorkflowStatusView.Item item = itemStore.findById(instance.itemId)
                .map(found -> new WorkflowStatusView.Item(found.id, found.url, found.title, found.titleLocalized,
                        found.summary, found.summaryLocalized, found.sourceType, found.topicId))
                .orElse(null);
        return new WorkflowStatusView(status, null, item);
    }
}
