package villagecompute.newsence.workflow;

import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.WorkflowInstance;
import villagecompute.newsence.data.stores.WorkflowStore;
import villagecompute.newsence.jobs.JobType;
import villagecompute.newsence.services.DelayedJobService;

/**
 * Creates workflow instances and schedules their execution as {@link JobType#WORKFLOW_RUN} jobs.
 */
@ApplicationScoped
public class WorkflowLauncher {

    private static final Logger LOG = Logger.getLogger(WorkflowLauncher.class);

    public static final String INSTANCE_ID_KEY = "instanceId";

    @Inject
    WorkflowStore workflowStore;

    @Inject
    DelayedJobService jobService;

    /**
     * @return the new instance id, which is also the status-query handle
     */
    public UUID launch(UUID itemId, String sourceType) {
        WorkflowInstance instance = workflowStore.createInstance(itemId, sourceType);
        jobService.enqueue(JobType.WORKFLOW_RUN, Map.of(INSTANCE_ID_KEY, instance.id.toString()));
        LOG.debugf("Launched workflow %s for item %s (%s)", instance.id, itemId, sourceType);
        return instance.id;
    }
}
