package villagecompute.newsence.jobs;

import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.WorkflowInstance.WorkflowStatus;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.workflow.WorkflowLauncher;
import villagecompute.newsence.workflow.WorkflowOrchestrator;

/**
 * Executes one workflow instance. A redelivered job replays completed steps from their checkpoints.
 */
@ApplicationScoped
public class WorkflowRunJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(WorkflowRunJobHandler.class);

    @Inject
    WorkflowOrchestrator orchestrator;

    @Override
    public JobType handlesType() {
        return JobType.WORKFLOW_RUN;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        Object raw = payload.get(WorkflowLauncher.INSTANCE_ID_KEY);
        UUID instanceId;
        try {
            instanceId = UUID.fromString(String.valueOf(raw));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid workflow instance id: " + raw, e);
        }

        try {
            LoggingConfig.setJobId(jobId);
            WorkflowStatus status = orchestrator.run(instanceId);
            LOG.debugf("Workflow job %d finished instance %s as %s", jobId, instanceId, status);
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
