package villagecompute.newsence.exceptions;

/**
 * Exception thrown when a workflow step exhausts its retry budget.
 *
 * <p>
 * Extends RuntimeException per project standards. The orchestrator marks the instance ERRORED and never attempts the
 * steps that follow.
 */
public class WorkflowStepException extends RuntimeException {

    private final String stepName;

    public WorkflowStepException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
