package villagecompute.newsence.workflow;

/**
 * Body of a workflow step. May return null, which is checkpointed like any other result.
 */
@FunctionalInterface
public interface StepAction<T> {

    T run() throws Exception;
}
