package villagecompute.newsence.workflow;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.WorkflowCheckpoint;
import villagecompute.newsence.data.models.WorkflowCheckpoint.CheckpointStatus;
import villagecompute.newsence.data.stores.WorkflowStore;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.exceptions.WorkflowStepException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.observability.PipelineMetrics;

/**
 * Runs one workflow step with checkpointing, per-attempt timeout and exponential retry.
 *
 * <p>
 * <b>Replay:</b> the checkpoint {@code (instanceId, stepName)} is read first. A DONE checkpoint short-circuits the step
 * and returns the stored result, so a step's side effects happen at most once per successful attempt even when the
 * whole workflow is re-run after a crash.
 *
 * <p>
 * <b>Failures:</b> {@link ResourceNotFoundException} and {@link ValidationException} are terminal and rethrown at
 * once. Any other exception, including a timeout, consumes one attempt. When all attempts are used up the checkpoint is
 * marked FAILED and a {@link WorkflowStepException} is thrown.
 *
 * <p>
 * <b>Timeouts:</b> a timed-out attempt is interrupted, but JDBC and HTTP calls may ignore the interrupt. The next
 * attempt never starts while the previous one is still running: the executor waits up to the step's grace period for
 * it to end. An attempt that completes successfully within the grace period keeps its result, since its side effects
 * have already happened. An attempt still running after the grace period fails the step with no further attempts.
 */
@ApplicationScoped
public class StepExecutor {

    private static final Logger LOG = Logger.getLogger(StepExecutor.class);

    static final String RESULT_KEY = "value";
    private static final int MAX_ERROR_LENGTH = 1000;

    @Inject
    WorkflowStore workflowStore;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    PipelineMetrics metrics;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "newsence.workflow.step-backoff-enabled",
            defaultValue = "true")
    boolean backoffEnabled;

    Sleeper sleeper = Sleeper.THREAD;

    Function<WorkflowStep, Duration> timeouts = WorkflowStep::timeout;

    Function<WorkflowStep, Duration> graceTimeouts = WorkflowStep::timeout;

    private final ExecutorService executor = Context.taskWrapping(Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "workflow-step");
        thread.setDaemon(true);
        return thread;
    }));

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Executes {@code action} as {@code step} of the given instance, or returns its checkpointed result.
     *
     * @param resultType
     *            type the checkpointed JSON result is converted back to on replay
     * @throws ResourceNotFoundException
     *             terminal, from the action
     * @throws ValidationException
     *             terminal, from the action
     * @throws WorkflowStepException
     *             when every attempt failed
     */
    public <T> T execute(UUID instanceId, WorkflowStep step, Class<T> resultType, StepAction<T> action) {
        String name = step.stepName();
        Optional<WorkflowCheckpoint> existing = workflowStore.findCheckpoint(instanceId, name);
        if (existing.isPresent() && existing.get().status == CheckpointStatus.DONE) {
            LOG.debugf("Step %s of %s already done, replaying checkpoint", name, instanceId);
            metrics.recordStep(name, "replayed", null);
            return decode(existing.get().result, resultType);
        }

        int priorAttempts = existing.map(checkpoint -> checkpoint.attempts).orElse(0);
        int maxAttempts = step.retries() + 1;
        LoggingConfig.setWorkflowStep(name);
        try {
            Exception lastError = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                int recordedAttempts = priorAttempts + attempt;
                workflowStore.saveCheckpoint(instanceId, name, CheckpointStatus.PENDING, null, recordedAttempts,
                        errorText(lastError));

                long started = System.nanoTime();
                Span span = tracer.spanBuilder("workflow.step").setAttribute("workflow.instance", instanceId.toString())
                        .setAttribute("workflow.step", name).setAttribute("workflow.attempt", attempt).startSpan();
                try (Scope scope = span.makeCurrent()) {
                    T result = runWithTimeout(step, action);
                    workflowStore.saveCheckpoint(instanceId, name, CheckpointStatus.DONE, encode(result),
                            recordedAttempts, null);
                    metrics.recordStep(name, "done", Duration.ofNanos(System.nanoTime() - started));
                    return result;
                } catch (ResourceNotFoundException | ValidationException e) {
                    span.recordException(e);
                    workflowStore.saveCheckpoint(instanceId, name, CheckpointStatus.FAILED, null, recordedAttempts,
                            errorText(e));
                    metrics.recordStep(name, "terminal", Duration.ofNanos(System.nanoTime() - started));
                    throw e;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    span.recordException(e);
                    throw new WorkflowStepException(name, "Interrupted while running step " + name, e);
                } catch (AttemptStillRunningException e) {
                    span.recordException(e);
                    workflowStore.saveCheckpoint(instanceId, name, CheckpointStatus.FAILED, null, recordedAttempts,
                            errorText(e));
                    metrics.recordStep(name, "abandoned", Duration.ofNanos(System.nanoTime() - started));
                    LOG.errorf("Step %s of %s is still running after its grace period, not retrying", name,
                            instanceId);
                    throw new WorkflowStepException(name, e.getMessage(), e);
                } catch (Exception e) {
                    span.recordException(e);
                    lastError = e;
                    metrics.recordStep(name, "attempt_failed", Duration.ofNanos(System.nanoTime() - started));
                    LOG.warnf("Step %s attempt %d/%d failed for %s: %s", name, attempt, maxAttempts, instanceId,
                            e.getMessage());
                } finally {
                    span.end();
                }

                if (attempt < maxAttempts) {
                    pause(step, attempt);
                }
            }

            workflowStore.saveCheckpoint(instanceId, name, CheckpointStatus.FAILED, null, priorAttempts + maxAttempts,
                    errorText(lastError));
            metrics.recordStep(name, "failed", null);
            throw new WorkflowStepException(name, "Step " + name + " failed after " + maxAttempts + " attempts",
                    lastError);
        } finally {
            LoggingConfig.setWorkflowStep(null);
        }
    }

    private <T> T runWithTimeout(WorkflowStep step, StepAction<T> action) throws Exception {
        Attempt<T> attempt = new Attempt<>(action, MDC.getMap());
        Future<T> future = executor.submit(attempt);

        Duration timeout = timeouts.apply(step);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return awaitAbandoned(step, timeout, attempt);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw new IllegalStateException("Step " + step.stepName() + " raised an error", e.getCause());
        }
    }

    private <T> T awaitAbandoned(WorkflowStep step, Duration timeout, Attempt<T> attempt) throws Exception {
        Duration grace = graceTimeouts.apply(step);
        if (!attempt.finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new AttemptStillRunningException("Step " + step.stepName() + " still running "
                    + grace.toMillis() + "ms after its " + timeout.toMillis() + "ms timeout");
        }
        if (attempt.succeeded) {
            LOG.warnf("Step %s finished after its %dms timeout, keeping the late result", step.stepName(),
                    timeout.toMillis());
            return attempt.result;
        }
        throw new TimeoutException("Step " + step.stepName() + " timed out after " + timeout.toMillis() + "ms");
    }

    private void pause(WorkflowStep step, int attempt) {
        if (!backoffEnabled) {
            return;
        }
        try {
            sleeper.sleep(step.backoff(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowStepException(step.stepName(), "Interrupted during retry backoff", e);
        }
    }

    Map<String, Object> encode(Object result) {
        Map<String, Object> wrapped = new HashMap<>();
        wrapped.put(RESULT_KEY, result == null ? null : objectMapper.convertValue(result, Object.class));
        return wrapped;
    }

    <T> T decode(Map<String, Object> stored, Class<T> resultType) {
        Object value = stored == null ? null : stored.get(RESULT_KEY);
        return value == null ? null : objectMapper.convertValue(value, resultType);
    }

    private static String errorText(Exception error) {
        if (error == null) {
            return null;
        }
        String text = error.getClass().getSimpleName() + ": " + error.getMessage();
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }

    /**
     * One attempt of a step on the worker pool. {@code finished} opens when the action returns or throws, whether or not
     * the caller is still waiting for it.
     */
    private static final class Attempt<T> implements Callable<T> {

        private final StepAction<T> action;
        private final Map<String, Object> mdc;
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile boolean succeeded;
        private volatile T result;

        Attempt(StepAction<T> action, Map<String, Object> mdc) {
            this.action = action;
            this.mdc = mdc;
        }

        @Override
        public T call() throws Exception {
            mdc.forEach(MDC::put);
            try {
                T value = action.run();
                result = value;
                succeeded = true;
                return value;
            } finally {
                MDC.clear();
                finished.countDown();
            }
        }
    }

    private static final class AttemptStillRunningException extends Exception {

        private static final long serialVersionUID = 1L;

        AttemptStillRunningException(String message) {
            super(message);
        }
    }
}
