package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import jakarta.enterprise.inject.Instance;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.jobs.JobHandler;
import villagecompute.newsence.jobs.JobType;

class DelayedJobServiceTest {

    private JobHandler itemHandler;
    private DelayedJobService service;
    private final List<DelayedJobService> started = new ArrayList<>();

    @SuppressWarnings("unchecked")
    private static Instance<JobHandler> handlers(JobHandler... handlers) {
        Instance<JobHandler> instance = mock(Instance.class);
        when(instance.iterator()).thenAnswer(invocation -> List.of(handlers).iterator());
        return instance;
    }

    private static JobHandler handlerFor(JobType type) {
        JobHandler handler = mock(JobHandler.class);
        when(handler.handlesType()).thenReturn(type);
        return handler;
    }

    @BeforeEach
    void setUp() {
        itemHandler = handlerFor(JobType.ITEM_PROCESS);
        service = new DelayedJobService(handlers(itemHandler, handlerFor(JobType.WORKFLOW_RUN)));
        Tracer tracer = mock(Tracer.class);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        service.tracer = tracer;
    }

    @AfterEach
    void tearDown() {
        started.forEach(DelayedJobService::stopWorkers);
    }

    private DelayedJobService startedService(int workerThreads, JobHandler... handlers) {
        DelayedJobService jobs = new DelayedJobService(handlers(handlers));
        jobs.tracer = service.tracer;
        jobs.workerThreads = workerThreads;
        jobs.startWorkers();
        started.add(jobs);
        DelayedJobService spied = spy(jobs);
        doNothing().when(spied).markCompleted(anyLong());
        doNothing().when(spied).recordFailure(any(), any());
        return spied;
    }

    @Test
    void testConstructor_RegistersHandlersByType() {
        assertTrue(service.hasHandler(JobType.ITEM_PROCESS));
        assertTrue(service.hasHandler(JobType.WORKFLOW_RUN));
        assertFalse(service.hasHandler(JobType.RSS_FEED_REFRESH));
    }

    @Test
    void testConstructor_DuplicateHandlers_Fails() {
        Instance<JobHandler> duplicates = handlers(handlerFor(JobType.ITEM_PROCESS),
                handlerFor(JobType.ITEM_PROCESS));

        assertThrows(IllegalStateException.class, () -> new DelayedJobService(duplicates));
    }

    @Test
    void testExecuteJob_DispatchesPayloadToHandler() throws Exception {
        Map<String, Object> payload = Map.of("itemId", "00000000-0000-0000-0000-00000000a001");

        service.executeJob(JobType.ITEM_PROCESS, 7L, payload, 1);

        verify(itemHandler).execute(7L, payload);
    }

    @Test
    void testExecuteJob_HandlerFailure_Propagates() throws Exception {
        ValidationException failure = new ValidationException("bad payload");
        doThrow(failure).when(itemHandler).execute(8L, Map.of());

        ValidationException thrown = assertThrows(ValidationException.class,
                () -> service.executeJob(JobType.ITEM_PROCESS, 8L, Map.of(), 1));

        assertSame(failure, thrown);
    }

    @Test
    void testExecuteJob_NoHandler_Fails() {
        assertThrows(IllegalStateException.class,
                () -> service.executeJob(JobType.RSS_FEED_REFRESH, 9L, Map.of(), 1));
    }

    @Test
    void testCalculateBackoffDelay_GrowsExponentiallyWithJitter() {
        for (int attempt = 1; attempt <= 4; attempt++) {
            double base = Math.pow(2, attempt) * 30;
            long delay = service.calculateBackoffDelay(attempt);
            assertTrue(delay >= (long) (base * 0.75) && delay <= (long) (base * 1.25),
                    "Attempt " + attempt + " delay " + delay + " outside jitter range");
        }
    }

    @Test
    void testDispatch_WorkflowJobs_RunConcurrently() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        JobHandler workflowHandler = handlerFor(JobType.WORKFLOW_RUN);
        doAnswer(invocation -> {
            bothRunning.countDown();
            if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Workflow job ran alone");
            }
            return null;
        }).when(workflowHandler).execute(anyLong(), anyMap());
        DelayedJobService jobs = startedService(2, workflowHandler);

        assertEquals(2, jobs.reserve(10));
        jobs.dispatch(new DelayedJobService.ClaimedJob(1L, JobType.WORKFLOW_RUN, Map.of(), 1));
        jobs.dispatch(new DelayedJobService.ClaimedJob(2L, JobType.WORKFLOW_RUN, Map.of(), 1));

        verify(jobs, timeout(5000)).markCompleted(1L);
        verify(jobs, timeout(5000)).markCompleted(2L);
        verify(jobs, never()).recordFailure(any(), any());
    }

    @Test
    void testReserve_NeverExceedsIdleWorkers() throws Exception {
        DelayedJobService jobs = startedService(1, handlerFor(JobType.WORKFLOW_RUN));

        assertEquals(1, jobs.reserve(10));
        assertEquals(0, jobs.reserve(10), "Busy pool must not claim more jobs");

        jobs.dispatch(new DelayedJobService.ClaimedJob(3L, JobType.WORKFLOW_RUN, Map.of(), 1));
        verify(jobs, timeout(5000)).markCompleted(3L);

        long deadline = System.currentTimeMillis() + 5000;
        int reserved = 0;
        while (reserved == 0 && System.currentTimeMillis() < deadline) {
            reserved = jobs.reserve(1);
            Thread.sleep(10);
        }
        assertEquals(1, reserved, "Slot is released once the job ends");
    }

    @Test
    void testDispatch_HandlerFailure_RecordsFailureInsteadOfCompleting() throws Exception {
        JobHandler workflowHandler = handlerFor(JobType.WORKFLOW_RUN);
        IllegalStateException failure = new IllegalStateException("store unavailable");
        doThrow(failure).when(workflowHandler).execute(anyLong(), anyMap());
        DelayedJobService jobs = startedService(1, workflowHandler);

        jobs.reserve(1);
        DelayedJobService.ClaimedJob job = new DelayedJobService.ClaimedJob(4L, JobType.WORKFLOW_RUN, Map.of(), 1);
        jobs.dispatch(job);

        verify(jobs, timeout(5000)).recordFailure(eq(job), eq(failure));
        verify(jobs, never()).markCompleted(anyLong());
    }
}
