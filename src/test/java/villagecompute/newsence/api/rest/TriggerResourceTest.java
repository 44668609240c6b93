package villagecompute.newsence.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import villagecompute.newsence.TestConstants;
import villagecompute.newsence.api.types.ApiErrorType;
import villagecompute.newsence.api.types.TriggerRequestType;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.jobs.RetryIncompleteJobHandler;
import villagecompute.newsence.queue.ItemQueue;

class TriggerResourceTest {

    @Mock
    ItemQueue itemQueue;

    @Mock
    RetryIncompleteJobHandler retryIncomplete;

    @InjectMocks
    TriggerResource resource;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void testTrigger_ListedItems_QueuedAsBatch() {
        Response response = resource.trigger(new TriggerRequestType(List.of(TestConstants.ITEM_ID), "operator"));

        assertEquals(202, response.getStatus());
        verify(itemQueue).send(any());
        verify(retryIncomplete, never()).requeueIncomplete();
    }

    @Test
    void testTrigger_QueueWriteFails_ReturnsDatastoreError() {
        when(itemQueue.send(any())).thenThrow(new DatastoreException("Failed to enqueue BATCH_PROCESS"));

        Response response = resource.trigger(new TriggerRequestType(List.of(TestConstants.ITEM_ID), "operator"));

        assertEquals(500, response.getStatus());
        ApiErrorType body = (ApiErrorType) response.getEntity();
        assertEquals(ApiErrorType.DATASTORE_ERROR, body.error().code());
    }

    @Test
    void testTrigger_UnexpectedFailure_ReturnsInternalError() {
        when(retryIncomplete.requeueIncomplete()).thenThrow(new IllegalStateException("boom"));

        Response response = resource.trigger(new TriggerRequestType(List.of(), null));

        assertEquals(500, response.getStatus());
        assertEquals(ApiErrorType.INTERNAL_ERROR, ((ApiErrorType) response.getEntity()).error().code());
    }
}
