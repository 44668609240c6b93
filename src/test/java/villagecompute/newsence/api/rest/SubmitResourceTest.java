package villagecompute.newsence.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
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
import villagecompute.newsence.api.types.SubmitRequestType;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.RateLimitException;
import villagecompute.newsence.services.SubmissionService;

class SubmitResourceTest {

    @Mock
    SubmissionService submissionService;

    @InjectMocks
    SubmitResource resource;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(submissionService.maxBatchSize()).thenReturn(20);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static SubmitRequestType single() {
        return new SubmitRequestType(TestConstants.ARTICLE_URL, null, null);
    }

    @Test
    void testSubmit_DatastoreFailure_Returns500WithDatastoreCode() {
        when(submissionService.submit(anyList(), any(), any())).thenThrow(new DatastoreException("insert failed"));

        Response response = resource.submit(single(), null, null);

        assertEquals(500, response.getStatus());
        assertEquals(ApiErrorType.DATASTORE_ERROR, ((ApiErrorType) response.getEntity()).error().code());
    }

    @Test
    void testSubmit_RateLimited_Returns429() {
        when(submissionService.submit(anyList(), any(), any()))
                .thenThrow(new RateLimitException("Too many submit requests. Retry in 42s", 42));

        Response response = resource.submit(single(), null, null);

        assertEquals(429, response.getStatus());
        assertEquals(ApiErrorType.RATE_LIMITED, ((ApiErrorType) response.getEntity()).error().code());
    }

    @Test
    void testSubmit_OversizedBatch_RejectedBeforeAdmission() {
        when(submissionService.maxBatchSize()).thenReturn(1);
        SubmitRequestType request = new SubmitRequestType(null,
                List.of(TestConstants.ARTICLE_URL, TestConstants.YOUTUBE_URL), null);

        Response response = resource.submit(request, null, null);

        assertEquals(400, response.getStatus());
        assertEquals(ApiErrorType.BATCH_TOO_LARGE, ((ApiErrorType) response.getEntity()).error().code());
    }
}
