package villagecompute.newsence.jobs;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.newsence.TestConstants;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.queue.ItemProcessMessage;
import villagecompute.newsence.workflow.WorkflowLauncher;

class ItemProcessJobHandlerTest {

    @Mock
    WorkflowLauncher launcher;

    @Mock
    Tracer tracer;

    @InjectMocks
    ItemProcessJobHandler handler;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(tracer.spanBuilder(anyString())).thenReturn(TracerProvider.noop().get("test").spanBuilder("test"));
        when(launcher.launch(any(), anyString())).thenReturn(TestConstants.INSTANCE_ID);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void testExecute_ValidMessage_LaunchesWorkflow() throws Exception {
        Map<String, Object> payload = new ItemProcessMessage(TestConstants.ITEM_ID, "youtube").toPayload();

        handler.execute(1L, payload);

        verify(launcher).launch(TestConstants.ITEM_ID, "youtube");
    }

    @Test
    void testExecute_MissingSourceType_UsesDefault() throws Exception {
        handler.execute(2L, Map.of("itemId", TestConstants.ITEM_ID.toString()));

        verify(launcher).launch(TestConstants.ITEM_ID, "default");
    }

    @Test
    void testExecute_MissingItemId_IsValidationError() {
        assertThrows(ValidationException.class, () -> handler.execute(3L, Map.of("sourceType", "rss")));
        verify(launcher, never()).launch(any(UUID.class), anyString());
    }

    @Test
    void testExecute_MalformedItemId_IsValidationError() {
        assertThrows(ValidationException.class, () -> handler.execute(4L, Map.of("itemId", "not-a-uuid")));
    }
}
