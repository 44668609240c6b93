package villagecompute.newsence.processors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.newsence.TestConstants;
import villagecompute.newsence.TestFixtures;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.services.AnalysisResult;
import villagecompute.newsence.services.ContentAnalysisService;

class DefaultItemProcessorTest {

    @Mock
    ContentAnalysisService analysisService;

    @InjectMocks
    DefaultItemProcessor processor;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(analysisService.analyze(any())).thenReturn(new AnalysisResult(List.of("Quantum", "Networks"),
                List.of("entanglement", "fiber"), "Quantum networks go metro", "量子網路走向城市",
                "Three quantum memories were linked.", "三個量子記憶體被連接。", "Research", false));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void testProcess_FreshItem_FillsEveryField() {
        ContentItem item = TestFixtures.article(TestConstants.ITEM_ID);

        ProcessorResult result = processor.process(item);

        ItemUpdate update = result.update();
        assertEquals(List.of("Quantum", "Networks", "Research"), update.tags());
        assertEquals(List.of("entanglement", "fiber"), update.keywords());
        assertEquals("Quantum networks go metro", update.title());
        assertEquals("量子網路走向城市", update.titleLocalized());
        assertEquals("Three quantum memories were linked.", update.summary());
        assertEquals("三個量子記憶體被連接。", update.summaryLocalized());
        assertTrue(result.enrichments().isEmpty());
    }

    @Test
    void testProcess_AlreadyEnrichedItem_KeepsExistingFields() {
        ContentItem item = TestFixtures.article(TestConstants.ITEM_ID);
        item.tags = List.of("Physics");
        item.keywords = List.of("qubits");
        item.titleLocalized = "已翻譯的標題";
        item.summary = "Existing summary";
        item.summaryLocalized = "既有摘要";

        ItemUpdate update = processor.process(item).update();

        assertNull(update.tags());
        assertNull(update.keywords());
        assertNull(update.title());
        assertNull(update.titleLocalized());
        assertNull(update.summary());
        assertNull(update.summaryLocalized());
        assertTrue(update.isEmpty());
    }
}
