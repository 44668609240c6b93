package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

class ContentAnalysisServiceTest {

    @Mock
    AiCompletionService completionService;

    private ContentAnalysisService service;
    private AutoCloseable mocks;

    private static final AnalysisInput INPUT = new AnalysisInput("Quantum networking reaches metro scale", "Example",
            null, null, null, "Some article body");

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new ContentAnalysisService();
        service.completionService = completionService;
        service.objectMapper = new ObjectMapper();
        service.targetLanguage = "Traditional Chinese";
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void testAnalyze_WellFormedResponse_Parsed() {
        when(completionService.complete(anyString(), any())).thenReturn("""
                Here you go:
                ```json
                {"tags": ["Quantum", "Networking"], "keywords": ["entanglement", "fiber"],
                 "title_en": "Quantum networking reaches metro scale", "title_localized": "量子網路達到都會規模",
                 "summary_en": "English summary", "summary_localized": "中文摘要", "category": "Science"}
                ```
                """);

        AnalysisResult result = service.analyze(INPUT);

        assertFalse(result.fallback());
        assertEquals(List.of("Quantum", "Networking"), result.tags());
        assertEquals("中文摘要", result.summaryLocalized());
        assertEquals("Science", result.category());
        assertEquals(List.of("Quantum", "Networking", "Science", "Extra"), result.tagsWithCategory("Extra"));
    }

    @Test
    void testAnalyze_MissingSummary_FallsBack() {
        when(completionService.complete(anyString(), any()))
                .thenReturn("{\"tags\": [\"A\"], \"keywords\": [], \"summary_en\": \"only english\"}");

        AnalysisResult result = service.analyze(INPUT);

        assertTrue(result.fallback(), "Missing localized summary fails the shape check");
    }

    @Test
    void testAnalyze_NoResponse_FallsBack() {
        when(completionService.complete(anyString(), any())).thenReturn(null);

        assertTrue(service.analyze(INPUT).fallback());
    }

    @Test
    void testFallback_DerivesFromTitle() {
        AnalysisResult result = ContentAnalysisService.fallback(INPUT);

        assertEquals(List.of(AnalysisResult.DEFAULT_CATEGORY), result.tags());
        assertEquals(List.of("Quantum", "networking", "reaches", "metro", "scale"), result.keywords());
        assertEquals("Quantum networking reaches metro scale...", result.summaryEn());
        assertEquals(result.summaryEn(), result.summaryLocalized());
        assertEquals(INPUT.title(), result.titleLocalized());
    }

    @Test
    void testFallback_PrefersExistingSummaries() {
        AnalysisInput input = new AnalysisInput("Title", null, "Existing summary", "既有摘要", "既有標題", null);

        AnalysisResult result = ContentAnalysisService.fallback(input);

        assertEquals("Existing summary", result.summaryEn());
        assertEquals("既有摘要", result.summaryLocalized());
        assertEquals("既有標題", result.titleLocalized());
    }

    @Test
    void testTranslateTweet_UnparseableResponse_KeepsOriginalText() {
        when(completionService.complete(anyString(), any())).thenReturn("not json at all");

        TweetTranslation translation = service.translateTweet("hello world");

        assertEquals("hello world", translation.summaryLocalized());
        assertEquals(List.of("Twitter"), translation.tags());
    }

    @Test
    void testTranslateContent_BlankInput_SkipsModel() {
        assertNull(service.translateContent("  "));
        verify(completionService, never()).complete(anyString(), any());
    }

    @Test
    void testTranslateContent_TrimsModelOutput() {
        when(completionService.complete(anyString(), any())).thenReturn("  譯文\n");

        assertEquals("譯文", service.translateContent("Some article text"));
    }
}
