package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.newsence.data.models.VideoTranscript;
import villagecompute.newsence.data.stores.TranscriptStore;

class VideoHighlightsServiceTest {

    private static final String VIDEO_ID = "dQw4w9WgXcQ";

    @Mock
    TranscriptStore transcriptStore;

    @Mock
    AiCompletionService completionService;

    @Mock
    ContentAnalysisService analysisService;

    private VideoHighlightsService service;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        service = new VideoHighlightsService();
        service.transcriptStore = transcriptStore;
        service.completionService = completionService;
        service.analysisService = analysisService;
        service.objectMapper = objectMapper;
        when(analysisService.targetLanguage()).thenReturn("Traditional Chinese");
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static VideoTranscript transcript() {
        VideoTranscript transcript = new VideoTranscript();
        transcript.videoId = VIDEO_ID;
        transcript.transcript = "[00:00] Intro\n[01:30] Main point\n[04:10] Wrap up";
        return transcript;
    }

    @Test
    void testGenerate_StoresParsedHighlights() {
        when(transcriptStore.findByVideoId(VIDEO_ID)).thenReturn(Optional.of(transcript()));
        when(completionService.complete(anyString(), any())).thenReturn("""
                [{"start": "00:00", "title": "開場", "summary": "介紹"},
                 {"start": "01:30", "title": "重點"},
                 {"title": "missing start"}]
                """);

        int stored = service.generate(VIDEO_ID);

        assertEquals(2, stored);
        verify(transcriptStore).saveHighlights(eq(VIDEO_ID), anyList());
    }

    @Test
    void testGenerate_NoTranscript_ReturnsZero() {
        when(transcriptStore.findByVideoId(VIDEO_ID)).thenReturn(Optional.empty());

        assertEquals(0, service.generate(VIDEO_ID));
        verify(completionService, never()).complete(anyString(), any());
    }

    @Test
    void testGenerate_MalformedResponse_StoresNothing() {
        when(transcriptStore.findByVideoId(VIDEO_ID)).thenReturn(Optional.of(transcript()));
        when(completionService.complete(anyString(), any())).thenReturn("I could not find any chapters.");

        assertEquals(0, service.generate(VIDEO_ID));
        verify(transcriptStore, never()).saveHighlights(anyString(), anyList());
    }

    @Test
    void testParse_CapsAtMaxAndDefaultsSummary() throws Exception {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 12; i++) {
            json.append(i > 0 ? "," : "").append("{\"start\": \"0").append(i % 10).append(":00\", \"title\": \"t")
                    .append(i).append("\"}");
        }
        json.append("]");

        List<Map<String, Object>> highlights = VideoHighlightsService.parse(objectMapper.readTree(json.toString()));

        assertEquals(VideoHighlightsService.MAX_HIGHLIGHTS, highlights.size());
        assertEquals("", highlights.get(0).get("summary"));
        assertEquals("t0", highlights.get(0).get("title"));
    }
}
