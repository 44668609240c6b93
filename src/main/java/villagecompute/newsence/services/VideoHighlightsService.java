package villagecompute.newsence.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.VideoTranscript;
import villagecompute.newsence.data.stores.TranscriptStore;
import villagecompute.newsence.exceptions.MalformedResponseException;
import villagecompute.newsence.util.AiResponseParser;

/**
 * Chapter highlights for videos, derived from the stored transcript.
 *
 * <p>
 * Each highlight is {@code {start, title, summary}} where {@code start} is the {@code mm:ss} or {@code h:mm:ss}
 * position the model read from the transcript's timestamps. Highlights are generated at most once per video.
 */
@ApplicationScoped
public class VideoHighlightsService {

    private static final Logger LOG = Logger.getLogger(VideoHighlightsService.class);

    static final int MAX_HIGHLIGHTS = 8;
    static final int MAX_TRANSCRIPT_CHARS = 20000;

    private static final CompletionOptions OPTIONS = CompletionOptions.of(1500, 0.3);

    @Inject
    TranscriptStore transcriptStore;

    @Inject
    AiCompletionService completionService;

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * Generates and stores highlights for a video.
     *
     * @return number of highlights stored; 0 when there is no transcript, highlights already exist, the model is
     *         unavailable or its answer is unusable
     */
    public int generate(String videoId) {
        Optional<VideoTranscript> found = transcriptStore.findByVideoId(videoId);
        if (found.isEmpty()) {
            LOG.debugf("No transcript stored for video %s", videoId);
            return 0;
        }
        VideoTranscript transcript = found.get();
        if (transcript.hasHighlights()) {
            LOG.infof("Highlights already exist for video %s, skipping", videoId);
            return 0;
        }
        if (transcript.transcript == null || transcript.transcript.isBlank()) {
            return 0;
        }

        String response = completionService.complete(buildPrompt(transcript.transcript), OPTIONS);
        if (response == null || response.isBlank()) {
            return 0;
        }

        List<Map<String, Object>> highlights;
        try {
            highlights = parse(AiResponseParser.extractArray(objectMapper, response));
        } catch (MalformedResponseException e) {
            LOG.warnf("Discarding highlights for video %s: %s", videoId, e.getMessage());
            return 0;
        }
        if (highlights.isEmpty()) {
            return 0;
        }

        transcriptStore.saveHighlights(videoId, highlights);
        LOG.infof("Stored %d highlights for video %s", highlights.size(), videoId);
        return highlights.size();
    }

    static List<Map<String, Object>> parse(JsonNode array) {
        List<Map<String, Object>> highlights = new ArrayList<>();
        for (JsonNode entry : array) {
            if (highlights.size() >= MAX_HIGHLIGHTS) {
                break;
            }
            String start = AiResponseParser.text(entry, "start");
            String title = AiResponseParser.text(entry, "title");
            if (start == null || title == null) {
                continue;
            }
            Map<String, Object> highlight = new LinkedHashMap<>();
            highlight.put("start", start);
            highlight.put("title", title);
            String summary = AiResponseParser.text(entry, "summary");
            highlight.put("summary", summary == null ? "" : summary);
            highlights.add(highlight);
        }
        return highlights;
    }

    private String buildPrompt(String transcript) {
        return String.format("""
                Below is a timestamped video transcript. Pick the %1$d most important moments and write a chapter
                highlight for each, in %2$s.

                TRANSCRIPT:
                %3$s

                Respond with ONLY a JSON array, ordered by time:
                [
                  {"start": "mm:ss", "title": "short chapter title", "summary": "one sentence"}
                ]
                """, MAX_HIGHLIGHTS, analysisService.targetLanguage(),
                ContentAnalysisService.truncate(transcript, MAX_TRANSCRIPT_CHARS));
    }
}
