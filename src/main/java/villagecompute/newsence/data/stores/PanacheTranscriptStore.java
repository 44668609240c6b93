package villagecompute.newsence.data.stores;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.newsence.data.models.VideoTranscript;
import villagecompute.newsence.exceptions.DatastoreException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link TranscriptStore}.
 */
@ApplicationScoped
public class PanacheTranscriptStore implements TranscriptStore {

    @Override
    @Transactional
    public Optional<VideoTranscript> findByVideoId(String videoId) {
        return VideoTranscript.findByVideoId(videoId);
    }

    @Override
    public void saveHighlights(String videoId, List<Map<String, Object>> highlights) {
        try {
            QuarkusTransaction.requiringNew().run(() -> VideoTranscript.findByVideoId(videoId).ifPresent(transcript -> {
                transcript.highlights = highlights;
                transcript.highlightsGeneratedAt = Instant.now();
            }));
        } catch (RuntimeException e) {
            throw new DatastoreException("Failed to save highlights for video " + videoId, e);
        }
    }
}
