package villagecompute.newsence.data.stores;

import villagecompute.newsence.data.models.VideoTranscript;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence seam for video transcripts and their highlights.
 */
public interface TranscriptStore {

    Optional<VideoTranscript> findByVideoId(String videoId);

    void saveHighlights(String videoId, List<Map<String, Object>> highlights);
}
