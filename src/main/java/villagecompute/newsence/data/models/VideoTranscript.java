package villagecompute.newsence.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transcript of a video item and the chapter highlights derived from it.
 *
 * <p>
 * Transcripts are written by the video extractor collaborator; the workflow only adds {@code highlights}.
 */
@Entity
@Table(
        name = "video_transcripts")
@NamedQuery(
        name = VideoTranscript.QUERY_FIND_BY_VIDEO_ID,
        query = VideoTranscript.JPQL_FIND_BY_VIDEO_ID)
public class VideoTranscript extends PanacheEntityBase {

    public static final String JPQL_FIND_BY_VIDEO_ID = "FROM VideoTranscript WHERE videoId = :videoId";
    public static final String QUERY_FIND_BY_VIDEO_ID = "VideoTranscript.findByVideoId";

    @Id
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "video_id",
            nullable = false,
            unique = true)
    public String videoId;

    @Column(
            name = "item_id")
    public UUID itemId;

    @Column(
            columnDefinition = "text")
    public String transcript;

    @Column(
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<Map<String, Object>> highlights;

    @Column(
            name = "highlights_generated_at")
    public Instant highlightsGeneratedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static Optional<VideoTranscript> findByVideoId(String videoId) {
        if (videoId == null || videoId.isBlank()) {
            return Optional.empty();
        }
        return find("#" + QUERY_FIND_BY_VIDEO_ID, Parameters.with("videoId", videoId)).firstResultOptional();
    }

    public boolean hasHighlights() {
        return highlights != null && !highlights.isEmpty();
    }
}
