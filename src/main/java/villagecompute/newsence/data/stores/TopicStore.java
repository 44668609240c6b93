package villagecompute.newsence.data.stores;

import villagecompute.newsence.data.models.Topic;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence seam for topics.
 */
public interface TopicStore {

    /**
     * Inserts a topic, assigning its id and audit timestamps.
     */
    Topic create(Topic topic);

    Optional<Topic> findById(UUID id);

    void delete(UUID id);

    void updateStats(UUID id, TopicStats stats);

    void updateDisplay(UUID id, String title, String titleLocalized, String description, String descriptionLocalized,
            Instant updatedAt);
}
