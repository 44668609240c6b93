package villagecompute.newsence.data.stores;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import villagecompute.newsence.data.models.Topic;

/**
 * Map-backed {@link TopicStore} for unit tests.
 */
public class InMemoryTopicStore implements TopicStore {

    public final Map<UUID, Topic> topics = new LinkedHashMap<>();

    public int deleteCalls;

    @Override
    public Topic create(Topic topic) {
        if (topic.id == null) {
            topic.id = UUID.randomUUID();
        }
        Instant now = Instant.now();
        topic.createdAt = now;
        topic.updatedAt = now;
        topics.put(topic.id, topic);
        return topic;
    }

    @Override
    public Optional<Topic> findById(UUID id) {
        return Optional.ofNullable(topics.get(id));
    }

    @Override
    public void delete(UUID id) {
        deleteCalls++;
        topics.remove(id);
    }

    @Override
    public void updateStats(UUID id, TopicStats stats) {
        Topic topic = topics.get(id);
        if (topic != null) {
            topic.memberCount = stats.memberCount();
            topic.firstSeenAt = stats.firstSeenAt();
            topic.lastSeenAt = stats.lastSeenAt();
        }
    }

    @Override
    public void updateDisplay(UUID id, String title, String titleLocalized, String description,
            String descriptionLocalized, Instant updatedAt) {
        Topic topic = topics.get(id);
        if (topic != null) {
            topic.title = title;
            topic.titleLocalized = titleLocalized;
            topic.description = description;
            topic.descriptionLocalized = descriptionLocalized;
            topic.updatedAt = updatedAt;
        }
    }
}
