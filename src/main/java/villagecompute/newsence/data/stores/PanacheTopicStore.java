package villagecompute.newsence.data.stores;

import io.quarkus.narayana.jta.QuarkusTransaction;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import villagecompute.newsence.data.models.Topic;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of {@link TopicStore}. Each write commits in its own transaction.
 */
@ApplicationScoped
public class PanacheTopicStore implements TopicStore {

    @Override
    public Topic create(Topic topic) {
        QuarkusTransaction.requiringNew().run(() -> {
            if (topic.id == null) {
                topic.id = UUID.randomUUID();
            }
            topic.createdAt = Instant.now();
            topic.updatedAt = topic.createdAt;
            topic.persist();
        });
        return topic;
    }

    @Override
    @Transactional
    public Optional<Topic> findById(UUID id) {
        return Topic.findByIdOptional(id);
    }

    @Override
    public void delete(UUID id) {
        QuarkusTransaction.requiringNew().run(() -> Topic.deleteById(id));
    }

    @Override
    public void updateStats(UUID id, TopicStats stats) {
        QuarkusTransaction.requiringNew().run(() -> {
            Topic topic = Topic.findById(id);
            if (topic != null) {
                topic.memberCount = stats.memberCount();
                topic.firstSeenAt = stats.firstSeenAt();
                topic.lastSeenAt = stats.lastSeenAt();
                topic.updatedAt = Instant.now();
            }
        });
    }

    @Override
    public void updateDisplay(UUID id, String title, String titleLocalized, String description,
            String descriptionLocalized, Instant updatedAt) {
        QuarkusTransaction.requiringNew().run(() -> {
            Topic topic = Topic.findById(id);
            if (topic != null) {
                topic.title = title;
                topic.titleLocalized = titleLocalized;
                topic.description = description;
                topic.descriptionLocalized = descriptionLocalized;
                topic.updatedAt = updatedAt;
            }
        });
    }
}
