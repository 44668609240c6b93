package villagecompute.newsence.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.Topic;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.data.stores.SimilarItem;
import villagecompute.newsence.data.stores.TopicStats;
import villagecompute.newsence.data.stores.TopicStore;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.observability.PipelineMetrics;

/**
 * Assigns embedded items to topics by nearest-neighbour similarity.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 * <li>Skip items without an embedding or with a topic already (topics are assigned once, never re-clustered).</li>
 * <li>Find up to {@code max-candidates} other items published within the trailing {@code time-window-days} whose
 * cosine similarity is at least {@code similarity-threshold}.</li>
 * <li>No candidate: the item stays a singleton.</li>
 * <li>A candidate with a topic: the item joins the topic of the most similar such candidate.</li>
 * <li>Only topicless candidates: a new topic is created with the item as its canonical member, and the item plus all
 * candidates are assigned in one update. Items that gained a topic in the meantime keep it. If that update fails, or
 * assigns nothing, the topic is deleted again.</li>
 * </ol>
 * Member count and first/last seen are always recomputed from the items that actually carry the topic id.
 */
@ApplicationScoped
public class TopicClusteringService {

    private static final Logger LOG = Logger.getLogger(TopicClusteringService.class);

    @Inject
    ItemStore itemStore;

    @Inject
    TopicStore topicStore;

    @Inject
    PipelineMetrics metrics;

    @ConfigProperty(
            name = "newsence.topics.similarity-threshold",
            defaultValue = "0.85")
    double similarityThreshold;

    @ConfigProperty(
            name = "newsence.topics.time-window-days",
            defaultValue = "7")
    int timeWindowDays;

    @ConfigProperty(
            name = "newsence.topics.max-candidates",
            defaultValue = "10")
    int maxCandidates;

    Clock clock = Clock.systemUTC();

    public TopicAssignmentResult assignTopic(UUID itemId) {
        Optional<ContentItem> found = itemStore.findById(itemId);
        if (found.isEmpty()) {
            LOG.warnf("Item %s not found, skipping topic assignment", itemId);
            return skipped();
        }
        ContentItem item = found.get();
        if (item.embedding == null) {
            LOG.debugf("Item %s has no embedding, skipping topic assignment", itemId);
            return skipped();
        }
        if (item.topicId != null) {
            LOG.debugf("Item %s already belongs to topic %s", itemId, item.topicId);
            return skipped();
        }

        Instant since = clock.instant().minus(Duration.ofDays(timeWindowDays));
        List<SimilarItem> candidates = itemStore.findSimilar(itemId, item.embedding, similarityThreshold, since,
                maxCandidates);
        if (candidates.isEmpty()) {
            LOG.debugf("No similar items for %s, leaving it topicless", itemId);
            metrics.recordTopicAssignment("singleton");
            return TopicAssignmentResult.none();
        }

        Optional<SimilarItem> withTopic = candidates.stream().filter(candidate -> candidate.topicId() != null)
                .findFirst();
        if (withTopic.isPresent()) {
            return join(item, withTopic.get().topicId());
        }
        return create(item, candidates);
    }

    private TopicAssignmentResult join(ContentItem item, UUID topicId) {
        itemStore.assignTopic(List.of(item.id), topicId);
        TopicStats stats = refreshStats(topicId);
        boolean needsSynthesis = SynthesisPolicy.needsSynthesis(stats.memberCount(), false);
        LOG.infof("Item %s joined topic %s (members=%d, synthesis=%s)", item.id, topicId, stats.memberCount(),
                needsSynthesis);
        metrics.recordTopicAssignment("joined");
        return new TopicAssignmentResult(topicId, false, stats.memberCount(), needsSynthesis);
    }

    private TopicAssignmentResult create(ContentItem item, List<SimilarItem> candidates) {
        Instant now = clock.instant();
        Topic topic = new Topic();
        topic.title = item.title;
        topic.titleLocalized = item.titleLocalized;
        topic.canonicalItemId = item.id;
        topic.memberCount = candidates.size() + 1;
        topic.firstSeenAt = item.publishedAt != null ? item.publishedAt : now;
        topic.lastSeenAt = topic.firstSeenAt;
        Topic created = topicStore.create(topic);

        List<UUID> memberIds = new ArrayList<>(candidates.size() + 1);
        memberIds.add(item.id);
        candidates.forEach(candidate -> memberIds.add(candidate.id()));
        int assigned;
        try {
            assigned = itemStore.assignTopic(memberIds, created.id);
        } catch (DatastoreException e) {
            LOG.errorf(e, "Failed to assign %d items to new topic %s, rolling back", memberIds.size(), created.id);
            rollback(created.id);
            metrics.recordTopicAssignment("rolled_back");
            return TopicAssignmentResult.none();
        }
        if (assigned == 0) {
            // every member was claimed by another topic in the meantime
            LOG.warnf("No items left to assign to new topic %s, deleting it", created.id);
            rollback(created.id);
            metrics.recordTopicAssignment("rolled_back");
            return TopicAssignmentResult.none();
        }

        TopicStats stats = refreshStats(created.id);
        boolean needsSynthesis = SynthesisPolicy.needsSynthesis(stats.memberCount(), true);
        LOG.infof("Created topic %s from item %s with %d members", created.id, item.id, stats.memberCount());
        metrics.recordTopicAssignment("created");
        return new TopicAssignmentResult(created.id, true, stats.memberCount(), needsSynthesis);
    }

    private TopicStats refreshStats(UUID topicId) {
        TopicStats stats = itemStore.computeTopicStats(topicId);
        topicStore.updateStats(topicId, stats);
        return stats;
    }

    private void rollback(UUID topicId) {
        try {
            topicStore.delete(topicId);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to delete orphan topic %s", topicId);
        }
    }

    private TopicAssignmentResult skipped() {
        metrics.recordTopicAssignment("skipped");
        return TopicAssignmentResult.none();
    }
}
