package villagecompute.newsence.services;

import java.util.UUID;

/**
 * Outcome of {@link TopicClusteringService#assignTopic(UUID)}. Checkpointed by the workflow, so it must stay a plain
 * JSON-friendly record.
 *
 * @param topicId
 *            topic the item now belongs to, or null when nothing was assigned
 * @param newTopic
 *            whether the topic was created by this call
 * @param memberCount
 *            member count recomputed from the items carrying the topic id
 * @param needsSynthesis
 *            whether the topic headline should be regenerated now
 */
public record TopicAssignmentResult(UUID topicId, boolean newTopic, int memberCount, boolean needsSynthesis) {

    public static TopicAssignmentResult none() {
        return new TopicAssignmentResult(null, false, 0, false);
    }

    public boolean assigned() {
        return topicId != null;
    }
}
