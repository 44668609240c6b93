package villagecompute.newsence.data.stores;

import java.time.Instant;

/**
 * Member statistics of a topic, computed from the items that actually carry its id.
 */
public record TopicStats(int memberCount, Instant firstSeenAt, Instant lastSeenAt) {
}
