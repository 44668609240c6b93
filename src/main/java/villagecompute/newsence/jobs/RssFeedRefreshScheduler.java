package villagecompute.newsence.jobs;

import java.util.HashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Scheduler for feed refresh.
 *
 * <p>
 * Runs every 10 minutes and invokes {@link RssFeedRefreshJobHandler} directly with an empty payload, refreshing all
 * active feeds in one execution. Manual refreshes can enqueue a {@link JobType#RSS_FEED_REFRESH} job instead.
 */
@ApplicationScoped
public class RssFeedRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(RssFeedRefreshScheduler.class);

    @Inject
    RssFeedRefreshJobHandler handler;

    @Scheduled(
            every = "10m",
            identity = "rss-feed-refresh")
    void refreshFeeds() {
        LOG.debugf("Feed refresh scheduler triggered");

        try {
            Map<String, Object> payload = new HashMap<>();
            handler.execute(System.currentTimeMillis(), payload);
        } catch (Exception e) {
            LOG.errorf(e, "Feed refresh scheduler failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }
}
