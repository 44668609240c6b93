package villagecompute.newsence.jobs;

import java.util.HashMap;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Scheduler for social list polling (every 15 minutes).
 */
@ApplicationScoped
public class SocialFeedRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(SocialFeedRefreshScheduler.class);

    @Inject
    SocialFeedRefreshJobHandler handler;

    @Scheduled(
            every = "15m",
            identity = "social-feed-refresh")
    void refreshLists() {
        LOG.debugf("Social refresh scheduler triggered");

        try {
            handler.execute(System.currentTimeMillis(), new HashMap<>());
        } catch (Exception e) {
            LOG.errorf(e, "Social refresh scheduler failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }
}
