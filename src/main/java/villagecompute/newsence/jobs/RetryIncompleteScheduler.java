package villagecompute.newsence.jobs;

import java.util.HashMap;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Hourly scheduler for the incomplete-item sweep.
 */
@ApplicationScoped
public class RetryIncompleteScheduler {

    private static final Logger LOG = Logger.getLogger(RetryIncompleteScheduler.class);

    @Inject
    RetryIncompleteJobHandler handler;

    @Scheduled(
            cron = "0 0 * * * ?",
            identity = "retry-incomplete")
    void sweep() {
        try {
            handler.execute(System.currentTimeMillis(), new HashMap<>());
        } catch (Exception e) {
            LOG.errorf(e, "Incomplete item sweep failed: %s", e.getMessage());
            // Swallow exception to prevent scheduler from being disabled
        }
    }
}
