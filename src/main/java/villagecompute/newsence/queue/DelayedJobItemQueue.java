package villagecompute.newsence.queue;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.services.DelayedJobService;

/**
 * {@link ItemQueue} backed by the {@code delayed_jobs} table.
 */
@ApplicationScoped
public class DelayedJobItemQueue implements ItemQueue {

    private static final Logger LOG = Logger.getLogger(DelayedJobItemQueue.class);

    @Inject
    DelayedJobService delayedJobService;

    @Override
    public long send(QueueMessage message) {
        long jobId = delayedJobService.enqueue(message.jobType(), message.toPayload());
        LOG.debugf("Queued %s as job %d", message.toPayload().get(QueueMessage.KIND_FIELD), jobId);
        return jobId;
    }
}
