package villagecompute.newsence.queue;

/**
 * Durable hand-off between producers and the workflow orchestrator.
 */
public interface ItemQueue {

    /**
     * Persists a message for asynchronous processing.
     *
     * @return id of the stored job
     * @throws villagecompute.newsence.exceptions.DatastoreException
     *             when the message could not be stored
     */
    long send(QueueMessage message);
}
