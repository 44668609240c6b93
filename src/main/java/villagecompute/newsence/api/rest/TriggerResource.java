package villagecompute.newsence.api.rest;

import java.util.List;
import java.util.UUID;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.newsence.api.filters.InternalTokenRequired;
import villagecompute.newsence.api.types.ApiErrorType;
import villagecompute.newsence.api.types.TriggerRequestType;
import villagecompute.newsence.api.types.TriggerResponseType;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.jobs.RetryIncompleteJobHandler;
import villagecompute.newsence.queue.BatchProcessMessage;
import villagecompute.newsence.queue.ItemQueue;

/**
 * Manual processing trigger for operators.
 */
@Path("/api/trigger")
@Tag(
        name = "Operations",
        description = "Manual processing triggers")
@InternalTokenRequired
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TriggerResource {

    private static final Logger LOG = Logger.getLogger(TriggerResource.class);

    static final String DEFAULT_TRIGGERED_BY = "manual";

    @Inject
    ItemQueue itemQueue;

    @Inject
    RetryIncompleteJobHandler retryIncomplete;

    @POST
    @Operation(
            summary = "Trigger processing",
            description = "Queues the listed items as one batch, or runs the incomplete-item sweep when none are listed")
    public Response trigger(@Valid TriggerRequestType request) {
        List<UUID> itemIds = request == null || request.itemIds() == null ? List.of() : request.itemIds();
        String triggeredBy = request == null || request.triggeredBy() == null ? DEFAULT_TRIGGERED_BY
                : request.triggeredBy();

        try {
            if (itemIds.isEmpty()) {
                int queued = retryIncomplete.requeueIncomplete();
                LOG.infof("Manual trigger from %s ran the incomplete-item sweep: %d items", triggeredBy, queued);
                return Response.accepted(new TriggerResponseType("started", queued, "recent_incomplete")).build();
            }

            itemQueue.send(new BatchProcessMessage(itemIds, triggeredBy));
            LOG.infof("Manual trigger from %s queued %d items", triggeredBy, itemIds.size());
            return Response.accepted(new TriggerResponseType("started", itemIds.size(), "specific_items")).build();
        } catch (DatastoreException e) {
            LOG.errorf(e, "Manual trigger could not queue items: %s", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ApiErrorType.of(ApiErrorType.DATASTORE_ERROR, "Failed to queue items")).build();
        } catch (Exception e) {
            LOG.errorf(e, "Manual trigger failed: %s", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ApiErrorType.of(ApiErrorType.INTERNAL_ERROR, "Failed to queue items")).build();
        }
    }
}
