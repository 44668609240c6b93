package villagecompute.newsence.api.rest;

import java.util.UUID;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.newsence.api.types.ApiErrorType;
import villagecompute.newsence.exceptions.ResourceNotFoundException;
import villagecompute.newsence.workflow.WorkflowStatusService;

/**
 * Status of a workflow instance, keyed by the instance id returned when the workflow was launched.
 */
@Path("/api/workflows")
@Tag(
        name = "Workflows",
        description = "Workflow instance status")
@Produces(MediaType.APPLICATION_JSON)
public class WorkflowStatusResource {

    private static final Logger LOG = Logger.getLogger(WorkflowStatusResource.class);

    @Inject
    WorkflowStatusService statusService;

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Workflow status",
            description = "Returns the instance status; the enriched item is included once the workflow is complete")
    public Response status(@PathParam("id") String id) {
        UUID instanceId;
        try {
            instanceId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ApiErrorType.of(ApiErrorType.INVALID_REQUEST, "Invalid workflow id: " + id)).build();
        }

        try {
            return Response.ok(statusService.status(instanceId)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(ApiErrorType.of(ApiErrorType.NOT_FOUND, e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to load workflow %s", instanceId);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ApiErrorType.of(ApiErrorType.INTERNAL_ERROR, "Failed to load workflow status")).build();
        }
    }
}
