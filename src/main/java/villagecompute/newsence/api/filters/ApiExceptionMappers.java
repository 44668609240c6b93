package villagecompute.newsence.api.filters;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import jakarta.ws.rs.ForbiddenException;
import jakarta.ws.rs.core.Response;
import villagecompute.newsence.api.types.ApiErrorType;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.ResourceNotFoundException;

/**
 * Structured error bodies for exceptions that escape a resource method.
 */
public class ApiExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMappers.class);

    @ServerExceptionMapper
    public Response mapDatastore(DatastoreException e) {
        LOG.errorf(e, "Datastore failure: %s", e.getMessage());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ApiErrorType.of(ApiErrorType.DATASTORE_ERROR, "Datastore operation failed")).build();
    }

    @ServerExceptionMapper
    public Response mapNotFound(ResourceNotFoundException e) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ApiErrorType.of(ApiErrorType.NOT_FOUND, e.getMessage())).build();
    }

    @ServerExceptionMapper
    public Response mapForbidden(ForbiddenException e) {
        return Response.status(Response.Status.FORBIDDEN)
                .entity(ApiErrorType.of(ApiErrorType.FORBIDDEN, "Access denied")).build();
    }
}
