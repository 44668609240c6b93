package villagecompute.newsence.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import io.vertx.core.http.HttpServerRequest;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.newsence.api.filters.InternalTokenRequired;
import villagecompute.newsence.api.types.ApiErrorType;
import villagecompute.newsence.api.types.SubmitRequestType;
import villagecompute.newsence.api.types.SubmitResponseType;
import villagecompute.newsence.api.types.SubmitResultType;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.exceptions.RateLimitException;
import villagecompute.newsence.exceptions.ValidationException;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.services.SubmissionResult;
import villagecompute.newsence.services.SubmissionService;

/**
 * Manual URL submission.
 *
 * <p>
 * Returns as soon as each URL is stored and queued; enrichment runs in the background.
 *
 * <p>
 * Error codes:
 * <ul>
 * <li>400 Bad Request – missing URLs ({@code INVALID_REQUEST}) or more than the batch cap ({@code BATCH_TOO_LARGE})</li>
 * <li>401 Unauthorized – internal token missing or wrong ({@code UNAUTHORIZED})</li>
 * <li>429 Too Many Requests – admission denied, with {@code Retry-After} ({@code RATE_LIMITED})</li>
 * <li>500 Internal Server Error – storage failure ({@code DATASTORE_ERROR}) or unexpected failure ({@code INTERNAL_ERROR})</li>
 * </ul>
 */
@Path("/api/submit")
@Tag(
        name = "Submission",
        description = "Manual URL submission")
@InternalTokenRequired
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SubmitResource {

    private static final Logger LOG = Logger.getLogger(SubmitResource.class);

    @Inject
    SubmissionService submissionService;

    @POST
    @Operation(
            summary = "Submit URLs",
            description = "Stores and queues up to the configured number of URLs per request")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Per-URL results"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid request or batch too large"),
                    @APIResponse(
                            responseCode = "401",
                            description = "Missing or invalid internal token"),
                    @APIResponse(
                            responseCode = "429",
                            description = "Rate limited")})
    public Response submit(@Valid SubmitRequestType request, @Context HttpHeaders headers,
            @Context HttpServerRequest httpRequest) {
        if (request == null) {
            return badRequest(ApiErrorType.INVALID_REQUEST, "Request body required");
        }
        List<String> urls = request.effectiveUrls();
        if (urls.isEmpty()) {
            return badRequest(ApiErrorType.INVALID_REQUEST, "Missing url or urls field");
        }
        int maxBatchSize = submissionService.maxBatchSize();
        if (urls.size() > maxBatchSize) {
            return badRequest(ApiErrorType.BATCH_TOO_LARGE,
                    String.format("Maximum %d URLs per request, got %d", maxBatchSize, urls.size()));
        }

        try {
            LoggingConfig.setRequestOrigin("/api/submit");
            List<SubmissionResult> results = submissionService.submit(urls, request.userId(),
                    resolveClientIp(headers, httpRequest));
            return Response.ok(new SubmitResponseType(true, results.stream().map(SubmitResultType::from).toList()))
                    .build();

        } catch (ValidationException e) {
            LOG.warnf("Submission rejected: %s", e.getMessage());
            return badRequest(ApiErrorType.INVALID_REQUEST, e.getMessage());

        } catch (RateLimitException e) {
            return Response.status(429).header("Retry-After", e.getRetryAfterSeconds())
                    .entity(ApiErrorType.of(ApiErrorType.RATE_LIMITED, e.getMessage())).build();

        } catch (DatastoreException e) {
            LOG.errorf(e, "Datastore failure during submission: %s", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ApiErrorType.of(ApiErrorType.DATASTORE_ERROR, "Failed to store submission")).build();

        } catch (Exception e) {
            LOG.errorf(e, "Failed to process submission: %s", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ApiErrorType.of(ApiErrorType.INTERNAL_ERROR, "Failed to process submission")).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private static Response badRequest(String code, String message) {
        return Response.status(Response.Status.BAD_REQUEST).entity(ApiErrorType.of(code, message)).build();
    }

    static String resolveClientIp(HttpHeaders headers, HttpServerRequest request) {
        if (headers != null) {
            String forwarded = headers.getHeaderString("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        if (request != null && request.remoteAddress() != null) {
            return request.remoteAddress().host();
        }
        return null;
    }
}
