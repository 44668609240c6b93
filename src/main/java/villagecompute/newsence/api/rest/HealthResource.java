package villagecompute.newsence.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Check if the application is running")
    public HealthResponse health() {
        return new HealthResponse("UP", "newsence-core");
    }

    public record HealthResponse(String status, String worker) {
    }
}
