package villagecompute.newsence.api.filters;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import villagecompute.newsence.api.types.ApiErrorType;

/**
 * Rejects requests to {@link InternalTokenRequired} endpoints that do not carry the configured internal token.
 *
 * <p>
 * Both sides are hashed with SHA-256 and compared with {@link MessageDigest#isEqual(byte[], byte[])}, so the
 * comparison time does not depend on where the tokens differ or on their lengths.
 */
@Provider
@InternalTokenRequired
@Priority(Priorities.AUTHENTICATION)
public class InternalTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(InternalTokenFilter.class);

    static final String TOKEN_HEADER = "X-Internal-Token";

    private static final String BEARER_PREFIX = "Bearer ";

    @ConfigProperty(
            name = "newsence.internal-token")
    Optional<String> internalToken;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String expected = internalToken.map(String::trim).orElse("");
        if (expected.isEmpty()) {
            return;
        }

        String provided = providedToken(requestContext.getHeaderString(TOKEN_HEADER),
                requestContext.getHeaderString(HttpHeaders.AUTHORIZATION));
        if (provided == null || !tokensMatch(provided, expected)) {
            LOG.warnf("Rejected request to %s: missing or invalid internal token",
                    requestContext.getUriInfo().getPath());
            requestContext.abortWith(Response.status(Response.Status.UNAUTHORIZED).type(MediaType.APPLICATION_JSON)
                    .entity(ApiErrorType.of(ApiErrorType.UNAUTHORIZED, "Missing or invalid internal token")).build());
        }
    }

    static String providedToken(String tokenHeader, String authorization) {
        if (tokenHeader != null && !tokenHeader.isBlank()) {
            return tokenHeader.trim();
        }
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    static boolean tokensMatch(String provided, String expected) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] providedHash = sha256.digest(provided.getBytes(StandardCharsets.UTF_8));
            byte[] expectedHash = sha256.digest(expected.getBytes(StandardCharsets.UTF_8));
            return MessageDigest.isEqual(providedHash, expectedHash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
