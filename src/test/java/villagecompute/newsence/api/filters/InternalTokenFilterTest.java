package villagecompute.newsence.api.filters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import villagecompute.newsence.TestConstants;

class InternalTokenFilterTest {

    private InternalTokenFilter filter;
    private ContainerRequestContext request;

    @BeforeEach
    void setUp() {
        filter = new InternalTokenFilter();
        filter.internalToken = Optional.of(TestConstants.INTERNAL_TOKEN);
        request = mock(ContainerRequestContext.class);
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/submit");
        when(request.getUriInfo()).thenReturn(uriInfo);
    }

    @Test
    void testProvidedToken_PrefersDedicatedHeader() {
        assertEquals("a", InternalTokenFilter.providedToken(" a ", "Bearer b"));
    }

    @Test
    void testProvidedToken_AcceptsBearerCaseInsensitively() {
        assertEquals("b", InternalTokenFilter.providedToken(null, "bearer b"));
        assertNull(InternalTokenFilter.providedToken(null, "Basic dXNlcjpwYXNz"));
        assertNull(InternalTokenFilter.providedToken("", "Bearer "));
    }

    @Test
    void testTokensMatch() {
        assertTrue(InternalTokenFilter.tokensMatch("secret", "secret"));
        assertFalse(InternalTokenFilter.tokensMatch("secret", "secreT"));
        assertFalse(InternalTokenFilter.tokensMatch("secret-longer", "secret"));
    }

    @Test
    void testFilter_ValidToken_PassesThrough() {
        when(request.getHeaderString(InternalTokenFilter.TOKEN_HEADER)).thenReturn(TestConstants.INTERNAL_TOKEN);

        filter.filter(request);

        verify(request, never()).abortWith(any());
    }

    @Test
    void testFilter_BearerToken_PassesThrough() {
        when(request.getHeaderString(HttpHeaders.AUTHORIZATION)).thenReturn("Bearer " + TestConstants.INTERNAL_TOKEN);

        filter.filter(request);

        verify(request, never()).abortWith(any());
    }

    @Test
    void testFilter_WrongToken_Aborts401() {
        when(request.getHeaderString(InternalTokenFilter.TOKEN_HEADER)).thenReturn("wrong");

        filter.filter(request);

        ArgumentCaptor<Response> response = ArgumentCaptor.forClass(Response.class);
        verify(request).abortWith(response.capture());
        assertEquals(401, response.getValue().getStatus());
    }

    @Test
    void testFilter_MissingToken_Aborts401() {
        filter.filter(request);

        verify(request).abortWith(any(Response.class));
    }

    @Test
    void testFilter_NoTokenConfigured_OpenAccess() {
        filter.internalToken = Optional.empty();

        filter.filter(request);

        verify(request, never()).abortWith(any());
    }
}
