package villagecompute.newsence.integration.social;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import villagecompute.newsence.exceptions.ExtractionException;

class HttpSocialPostClientTest {

    private static final String FIRST_PAGE = """
            {"status": "success", "has_next_page": true, "next_cursor": "page-2",
             "tweets": [{"id": "1", "url": "https://x.com/a/status/1", "text": "first",
                         "author": {"userName": "a", "name": "A"}, "viewCount": 1200,
                         "hashTags": ["quantum"], "media": [{"url": "https://pbs.example/1.jpg"}],
                         "createdAt": "Sun Jun 01 10:00:00 +0000 2025"}]}
            """;

    private static final String SECOND_PAGE = """
            {"status": "success", "has_next_page": false,
             "tweets": [{"id": "2", "url": "https://x.com/b/status/2", "text": "second",
                         "author": {"userName": "b"}, "createdAt": "2025-06-01T11:00:00Z"}]}
            """;

    private HttpServer server;
    private HttpSocialPostClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/twitter/list/tweets", exchange -> {
            String query = exchange.getRequestURI().getQuery();
            if (!"test-key".equals(exchange.getRequestHeaders().getFirst("X-API-Key"))) {
                respond(exchange, 401, "{}");
            } else if (query.contains("listId=broken")) {
                respond(exchange, 200, "{\"status\": \"error\", \"message\": \"list not found\"}");
            } else {
                respond(exchange, 200, query.contains("cursor=page-2") ? SECOND_PAGE : FIRST_PAGE);
            }
        });
        server.start();

        client = new HttpSocialPostClient();
        client.baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client.apiKey = Optional.of("test-key");
        client.objectMapper = new ObjectMapper();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void testListPosts_FollowsCursorAcrossPages() {
        List<SocialPost> posts = client.listPosts("list-1", Instant.parse("2025-06-01T00:00:00Z"));

        assertEquals(2, posts.size());
        SocialPost first = posts.get(0);
        assertEquals("1", first.id());
        assertEquals("a", first.authorHandle());
        assertEquals(1200, first.viewCount());
        assertEquals(List.of("quantum"), first.hashtags());
        assertEquals(List.of("https://pbs.example/1.jpg"), first.mediaUrls());
        assertEquals(Instant.parse("2025-06-01T10:00:00Z"), first.createdAt());
        assertEquals(Instant.parse("2025-06-01T11:00:00Z"), posts.get(1).createdAt());
    }

    @Test
    void testListPosts_ApiErrorStatus_Throws() {
        assertThrows(ExtractionException.class, () -> client.listPosts("broken", Instant.EPOCH));
    }

    @Test
    void testListPosts_NotConfigured_Throws() {
        client.apiKey = Optional.empty();

        assertThrows(ExtractionException.class, () -> client.listPosts("list-1", Instant.EPOCH));
    }

    @Test
    void testParseDate_UnparseableValue_ReturnsNull() {
        assertNull(HttpSocialPostClient.parseDate("yesterday"));
    }
}
