package villagecompute.newsence;

import java.time.Instant;
import java.util.HashMap;
import java.util.UUID;

import villagecompute.newsence.data.models.ContentItem;

/**
 * Builders for entities used across unit tests. Entities are plain objects here; nothing is persisted.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static ContentItem item(UUID id, String url, String sourceType) {
        ContentItem item = new ContentItem();
        item.id = id;
        item.url = url;
        item.sourceType = sourceType;
        item.source = "Example Source";
        item.title = TestConstants.ARTICLE_TITLE;
        item.publishedAt = TestConstants.NOW.minusSeconds(3600);
        item.ingestedAt = TestConstants.NOW.minusSeconds(600);
        item.platformMetadata = new HashMap<>();
        return item;
    }

    public static ContentItem article(UUID id) {
        ContentItem item = item(id, TestConstants.ARTICLE_URL + "/" + id, "rss");
        item.content = TestConstants.ARTICLE_CONTENT;
        return item;
    }

    public static ContentItem embedded(UUID id, float[] embedding, Instant publishedAt) {
        ContentItem item = article(id);
        item.embedding = embedding;
        item.publishedAt = publishedAt;
        return item;
    }

    /**
     * Unit vector in two dimensions whose cosine similarity with {@link #axis()} is {@code similarity}.
     */
    public static float[] unitVector(double similarity) {
        return new float[] { (float) similarity, (float) Math.sqrt(1 - similarity * similarity) };
    }

    public static float[] axis() {
        return new float[] { 1f, 0f };
    }
}
