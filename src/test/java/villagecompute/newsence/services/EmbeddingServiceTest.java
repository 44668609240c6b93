package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import villagecompute.newsence.TestConstants;
import villagecompute.newsence.TestFixtures;
import villagecompute.newsence.config.AiConfig;
import villagecompute.newsence.data.models.ContentItem;

class EmbeddingServiceTest {

    @Mock
    EmbeddingModel embeddingModel;

    @Mock
    AiConfig aiConfig;

    @InjectMocks
    EmbeddingService service;

    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(aiConfig.isEmbeddingConfigured()).thenReturn(true);
        when(aiConfig.getEmbeddingDimensions()).thenReturn(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    void testPrepareText_JoinsPresentFieldsInOrder() {
        ContentItem item = TestFixtures.item(TestConstants.ITEM_ID, TestConstants.ARTICLE_URL, "rss");
        item.title = "Title";
        item.titleLocalized = "標題";
        item.summary = " ";
        item.summaryLocalized = "摘要";
        item.tags = List.of("Science", "Networks");
        item.keywords = List.of("fiber");

        assertEquals("Title 標題 摘要 Science Networks fiber", EmbeddingService.prepareText(item));
    }

    @Test
    void testPrepareText_CapsLength() {
        ContentItem item = TestFixtures.item(TestConstants.ITEM_ID, TestConstants.ARTICLE_URL, "rss");
        item.title = "x".repeat(EmbeddingService.MAX_TEXT_LENGTH + 500);

        assertEquals(EmbeddingService.MAX_TEXT_LENGTH, EmbeddingService.prepareText(item).length());
    }

    @Test
    void testEmbed_NormalizesVector() {
        when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] { 3f, 4f })));

        float[] vector = service.embed("some text");

        assertArrayEquals(new float[] { 0.6f, 0.8f }, vector, 1e-6f);
    }

    @Test
    void testEmbed_WrongDimensions_ReturnsNull() {
        when(embeddingModel.embed(anyString()))
                .thenReturn(Response.from(Embedding.from(new float[] { 1f, 0f, 0f })));

        assertNull(service.embed("some text"));
    }

    @Test
    void testEmbed_ZeroVector_ReturnsNull() {
        when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] { 0f, 0f })));

        assertNull(service.embed("text"));
    }

    @Test
    void testEmbed_ModelFailure_ReturnsNull() {
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("timeout"));

        assertNull(service.embed("some text"));
    }

    @Test
    void testEmbed_NotConfigured_SkipsModel() {
        when(aiConfig.isEmbeddingConfigured()).thenReturn(false);

        assertNull(service.embed("some text"));
        verify(embeddingModel, never()).embed(anyString());
    }

    @Test
    void testEmbed_BlankText_ReturnsNull() {
        assertNull(service.embed("   "));
    }
}
