package villagecompute.newsence.services;

import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.config.AiConfig;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.util.VectorMath;

/**
 * Generates L2-normalized item embeddings through the LangChain4j {@link EmbeddingModel}.
 *
 * <p>
 * Embedding is fail-soft: blank input, a missing API key, a provider error, a vector of the wrong size or a zero vector
 * all return {@code null}, and the workflow then skips saving the embedding and topic assignment for that item.
 */
@ApplicationScoped
public class EmbeddingService {

    private static final Logger LOG = Logger.getLogger(EmbeddingService.class);

    static final int MAX_TEXT_LENGTH = 8000;

    @Inject
    EmbeddingModel embeddingModel;

    @Inject
    AiConfig aiConfig;

    /**
     * Concatenates title, localized title, summaries, tags and keywords, capped at {@value #MAX_TEXT_LENGTH} chars.
     */
    public static String prepareText(ContentItem item) {
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, item.title);
        addIfPresent(parts, item.titleLocalized);
        addIfPresent(parts, item.summary);
        addIfPresent(parts, item.summaryLocalized);
        if (item.tags != null && !item.tags.isEmpty()) {
            parts.add(String.join(" ", item.tags));
        }
        if (item.keywords != null && !item.keywords.isEmpty()) {
            parts.add(String.join(" ", item.keywords));
        }
        String text = String.join(" ", parts);
        return text.length() <= MAX_TEXT_LENGTH ? text : text.substring(0, MAX_TEXT_LENGTH);
    }

    /**
     * @return unit-length vector of {@code newsence.embedding.dimensions} floats, or null
     */
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (!aiConfig.isEmbeddingConfigured()) {
            LOG.debug("Embedding requested without an API key, skipping");
            return null;
        }

        String input = text.trim();
        if (input.length() > MAX_TEXT_LENGTH) {
            input = input.substring(0, MAX_TEXT_LENGTH);
        }
        try {
            Response<Embedding> response = embeddingModel.embed(input);
            float[] vector = response.content().vector();
            if (vector.length != aiConfig.getEmbeddingDimensions()) {
                LOG.warnf("Unexpected embedding dimensions: expected=%d, actual=%d",
                        aiConfig.getEmbeddingDimensions(), vector.length);
                return null;
            }
            if (VectorMath.isZero(vector)) {
                LOG.warn("Embedding provider returned a zero vector, discarding it");
                return null;
            }
            return VectorMath.l2Normalize(vector);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to generate embedding for text: %s", input.substring(0, Math.min(100, input.length())));
            return null;
        }
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value);
        }
    }
}
