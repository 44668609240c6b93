/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.newsence.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * LangChain4j model configuration.
 *
 * <p>
 * Produces the {@link ChatModel} behind {@link villagecompute.newsence.services.AiCompletionService} and the
 * {@link EmbeddingModel} behind {@link villagecompute.newsence.services.EmbeddingService}. Both beans are
 * {@code @ApplicationScoped} and therefore built lazily on first use.
 *
 * <p>
 * Unlike a hard dependency, missing credentials do not stop the application: enrichment falls back to deterministic
 * values, embeddings are skipped and topic synthesis is disabled. Startup logs which capabilities are off.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code newsence.ai.api-key} - Anthropic API key (from ANTHROPIC_API_KEY)</li>
 * <li>{@code newsence.ai.model.name} - completion model (default: claude-3-5-haiku-20241022)</li>
 * <li>{@code newsence.ai.model.timeout-seconds} / {@code newsence.ai.model.max-retries}</li>
 * <li>{@code newsence.embedding.api-key} - embedding provider key (from EMBEDDING_API_KEY)</li>
 * <li>{@code newsence.embedding.model.name} / {@code newsence.embedding.dimensions} (default 1024)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "newsence.ai.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "newsence.ai.model.name",
            defaultValue = "claude-3-5-haiku-20241022")
    String modelName;

    @ConfigProperty(
            name = "newsence.ai.model.timeout-seconds",
            defaultValue = "120")
    int timeoutSeconds;

    @ConfigProperty(
            name = "newsence.ai.model.max-retries",
            defaultValue = "1")
    int maxRetries;

    @ConfigProperty(
            name = "newsence.embedding.api-key")
    Optional<String> embeddingApiKey;

    @ConfigProperty(
            name = "newsence.embedding.model.name",
            defaultValue = "text-embedding-3-small")
    String embeddingModelName;

    @ConfigProperty(
            name = "newsence.embedding.dimensions",
            defaultValue = "1024")
    int embeddingDimensions;

    @PostConstruct
    public void logConfiguration() {
        if (!isCompletionConfigured()) {
            LOG.warn("newsence.ai.api-key is not set: AI analysis falls back to defaults, topic synthesis is off");
        }
        if (!isEmbeddingConfigured()) {
            LOG.warn("newsence.embedding.api-key is not set: embeddings and topic clustering are off");
        }
        LOG.infof("LangChain4j configured with completion model %s and embedding model %s (%d dims)", modelName,
                embeddingModelName, embeddingDimensions);
    }

    public boolean isCompletionConfigured() {
        return apiKey.filter(key -> !key.isBlank()).isPresent();
    }

    public boolean isEmbeddingConfigured() {
        return embeddingApiKey.filter(key -> !key.isBlank()).isPresent();
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    /**
     * Produces the completion model. Temperature and output limits are set per request.
     *
     * @return configured ChatModel
     * @throws AiConfigurationException
     *             if no API key is configured
     */
    @Produces
    @ApplicationScoped
    public ChatModel createChatModel() {
        String key = apiKey.filter(k -> !k.isBlank())
                .orElseThrow(() -> new AiConfigurationException("newsence.ai.api-key is not configured"));
        LOG.infof("Creating ChatModel: model=%s, timeout=%ds, maxRetries=%d", modelName, timeoutSeconds, maxRetries);

        return AnthropicChatModel.builder().apiKey(key).modelName(modelName).maxTokens(4096)
                .timeout(Duration.ofSeconds(timeoutSeconds)).maxRetries(maxRetries).logRequests(false)
                .logResponses(false).build();
    }

    /**
     * Produces the embedding model, requesting {@code newsence.embedding.dimensions} dimensional vectors.
     *
     * @return configured EmbeddingModel
     * @throws AiConfigurationException
     *             if no API key is configured
     */
    @Produces
    @ApplicationScoped
    public EmbeddingModel createEmbeddingModel() {
        String key = embeddingApiKey.filter(k -> !k.isBlank())
                .orElseThrow(() -> new AiConfigurationException("newsence.embedding.api-key is not configured"));
        LOG.infof("Creating EmbeddingModel: model=%s, dimensions=%d", embeddingModelName, embeddingDimensions);

        return OpenAiEmbeddingModel.builder().apiKey(key).modelName(embeddingModelName)
                .dimensions(embeddingDimensions).timeout(Duration.ofSeconds(30)).maxRetries(maxRetries).build();
    }

    /**
     * Exception thrown when a model is requested without its credentials.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }
    }
}
