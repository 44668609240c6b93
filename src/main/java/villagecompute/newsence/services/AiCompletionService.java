package villagecompute.newsence.services;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;
import villagecompute.newsence.config.AiConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Text completion client used by every AI-backed step (analysis, translation, discussion summaries, topic synthesis).
 *
 * <p>
 * The contract is {@code complete(prompt, options) -> text or null}: a missing key, an API error, an open circuit or a
 * timeout all come back as {@code null}, and every caller has a deterministic fallback for that case.
 *
 * <p>
 * <b>Fault tolerance:</b> calls share the {@code ai-completion} circuit breaker (opens after 5 consecutive failures,
 * half-opens after 30 seconds) and time out after 180 seconds, matching the longest workflow step timeout.
 */
@ApplicationScoped
public class AiCompletionService {

    private static final Logger LOG = Logger.getLogger(AiCompletionService.class);

    @Inject
    ChatModel chatModel;

    @Inject
    AiConfig aiConfig;

    public boolean isConfigured() {
        return aiConfig.isCompletionConfigured();
    }

    /**
     * Sends a single-turn completion request.
     *
     * @param prompt
     *            user prompt
     * @param options
     *            token limit, temperature and optional system prompt
     * @return completion text, or null when the model is unavailable
     */
    @CircuitBreaker(
            requestVolumeThreshold = 5,
            failureRatio = 1.0,
            delay = 30000,
            successThreshold = 2)
    @CircuitBreakerName("ai-completion")
    @Fallback(
            fallbackMethod = "completeFallback")
    @Timeout(180000)
    public String complete(String prompt, CompletionOptions options) {
        if (!isConfigured()) {
            LOG.debug("AI completion requested without an API key, returning null");
            return null;
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (options.systemPrompt() != null) {
            messages.add(SystemMessage.from(options.systemPrompt()));
        }
        messages.add(UserMessage.from(prompt));

        try {
            ChatRequest request = ChatRequest.builder().messages(messages).temperature(options.temperature())
                    .maxOutputTokens(options.maxTokens()).build();
            ChatResponse response = chatModel.chat(request);
            String text = response.aiMessage().text();
            LOG.debugf("AI completion: promptChars=%d, responseChars=%d", prompt.length(),
                    text == null ? 0 : text.length());
            return text;
        } catch (Exception e) {
            LOG.errorf(e, "AI completion failed: promptChars=%d", prompt.length());
            throw new RuntimeException("AI completion failed", e); // Trigger circuit breaker
        }
    }

    /**
     * Fallback when the circuit breaker is open, the call timed out or the API failed.
     */
    public String completeFallback(String prompt, CompletionOptions options) {
        LOG.warnf("AI completion unavailable, returning null (promptChars=%d)", prompt.length());
        return null;
    }
}
