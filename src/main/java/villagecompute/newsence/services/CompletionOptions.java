package villagecompute.newsence.services;

/**
 * Per-request options for {@link AiCompletionService#complete(String, CompletionOptions)}.
 *
 * @param systemPrompt
 *            optional system message, null for none
 * @param maxTokens
 *            output token ceiling
 * @param temperature
 *            sampling temperature
 */
public record CompletionOptions(String systemPrompt, int maxTokens, double temperature) {

    public static CompletionOptions of(int maxTokens, double temperature) {
        return new CompletionOptions(null, maxTokens, temperature);
    }

    public CompletionOptions withSystemPrompt(String prompt) {
        return new CompletionOptions(prompt, maxTokens, temperature);
    }
}
