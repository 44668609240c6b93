package villagecompute.newsence.services;

import java.util.Arrays;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.exceptions.MalformedResponseException;
import villagecompute.newsence.integration.hackernews.HnComment;
import villagecompute.newsence.util.AiResponseParser;

/**
 * AI analysis, translation and summarization of items.
 *
 * <p>
 * Every method degrades deterministically: {@link #analyze(AnalysisInput)} and {@link #translateTweet(String)} fall
 * back to values derived from their input when the model is unavailable or answers with malformed JSON, and the free
 * text methods return null. A formatting slip of the model never fails the pipeline.
 *
 * <p>
 * The localized fields are written in {@code newsence.ai.target-language}.
 */
@ApplicationScoped
public class ContentAnalysisService {

    private static final Logger LOG = Logger.getLogger(ContentAnalysisService.class);

    static final int MAX_CONTENT_LENGTH = 2000;
    static final int MAX_TAGS = 5;
    static final int MAX_KEYWORDS = 8;
    static final int FALLBACK_KEYWORDS = 5;
    static final int MAX_DISCUSSION_CHARS = 25000;

    private static final CompletionOptions ANALYSIS_OPTIONS = CompletionOptions.of(800, 0.3);
    private static final CompletionOptions TWEET_OPTIONS = CompletionOptions.of(1000, 0.3);
    private static final CompletionOptions TRANSLATION_OPTIONS = CompletionOptions.of(8000, 0.3);
    private static final CompletionOptions DISCUSSION_OPTIONS = CompletionOptions.of(400, 0.3)
            .withSystemPrompt("You summarize Hacker News discussions. Extract key insights, main arguments, and "
                    + "interesting perspectives. Be concise (150-200 words). Use bullet points. Write in English.");

    @Inject
    AiCompletionService completionService;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "newsence.ai.target-language",
            defaultValue = "Traditional Chinese")
    String targetLanguage;

    /**
     * Tags, keywords, bilingual title and summary, and a category for an item.
     *
     * <p>
     * An answer is accepted only when {@code tags} and {@code keywords} are arrays and both summaries are present;
     * anything else yields {@link #fallback(AnalysisInput)}.
     */
    public AnalysisResult analyze(AnalysisInput input) {
        LOG.debugf("Analyzing \"%s\"", truncate(input.title(), 80));
        String response = completionService.complete(buildAnalysisPrompt(input), ANALYSIS_OPTIONS);
        if (response == null || response.isBlank()) {
            return fallback(input);
        }

        try {
            JsonNode json = AiResponseParser.extractObject(objectMapper, response);
            String summaryEn = AiResponseParser.text(json, "summary_en");
            String summaryLocalized = AiResponseParser.text(json, "summary_localized");
            if (!json.path("tags").isArray() || !json.path("keywords").isArray() || summaryEn == null
                    || summaryLocalized == null) {
                throw new MalformedResponseException("Analysis response failed shape check");
            }
            String category = AiResponseParser.text(json, "category");
            return new AnalysisResult(AiResponseParser.strings(json, "tags", MAX_TAGS),
                    AiResponseParser.strings(json, "keywords", MAX_KEYWORDS), AiResponseParser.text(json, "title_en"),
                    AiResponseParser.text(json, "title_localized"), summaryEn, summaryLocalized,
                    category == null ? AnalysisResult.DEFAULT_CATEGORY : category, false);
        } catch (MalformedResponseException e) {
            LOG.warnf("Analysis parse failed for \"%s\": %s", truncate(input.title(), 80), e.getMessage());
            return fallback(input);
        }
    }

    /**
     * Deterministic analysis derived from the item itself.
     */
    public static AnalysisResult fallback(AnalysisInput input) {
        String title = input.title() == null ? "" : input.title();
        String shortTitle = truncate(title, 100) + "...";
        List<String> keywords = Arrays.stream(title.split(" ")).filter(word -> !word.isBlank())
                .limit(FALLBACK_KEYWORDS).toList();
        String summaryEn = input.summary() != null ? input.summary() : shortTitle;
        String summaryLocalized = input.summaryLocalized() != null ? input.summaryLocalized()
                : input.summary() != null ? input.summary() : shortTitle;
        return new AnalysisResult(List.of(AnalysisResult.DEFAULT_CATEGORY), keywords, title,
                input.titleLocalized() != null ? input.titleLocalized() : title, summaryEn, summaryLocalized,
                AnalysisResult.DEFAULT_CATEGORY, true);
    }

    /**
     * Direct translation of a short post with tags and keywords. Falls back to the untranslated text with the tag
     * {@code Twitter}.
     */
    public TweetTranslation translateTweet(String text) {
        String response = completionService.complete(buildTweetPrompt(text), TWEET_OPTIONS);
        TweetTranslation fallback = new TweetTranslation(text, List.of("Twitter"), List.of());
        if (response == null || response.isBlank()) {
            return fallback;
        }

        try {
            JsonNode json = AiResponseParser.extractObject(objectMapper, response);
            String translated = AiResponseParser.text(json, "summary_localized");
            List<String> tags = json.path("tags").isArray() ? AiResponseParser.strings(json, "tags", MAX_TAGS)
                    : List.of("Twitter");
            return new TweetTranslation(translated == null ? text : translated, tags,
                    AiResponseParser.strings(json, "keywords", MAX_KEYWORDS));
        } catch (MalformedResponseException e) {
            LOG.warnf("Tweet translation parse failed: %s", e.getMessage());
            return fallback;
        }
    }

    /**
     * Translates long-form content, keeping its Markdown structure.
     *
     * @return translated text, or null when unavailable
     */
    public String translateContent(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String prompt = String.format("""
                Translate the following article into %s. Keep the Markdown structure (headings, paragraphs, lists).
                Only translate; do not add anything.

                %s
                """, targetLanguage, content);
        String translated = completionService.complete(prompt, TRANSLATION_OPTIONS);
        return translated == null || translated.isBlank() ? null : translated.trim();
    }

    /**
     * Bullet-point summary of a Hacker News thread, in English.
     *
     * @return summary, or null when there are no comments or the model is unavailable
     */
    public String summarizeDiscussion(String title, List<HnComment> comments) {
        if (comments.isEmpty()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < comments.size(); i++) {
            if (i > 0) {
                text.append("\n---\n");
            }
            text.append(i + 1).append(". ").append(comments.get(i).attributed());
        }
        String prompt = String.format("Summarize the discussion about: \"%s\"\n\nComments:\n%s", title,
                truncate(text.toString(), MAX_DISCUSSION_CHARS));
        String summary = completionService.complete(prompt, DISCUSSION_OPTIONS);
        return summary == null || summary.isBlank() ? null : summary.trim();
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    private String buildAnalysisPrompt(AnalysisInput input) {
        String content = input.content() != null && !input.content().isBlank() ? input.content()
                : input.summary() != null && !input.summary().isBlank() ? input.summary() : input.title();
        String summary = input.summary() != null ? input.summary()
                : input.summaryLocalized() != null ? input.summaryLocalized() : "(none)";

        return String.format("""
                You are a news analyst and translator. Analyze the article below and return structured metadata in
                English and %1$s.

                ARTICLE:
                Title: %2$s
                Source: %3$s
                Summary: %4$s
                Content: %5$s...

                Respond with ONLY valid JSON in this exact format (no markdown, no explanation):
                {
                  "tags": ["tag1", "tag2", "tag3"],
                  "keywords": ["keyword1", "keyword2", "keyword3", "keyword4", "keyword5"],
                  "title_en": "title in natural English",
                  "title_localized": "title in natural %1$s",
                  "summary_en": "1-2 sentence English summary",
                  "summary_localized": "the summary translated directly into %1$s, same voice and person",
                  "category": "one category"
                }

                RULES:
                - Plain text only in every field, no Markdown.
                - Tags come from: AI, MachineLearning, DeepLearning, NLP, ComputerVision, LLM, GenerativeAI, Coding,
                  VR, AR, Robotics, Automation, SoftwareDevelopment, API, Tech, Finance, Healthcare, Education,
                  Gaming, Enterprise, Creative, Funding, IPO, Acquisition, ProductLaunch, Research, Partnership,
                  Review, Opinion, Analysis, Feature, Interview, Tutorial, Announcement
                - Category is one of: AI, Tech, Finance, Research, Business, Other
                """, targetLanguage, input.title(), input.source() == null ? "" : input.source(), summary,
                truncate(content == null ? "" : content, MAX_CONTENT_LENGTH));
    }

    private String buildTweetPrompt(String text) {
        return String.format("""
                Translate the following post directly into %s and provide tags and keywords.

                RULES:
                - Translate the original directly; keep its first-person voice and tone.
                - Do not describe the post from the outside ("this post says", "the author thinks").
                - Plain text only, no Markdown.

                POST:
                %s

                Respond with ONLY valid JSON in this exact format:
                {
                  "summary_localized": "direct translation",
                  "tags": ["tag1", "tag2", "tag3"],
                  "keywords": ["keyword1", "keyword2", "keyword3"]
                }

                Tags come from: AI, MachineLearning, DeepLearning, LLM, GenerativeAI, Coding, Robotics,
                SoftwareDevelopment, API, Tech, Finance, Healthcare, Gaming, Creative, ProductLaunch, Research,
                Partnership, Announcement
                """, targetLanguage, text);
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
