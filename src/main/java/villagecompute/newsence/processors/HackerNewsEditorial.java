package villagecompute.newsence.processors;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.exceptions.MalformedResponseException;
import villagecompute.newsence.integration.hackernews.HnComment;
import villagecompute.newsence.integration.hackernews.HnItem;
import villagecompute.newsence.services.AiCompletionService;
import villagecompute.newsence.services.CompletionOptions;
import villagecompute.newsence.services.ContentAnalysisService;
import villagecompute.newsence.util.AiResponseParser;
import villagecompute.newsence.util.HtmlText;

/**
 * Builds the localized editorial note for a Hacker News thread: a headline, background, discussion focuses with
 * numbered source references and a glossary.
 *
 * <p>
 * A note is only attempted for threads with some substance (at least {@value #MIN_COMMENTS} comments or a linked page
 * of at least {@value #MIN_PAGE_CONTENT} characters). The model answer must carry {@code title_line},
 * {@code background} and a non-empty {@code focuses} array, otherwise no note is produced.
 */
@ApplicationScoped
public class HackerNewsEditorial {

    private static final Logger LOG = Logger.getLogger(HackerNewsEditorial.class);

    static final int MIN_COMMENTS = 4;
    static final int MIN_PAGE_CONTENT = 600;
    static final int MAX_SOURCE_COMMENTS = 6;
    static final int MIN_SOURCE_COMMENT_LENGTH = 40;
    static final int MAX_PROMPT_COMMENTS = 24;
    static final int MAX_STORY_TEXT = 1200;
    static final int MAX_PAGE_EXCERPT = 6000;

    private static final CompletionOptions OPTIONS = CompletionOptions.of(1800, 0.3).withSystemPrompt(
            "You structure Hacker News threads into concise editorial notes. Use only provided material. "
                    + "Output strict JSON.");

    @Inject
    AiCompletionService completionService;

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    ObjectMapper objectMapper;

    static boolean worthStructuring(List<HnComment> comments, String pageContent) {
        return comments.size() >= MIN_COMMENTS || (pageContent != null && pageContent.length() >= MIN_PAGE_CONTENT);
    }

    /**
     * Citable sources in display order: linked article, the thread, then up to six substantive comments.
     */
    static List<HnSource> sources(HnItem story, List<HnComment> comments, String pageTitle) {
        String hnUrl = story.discussionUrl();
        List<HnSource> sources = new ArrayList<>();
        if (story.url() != null && !story.url().isBlank()) {
            String label = pageTitle != null && !pageTitle.isBlank() ? pageTitle.trim()
                    : story.title() != null ? story.title() : story.url();
            sources.add(new HnSource("article", label, story.url()));
        }
        sources.add(new HnSource("hn", "Hacker News discussion", hnUrl));

        int index = 0;
        for (HnComment comment : comments) {
            if (index >= MAX_SOURCE_COMMENTS) {
                break;
            }
            if (comment.text().length() < MIN_SOURCE_COMMENT_LENGTH) {
                continue;
            }
            index++;
            String label = "HN comment " + index + (comment.author() != null ? " by " + comment.author() : "");
            sources.add(new HnSource("c" + index, label, hnUrl + "#" + comment.id()));
        }
        return sources;
    }

    /**
     * Generates the note.
     *
     * @return rendered note, or null when the thread is too thin, the model is unavailable or its answer is malformed
     */
    public String build(String title, HnItem story, List<HnComment> comments, List<HnSource> sources,
            String pageContent) {
        if (!worthStructuring(comments, pageContent)) {
            return null;
        }

        String response = completionService.complete(buildPrompt(title, story, comments, sources, pageContent),
                OPTIONS);
        if (response == null || response.isBlank()) {
            return null;
        }
        try {
            JsonNode json = AiResponseParser.extractObject(objectMapper, response);
            if (AiResponseParser.text(json, "title_line") == null || AiResponseParser.text(json, "background") == null
                    || !json.path("focuses").isArray() || json.path("focuses").isEmpty()) {
                throw new MalformedResponseException("Editorial note failed shape check");
            }
            return render(json, sources);
        } catch (MalformedResponseException e) {
            LOG.warnf("Discarding editorial note for HN item %d: %s", story.id(), e.getMessage());
            return null;
        }
    }

    /**
     * Renders a validated note as plain text. Focus source ids that are not in {@code sources} are dropped.
     */
    static String render(JsonNode note, List<HnSource> sources) {
        Map<String, Integer> sourceIndex = new HashMap<>();
        for (int i = 0; i < sources.size(); i++) {
            sourceIndex.put(sources.get(i).id(), i + 1);
        }

        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add(AiResponseParser.text(note, "title_line"));
        String hook = AiResponseParser.text(note, "hook");
        lines.add(hook == null ? "" : hook);
        lines.add("");
        lines.add("## Background");
        lines.add(AiResponseParser.text(note, "background"));
        lines.add("");
        lines.add("## Discussion");

        for (JsonNode focus : note.path("focuses")) {
            String focusTitle = AiResponseParser.text(focus, "title");
            String detail = AiResponseParser.text(focus, "detail");
            if (focusTitle == null || detail == null) {
                continue;
            }
            lines.add(focusTitle);
            lines.add(detail);
            List<String> refs = new ArrayList<>();
            for (JsonNode sourceId : focus.path("sources")) {
                Integer number = sourceIndex.get(sourceId.asText());
                if (number != null) {
                    refs.add("[" + number + "]");
                }
            }
            if (!refs.isEmpty()) {
                lines.add(String.join(" ", refs));
            }
            lines.add("");
        }

        JsonNode terms = note.path("terms");
        if (terms.isArray() && !terms.isEmpty()) {
            lines.add("## Terms");
            for (JsonNode term : terms) {
                String name = AiResponseParser.text(term, "term");
                String definition = AiResponseParser.text(term, "definition");
                if (name != null && definition != null) {
                    lines.add(name + ": " + definition);
                }
            }
            lines.add("");
        }

        lines.add("## Sources");
        for (int i = 0; i < sources.size(); i++) {
            HnSource source = sources.get(i);
            lines.add("[" + (i + 1) + "] " + source.label() + " (" + source.url() + ")");
        }
        return String.join("\n", lines).trim();
    }

    private String buildPrompt(String title, HnItem story, List<HnComment> comments, List<HnSource> sources,
            String pageContent) {
        StringBuilder catalog = new StringBuilder();
        for (HnSource source : sources) {
            catalog.append("- ").append(source.id()).append(": ").append(source.label()).append(" (")
                    .append(source.url()).append(")\n");
        }

        StringBuilder commentInput = new StringBuilder();
        for (int i = 0; i < Math.min(comments.size(), MAX_PROMPT_COMMENTS); i++) {
            commentInput.append('c').append(i + 1).append(": ").append(comments.get(i).attributed()).append('\n');
        }

        String storyText = story.text() == null ? "" : HtmlText.truncate(HtmlText.clean(story.text()), MAX_STORY_TEXT);
        String excerpt = pageContent == null ? "" : HtmlText.truncate(pageContent, MAX_PAGE_EXCERPT);

        return String.format("""
                Turn the material below into an editorial note written in %1$s. Return JSON only, no other text.

                Title: %2$s
                HN post text: %3$s
                Linked article excerpt:
                %4$s

                Comment sample:
                %5$s

                Available source ids:
                %6$s

                Output format:
                {
                  "title_line": "one-line headline or warning",
                  "hook": "one short subtitle",
                  "background": "2-4 sentences of background",
                  "focuses": [
                    {"title": "focus title", "detail": "3-6 sentence synthesis", "sources": ["article", "hn", "c1"]}
                  ],
                  "terms": [
                    {"term": "term", "definition": "1-2 sentence explanation"}
                  ]
                }

                Constraints:
                - 3 to 6 focuses, 3 to 8 terms
                - sources may only use the available source ids
                - summarize, do not copy the original text
                """, analysisService.targetLanguage(), title, storyText.isBlank() ? "none" : storyText,
                excerpt.isBlank() ? "none" : excerpt, commentInput.length() == 0 ? "none" : commentInput,
                catalog);
    }
}
