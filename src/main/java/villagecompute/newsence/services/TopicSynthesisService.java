package villagecompute.newsence.services;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.stores.ItemStore;
import villagecompute.newsence.data.stores.TopicStore;
import villagecompute.newsence.exceptions.MalformedResponseException;
import villagecompute.newsence.util.AiResponseParser;

/**
 * Writes an AI headline and description for a topic from its most recent members.
 *
 * <p>
 * The answer must contain all four display fields. A failed call or a malformed answer leaves the topic untouched;
 * nothing is ever partially applied.
 */
@ApplicationScoped
public class TopicSynthesisService {

    private static final Logger LOG = Logger.getLogger(TopicSynthesisService.class);

    static final int MAX_MEMBERS = 20;
    static final int MAX_SUMMARY_CHARS = 200;
    static final int MAX_TAGS = 5;

    private static final CompletionOptions OPTIONS = CompletionOptions.of(500, 0.3);

    @Inject
    ItemStore itemStore;

    @Inject
    TopicStore topicStore;

    @Inject
    AiCompletionService completionService;

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    ObjectMapper objectMapper;

    Clock clock = Clock.systemUTC();

    public boolean isAvailable() {
        return completionService.isConfigured();
    }

    /**
     * @return true when the topic display fields were replaced
     */
    public boolean synthesize(UUID topicId) {
        List<ContentItem> members = itemStore.findByTopic(topicId, MAX_MEMBERS);
        if (members.isEmpty()) {
            LOG.warnf("Topic %s has no members to synthesize from", topicId);
            return false;
        }

        String response = completionService.complete(buildPrompt(members), OPTIONS);
        if (response == null || response.isBlank()) {
            LOG.warnf("Synthesis for topic %s returned nothing", topicId);
            return false;
        }

        String title;
        String titleLocalized;
        String description;
        String descriptionLocalized;
        try {
            JsonNode json = AiResponseParser.extractObject(objectMapper, response);
            title = AiResponseParser.text(json, "title");
            titleLocalized = AiResponseParser.text(json, "title_localized");
            description = AiResponseParser.text(json, "description");
            descriptionLocalized = AiResponseParser.text(json, "description_localized");
            if (title == null || titleLocalized == null || description == null || descriptionLocalized == null) {
                throw new MalformedResponseException("Synthesis response is missing display fields");
            }
        } catch (MalformedResponseException e) {
            LOG.warnf("Invalid synthesis response for topic %s: %s", topicId, e.getMessage());
            return false;
        }

        topicStore.updateDisplay(topicId, title, titleLocalized, description, descriptionLocalized, clock.instant());
        LOG.infof("Synthesized topic %s: \"%s\" (%d members)", topicId, title, members.size());
        return true;
    }

    String buildPrompt(List<ContentItem> members) {
        StringBuilder list = new StringBuilder();
        for (int i = 0; i < members.size(); i++) {
            ContentItem member = members.get(i);
            if (i > 0) {
                list.append("\n\n");
            }
            list.append(i + 1).append(". Title: ")
                    .append(member.titleLocalized != null ? member.titleLocalized : member.title);
            String summary = member.summaryLocalized != null ? member.summaryLocalized : member.summary;
            if (summary != null) {
                list.append("\n   Summary: ").append(ContentAnalysisService.truncate(summary, MAX_SUMMARY_CHARS));
            }
            if (member.tags != null && !member.tags.isEmpty()) {
                list.append("\n   Tags: ")
                        .append(String.join(", ", member.tags.subList(0, Math.min(MAX_TAGS, member.tags.size()))));
            }
            list.append("\n   Source: ").append(member.source);
        }

        return String.format("""
                You are a news editor. The articles below cover the same event or theme. Write one headline and a
                short description for the topic as a whole.

                ARTICLES:
                %1$s

                RULES:
                - Do not copy any single article title; summarize the common theme.
                - Headline: 2-8 words in English, a short natural headline in %2$s.
                - Description: 1-2 sentences about the whole event, neutral news tone.

                Respond with ONLY valid JSON:
                {
                  "title": "English topic title",
                  "title_localized": "topic title in %2$s",
                  "description": "English description in 1-2 sentences",
                  "description_localized": "description in %2$s"
                }
                """, list, analysisService.targetLanguage());
    }
}
