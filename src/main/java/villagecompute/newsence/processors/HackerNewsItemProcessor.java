package villagecompute.newsence.processors;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.integration.hackernews.HackerNewsClient;
import villagecompute.newsence.integration.hackernews.HnComment;
import villagecompute.newsence.integration.hackernews.HnItem;
import villagecompute.newsence.services.AnalysisInput;
import villagecompute.newsence.services.AnalysisResult;
import villagecompute.newsence.services.ContentAnalysisService;

/**
 * Enrichment of Hacker News stories.
 *
 * <p>
 * Fetches the thread through the Algolia API (item id from the platform metadata), scrapes the linked page,
 * summarizes the discussion and builds a structured localized note. The linked page content replaces the item content.
 * Every external call is optional: a missing item id, an unreachable API or a failing scrape still yields the generic
 * analysis, tagged {@code HackerNews}.
 */
@ApplicationScoped
public class HackerNewsItemProcessor implements ItemProcessor {

    private static final Logger LOG = Logger.getLogger(HackerNewsItemProcessor.class);

    static final String TAG = "HackerNews";

    @Inject
    HackerNewsClient hackerNewsClient;

    @Inject
    ContentExtractor contentExtractor;

    @Inject
    ContentAnalysisService analysisService;

    @Inject
    HackerNewsEditorial editorial;

    @Override
    public SourceType sourceType() {
        return SourceType.HACKERNEWS;
    }

    @Override
    public ProcessorResult process(ContentItem item) {
        ItemUpdate.Builder update = ItemUpdate.builder();
        Map<String, Object> enrichments = new HashMap<>();

        HnItem story = fetchStory(item).orElse(null);
        if (story != null) {
            List<HnComment> comments = HackerNewsClient.collectComments(story.children());
            LOG.debugf("Collected %d comments for HN item %d", comments.size(), story.id());

            ExtractedContent page = scrapeLinkedPage(story);
            String pageContent = page == null || page.contentLength() == 0 ? null : page.content();

            if (!comments.isEmpty()) {
                String discussion = analysisService.summarizeDiscussion(item.title, comments);
                if (discussion != null) {
                    enrichments.put("discussionSummary", discussion);
                }
            }

            List<HnSource> sources = HackerNewsEditorial.sources(story, comments, page == null ? null : page.title());
            String note = editorial.build(item.title, story, comments, sources, pageContent);
            if (note != null) {
                update.contentLocalized(note);
                enrichments.put("structuredSourceCount", sources.size());
            }
            if (pageContent != null) {
                update.content(pageContent);
            }

            enrichments.put("hnUrl", story.discussionUrl());
            // ProcessorResult copies with Map.copyOf, which rejects null values
            if (story.url() != null) {
                enrichments.put("externalUrl", story.url());
            }
            if (story.text() != null) {
                enrichments.put("hnText", story.text());
            }
        }

        AnalysisResult analysis = analysisService.analyze(AnalysisInput.from(item));
        AnalysisFill.apply(item, analysis, update, TAG);
        return new ProcessorResult(update.build(), enrichments);
    }

    private Optional<HnItem> fetchStory(ContentItem item) {
        Object itemId = item.platformData().get("itemId");
        if (itemId == null) {
            return Optional.empty();
        }
        try {
            return hackerNewsClient.fetchItem(itemId.toString());
        } catch (ExtractionException e) {
            LOG.warnf("Failed to fetch HN item %s for %s: %s", itemId, item.id, e.getMessage());
            return Optional.empty();
        }
    }

    private ExtractedContent scrapeLinkedPage(HnItem story) {
        if (story.url() == null || story.url().isBlank()) {
            return null;
        }
        try {
            return contentExtractor.extract(story.url());
        } catch (ExtractionException e) {
            LOG.warnf("Failed to scrape linked page %s of HN item %d: %s", story.url(), story.id(), e.getMessage());
            return null;
        }
    }
}
