package villagecompute.newsence.processors;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.services.AnalysisInput;
import villagecompute.newsence.services.AnalysisResult;
import villagecompute.newsence.services.ContentAnalysisService;

/**
 * Manually submitted pages. Re-extracts the page when the stored item has no content, then analyses it like a feed
 * article.
 */
@ApplicationScoped
public class WebItemProcessor implements ItemProcessor {

    private static final Logger LOG = Logger.getLogger(WebItemProcessor.class);

    @Inject
    ContentExtractor contentExtractor;

    @Inject
    ContentAnalysisService analysisService;

    @Override
    public SourceType sourceType() {
        return SourceType.WEB;
    }

    @Override
    public ProcessorResult process(ContentItem item) {
        ItemUpdate.Builder update = ItemUpdate.builder();
        AnalysisInput input = AnalysisInput.from(item);

        if (AnalysisFill.isBlank(item.content)) {
            try {
                ExtractedContent page = contentExtractor.extract(item.url);
                if (page.contentLength() > 0) {
                    update.content(page.content());
                    input = input.withArticle(item.title, page.content(),
                            item.summary != null ? item.summary : page.summary());
                }
            } catch (ExtractionException e) {
                LOG.warnf("Re-extraction of %s failed, analysing stored fields only: %s", item.url, e.getMessage());
            }
        }

        AnalysisResult analysis = analysisService.analyze(input);
        AnalysisFill.apply(item, analysis, update);
        if (analysis.titleEn() != null && AnalysisFill.isBlank(item.titleLocalized)) {
            update.title(analysis.titleEn());
        }
        return ProcessorResult.of(update.build());
    }
}
