package villagecompute.newsence.processors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.services.AnalysisInput;
import villagecompute.newsence.services.AnalysisResult;
import villagecompute.newsence.services.ContentAnalysisService;

/**
 * AI analysis for feed articles and any item without a dedicated processor.
 */
@ApplicationScoped
public class DefaultItemProcessor implements ItemProcessor {

    @Inject
    ContentAnalysisService analysisService;

    @Override
    public SourceType sourceType() {
        return SourceType.DEFAULT;
    }

    @Override
    public ProcessorResult process(ContentItem item) {
        AnalysisResult analysis = analysisService.analyze(AnalysisInput.from(item));
        ItemUpdate.Builder update = ItemUpdate.builder();
        AnalysisFill.apply(item, analysis, update);

        // Feeds in other languages get an English display title
        if (analysis.titleEn() != null && AnalysisFill.isBlank(item.titleLocalized)) {
            update.title(analysis.titleEn());
        }
        return ProcessorResult.of(update.build());
    }
}
