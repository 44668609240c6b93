package villagecompute.newsence.processors;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.services.AnalysisInput;
import villagecompute.newsence.services.ContentAnalysisService;

/**
 * Video items: analysis over title and description, tagged {@code YouTube}. Chapter highlights are produced later by
 * the workflow's highlights step.
 */
@ApplicationScoped
public class YoutubeItemProcessor implements ItemProcessor {

    static final String TAG = "YouTube";

    @Inject
    ContentAnalysisService analysisService;

    @Override
    public SourceType sourceType() {
        return SourceType.YOUTUBE;
    }

    @Override
    public ProcessorResult process(ContentItem item) {
        ItemUpdate.Builder update = ItemUpdate.builder();
        AnalysisFill.apply(item, analysisService.analyze(AnalysisInput.from(item)), update, TAG);

        Object videoId = item.platformData().get("videoId");
        return new ProcessorResult(update.build(), videoId == null ? Map.of() : Map.of("videoId", videoId));
    }
}
