package villagecompute.newsence.processors;

import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.stores.ItemUpdate;
import villagecompute.newsence.services.AnalysisResult;

/**
 * Copies analysis output into an update, only for fields the item does not have yet.
 */
final class AnalysisFill {

    private AnalysisFill() {
        // Utility class, no instantiation
    }

    static void apply(ContentItem item, AnalysisResult analysis, ItemUpdate.Builder update, String... extraTags) {
        if (item.tags == null || item.tags.isEmpty()) {
            update.tags(analysis.tagsWithCategory(extraTags));
        }
        if (item.keywords == null || item.keywords.isEmpty()) {
            update.keywords(analysis.keywords());
        }
        if (isBlank(item.titleLocalized)) {
            update.titleLocalized(analysis.titleLocalized());
        }
        if (isBlank(item.summary)) {
            update.summary(analysis.summaryEn());
        }
        if (isBlank(item.summaryLocalized)) {
            update.summaryLocalized(analysis.summaryLocalized());
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
