package villagecompute.newsence.services;

import villagecompute.newsence.data.models.ContentItem;

/**
 * Fields an analysis prompt is built from, plus the localized fields the deterministic fallback reuses.
 */
public record AnalysisInput(String title, String source, String summary, String summaryLocalized,
        String titleLocalized, String content) {

    public static AnalysisInput from(ContentItem item) {
        return new AnalysisInput(item.title == null ? "" : item.title, item.source, item.summary, item.summaryLocalized,
                item.titleLocalized, item.content);
    }

    public AnalysisInput withArticle(String newTitle, String newContent, String newSummary) {
        return new AnalysisInput(newTitle, source, newSummary, summaryLocalized, titleLocalized, newContent);
    }
}
