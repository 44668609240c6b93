package villagecompute.newsence.services;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured output of an item analysis.
 *
 * @param tags
 *            at most 5 topical tags
 * @param keywords
 *            at most 8 keywords
 * @param titleEn
 *            English title, may be null
 * @param titleLocalized
 *            title in the target language
 * @param summaryEn
 *            1-2 sentence English summary
 * @param summaryLocalized
 *            summary in the target language
 * @param category
 *            one of AI, Tech, Finance, Research, Business, Other
 * @param fallback
 *            true when the model answer was missing or malformed and the result was derived from the item itself
 */
public record AnalysisResult(List<String> tags, List<String> keywords, String titleEn, String titleLocalized,
        String summaryEn, String summaryLocalized, String category, boolean fallback) {

    public static final String DEFAULT_CATEGORY = "Other";

    /**
     * Tags followed by the category and any extra tags, without duplicates.
     */
    public List<String> tagsWithCategory(String... extra) {
        Set<String> all = new LinkedHashSet<>(tags);
        if (category != null) {
            all.add(category);
        }
        all.addAll(List.of(extra));
        return List.copyOf(all);
    }
}
