package villagecompute.newsence.services;

import java.util.List;

/**
 * Translation of a short post with its tags and keywords.
 */
public record TweetTranslation(String summaryLocalized, List<String> tags, List<String> keywords) {
}
