package villagecompute.newsence.services;

import villagecompute.newsence.data.models.ContentItem;

/**
 * One entry offered by a producer run.
 *
 * @param url
 *            raw URL as published by the producer
 * @param discussionUrl
 *            optional comments link (RSS {@code <comments>}), used for platform classification and upgrades
 * @param draftFactory
 *            builds the row to insert once the URL is known to be new
 */
public record IngestionCandidate(String url, String discussionUrl, DraftFactory draftFactory) {

    /**
     * Builds the insert record for a new item. Called at most once per candidate, after deduplication, so expensive
     * work (page scraping) is only done for genuinely new URLs.
     */
    @FunctionalInterface
    public interface DraftFactory {

        /**
         * @param normalizedUrl
         *            the URL the item will be stored under
         * @param platform
         *            resolved source type and platform metadata
         * @return the draft; {@code url}, {@code sourceType}, {@code source} and {@code platformMetadata} are filled
         *         in by the caller when left null
         */
        ContentItem create(String normalizedUrl, PlatformResolution platform);
    }
}
