package villagecompute.newsence.services;

import java.util.Map;

import villagecompute.newsence.data.models.SourceType;

/**
 * Platform classification of a URL.
 *
 * @param sourceType
 *            type the item is stored under
 * @param metadata
 *            {@code {type, fetchedAt, data}} platform metadata, or null when the URL is not platform content
 */
public record PlatformResolution(SourceType sourceType, Map<String, Object> metadata) {
}
