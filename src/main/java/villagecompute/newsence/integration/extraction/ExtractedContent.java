package villagecompute.newsence.integration.extraction;

import java.time.Instant;
import java.util.Map;

/**
 * Result of extracting a page.
 *
 * @param title
 *            page or post title
 * @param content
 *            main text, paragraphs separated by blank lines
 * @param summary
 *            description or excerpt
 * @param ogImageUrl
 *            preview image
 * @param siteName
 *            publisher name, used as the item's source label for manual submissions
 * @param publishedAt
 *            publication time when the page declares one
 * @param platformMetadata
 *            platform metadata ({@code {type, fetchedAt, data}}) or null
 */
public record ExtractedContent(String title, String content, String summary, String ogImageUrl, String siteName,
        Instant publishedAt, Map<String, Object> platformMetadata) {

    public int contentLength() {
        return content == null ? 0 : content.length();
    }
}
