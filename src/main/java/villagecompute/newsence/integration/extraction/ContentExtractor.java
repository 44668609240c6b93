package villagecompute.newsence.integration.extraction;

/**
 * Fetches a URL and returns its readable content.
 *
 * <p>
 * Implementations throw {@link villagecompute.newsence.exceptions.ExtractionException} when the page cannot be fetched
 * or parsed.
 */
public interface ContentExtractor {

    ExtractedContent extract(String url);
}
