package villagecompute.newsence.integration.extraction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.services.PlatformMetadataService;
import villagecompute.newsence.util.HtmlText;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Readable-content extractor built on Jsoup.
 *
 * <p>
 * Reads OpenGraph tags for title, description, image and site name, then takes the main text from the first of
 * {@code article}, {@code main}, {@code [role=main]} or {@code body}, dropping navigation, scripts and forms. Platform
 * metadata comes from {@link PlatformMetadataService}.
 */
@ApplicationScoped
public class JsoupContentExtractor implements ContentExtractor {

    private static final Logger LOG = Logger.getLogger(JsoupContentExtractor.class);

    private static final int TIMEOUT_MS = 15000;
    private static final int MAX_BODY_SIZE = 5 * 1024 * 1024;
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; NewsenceBot/1.0; +https://newsence.app)";

    @Inject
    PlatformMetadataService platformMetadataService;

    @Override
    public ExtractedContent extract(String url) {
        Document doc;
        try {
            doc = Jsoup.connect(url).userAgent(USER_AGENT).timeout(TIMEOUT_MS).maxBodySize(MAX_BODY_SIZE)
                    .followRedirects(true).get();
        } catch (IOException | IllegalArgumentException e) {
            throw new ExtractionException("Failed to fetch " + url + ": " + e.getMessage(), e);
        }

        String title = firstNonBlank(meta(doc, "meta[property=og:title]"), doc.title());
        String summary = firstNonBlank(meta(doc, "meta[property=og:description]"),
                meta(doc, "meta[name=description]"));
        String image = meta(doc, "meta[property=og:image]");
        String siteName = firstNonBlank(meta(doc, "meta[property=og:site_name]"), hostOf(url));
        Instant publishedAt = parseInstant(meta(doc, "meta[property=article:published_time]"));

        doc.select("script, style, nav, header, footer, aside, form, noscript, iframe").remove();
        Element root = firstPresent(doc, "article", "main", "[role=main]");
        String content = HtmlText.toParagraphs(root != null ? root : doc.body());

        LOG.debugf("Extracted %s: title=\"%s\", contentChars=%d", url, title, content.length());
        return new ExtractedContent(title, content, summary, image, siteName, publishedAt,
                platformMetadataService.resolve(url, null, SourceType.WEB).metadata());
    }

    private static String meta(Document doc, String cssQuery) {
        Element element = doc.selectFirst(cssQuery);
        if (element == null) {
            return null;
        }
        String content = element.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    private static Element firstPresent(Document doc, String... selectors) {
        for (String selector : selectors) {
            Element element = doc.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element;
            }
        }
        return null;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null || second.isBlank() ? null : second.trim();
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring unparseable published_time: %s", value);
            return null;
        }
    }
}
