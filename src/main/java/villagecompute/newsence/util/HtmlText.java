package villagecompute.newsence.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

/**
 * HTML to plain text helpers built on Jsoup.
 */
public final class HtmlText {

    private HtmlText() {
        // Utility class, no instantiation
    }

    /**
     * Strips tags and decodes entities, collapsing all whitespace to single spaces.
     *
     * @return clean text, or an empty string for null input
     */
    public static String clean(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
    }

    /**
     * Converts an HTML fragment to text that keeps block boundaries as blank lines.
     */
    public static String toParagraphs(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return toParagraphs(Jsoup.parseBodyFragment(html).body());
    }

    /**
     * Collects the text of block elements under {@code root}, one paragraph per block.
     */
    public static String toParagraphs(Element root) {
        StringBuilder text = new StringBuilder();
        for (Element block : root.select("h1, h2, h3, h4, p, li, blockquote, pre")) {
            // Nested blocks are emitted by their own match
            if (!block.is("pre") && !block.children().select("p, li, blockquote, pre").isEmpty()) {
                continue;
            }
            String line = block.is("pre") ? block.wholeText().trim() : block.text().trim();
            if (line.isEmpty()) {
                continue;
            }
            if (block.is("li")) {
                line = "- " + line;
            } else if (block.is("h1, h2, h3, h4")) {
                line = "## " + line;
            }
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(line);
        }
        if (text.length() == 0) {
            return root.text().trim();
        }
        return text.toString();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
