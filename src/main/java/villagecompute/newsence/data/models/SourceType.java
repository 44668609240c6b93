package villagecompute.newsence.data.models;

import java.util.Locale;

/**
 * Platform discriminator of a {@link ContentItem}. Stored in {@code content_items.source_type} by its lowercase
 * {@link #value()} and used to select the enrichment processor.
 */
public enum SourceType {

    RSS("rss"),

    TWITTER("twitter"),

    YOUTUBE("youtube"),

    HACKERNEWS("hackernews"),

    WEB("web"),

    /**
     * Fallback processor type for items whose stored type is missing or unknown.
     */
    DEFAULT("default");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a stored source type string, falling back to {@link #DEFAULT}.
     *
     * @param value
     *            stored value, may be null
     * @return matching source type, or DEFAULT when unrecognised
     */
    public static SourceType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return DEFAULT;
    }
}
