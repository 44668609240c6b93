package villagecompute.newsence.data.stores;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Field-level partial update of a content item. Null fields are left untouched by
 * {@link ItemStore#updateFields(java.util.UUID, ItemUpdate)}.
 *
 * <p>
 * Also the checkpointed result of the {@code ai-analysis} step, so it must stay JSON-serializable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemUpdate(String title, String titleLocalized, String summary, String summaryLocalized,
        String content, String contentLocalized, List<String> tags, List<String> keywords) {

    public static ItemUpdate empty() {
        return new ItemUpdate(null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && titleLocalized == null && summary == null && summaryLocalized == null
                && content == null && contentLocalized == null && tags == null && keywords == null;
    }

    public ItemUpdate withContentLocalized(String value) {
        return new ItemUpdate(title, titleLocalized, summary, summaryLocalized, content, value, tags, keywords);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String titleLocalized;
        private String summary;
        private String summaryLocalized;
        private String content;
        private String contentLocalized;
        private List<String> tags;
        private List<String> keywords;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder titleLocalized(String titleLocalized) {
            this.titleLocalized = titleLocalized;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder summaryLocalized(String summaryLocalized) {
            this.summaryLocalized = summaryLocalized;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder contentLocalized(String contentLocalized) {
            this.contentLocalized = contentLocalized;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = keywords;
            return this;
        }

        public ItemUpdate build() {
            return new ItemUpdate(title, titleLocalized, summary, summaryLocalized, content, contentLocalized, tags,
                    keywords);
        }
    }
}
