package villagecompute.newsence.workflow;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to a workflow status query. {@code item} is present only once the instance completed and its item exists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStatusView(String status, @JsonProperty("failure_reason") String failureReason, Item item) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Item(UUID id, String url, String title, @JsonProperty("title_localized") String titleLocalized,
            String summary, @JsonProperty("summary_localized") String summaryLocalized,
            @JsonProperty("source_type") String sourceType, @JsonProperty("topic_id") UUID topicId) {
    }
}
