package villagecompute.newsence.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param mode
 *            {@code specific_items} or {@code recent_incomplete}
 */
public record TriggerResponseType(@JsonProperty("status") String status,

        @JsonProperty("item_count") int itemCount,

        @JsonProperty("processing_mode") String mode) {
}
