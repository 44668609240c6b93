package villagecompute.newsence.api.types;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * Manual processing trigger. An empty or missing {@code itemIds} runs the incomplete-item sweep.
 */
public record TriggerRequestType(@JsonProperty("itemIds") @Size(
        max = 5000) List<UUID> itemIds,

        @JsonProperty("triggeredBy") @Size(
                max = 100) String triggeredBy) {
}
