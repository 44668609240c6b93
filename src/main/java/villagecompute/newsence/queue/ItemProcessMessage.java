package villagecompute.newsence.queue;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.jobs.JobType;

/**
 * Run the enrichment workflow for one item.
 *
 * @param itemId
 *            stored item id
 * @param sourceType
 *            processor selector, see {@link SourceType}
 */
public record ItemProcessMessage(UUID itemId, String sourceType) implements QueueMessage {

    public static final String KIND = "item_process";

    public ItemProcessMessage {
        Objects.requireNonNull(itemId, "itemId is required");
        if (sourceType == null || sourceType.isBlank()) {
            sourceType = SourceType.DEFAULT.value();
        }
    }

    @Override
    public JobType jobType() {
        return JobType.ITEM_PROCESS;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(KIND_FIELD, KIND);
        payload.put("itemId", itemId.toString());
        payload.put("sourceType", sourceType);
        return payload;
    }

    public static ItemProcessMessage fromPayload(Map<String, Object> payload) {
        Object itemId = payload.get("itemId");
        if (itemId == null) {
            throw new IllegalArgumentException("item_process payload missing itemId");
        }
        Object sourceType = payload.get("sourceType");
        return new ItemProcessMessage(UUID.fromString(itemId.toString()),
                sourceType == null ? null : sourceType.toString());
    }
}
