package villagecompute.newsence.queue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import villagecompute.newsence.jobs.JobType;

/**
 * Run the enrichment workflow for each listed item. Source types are resolved from the store at dispatch time.
 *
 * @param itemIds
 *            items to process
 * @param triggeredBy
 *            free-form origin label ({@code retry_cron}, {@code manual}, ...)
 */
public record BatchProcessMessage(List<UUID> itemIds, String triggeredBy) implements QueueMessage {

    public static final String KIND = "batch_process";

    public BatchProcessMessage {
        itemIds = itemIds == null ? List.of() : List.copyOf(itemIds);
    }

    @Override
    public JobType jobType() {
        return JobType.BATCH_PROCESS;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(KIND_FIELD, KIND);
        payload.put("itemIds", itemIds.stream().map(UUID::toString).toList());
        payload.put("triggeredBy", triggeredBy);
        return payload;
    }

    public static BatchProcessMessage fromPayload(Map<String, Object> payload) {
        List<UUID> ids = new ArrayList<>();
        if (payload.get("itemIds") instanceof List<?> raw) {
            for (Object id : raw) {
                ids.add(UUID.fromString(id.toString()));
            }
        }
        Object triggeredBy = payload.get("triggeredBy");
        return new BatchProcessMessage(ids, triggeredBy == null ? null : triggeredBy.toString());
    }
}
