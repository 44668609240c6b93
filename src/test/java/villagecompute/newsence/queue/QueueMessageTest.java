package villagecompute.newsence.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import villagecompute.newsence.TestConstants;
import villagecompute.newsence.jobs.JobType;

class QueueMessageTest {

    @Test
    void testItemProcessMessage_BlankSourceType_DefaultsToDefaultProcessor() {
        ItemProcessMessage message = new ItemProcessMessage(TestConstants.ITEM_ID, " ");

        assertEquals("default", message.sourceType());
        assertEquals(JobType.ITEM_PROCESS, message.jobType());
    }

    @Test
    void testItemProcessMessage_PayloadCarriesKindAndIds() {
        Map<String, Object> payload = new ItemProcessMessage(TestConstants.ITEM_ID, "youtube").toPayload();

        assertEquals(ItemProcessMessage.KIND, payload.get(QueueMessage.KIND_FIELD));
        assertEquals(TestConstants.ITEM_ID.toString(), payload.get("itemId"));
        assertEquals(new ItemProcessMessage(TestConstants.ITEM_ID, "youtube"),
                ItemProcessMessage.fromPayload(payload));
    }

    @Test
    void testItemProcessMessage_MissingItemId_Rejected() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("sourceType", "rss");

        assertThrows(IllegalArgumentException.class, () -> ItemProcessMessage.fromPayload(payload));
    }

    @Test
    void testBatchProcessMessage_NullIdsBecomeEmpty() {
        BatchProcessMessage message = new BatchProcessMessage(null, "manual");

        assertTrue(message.itemIds().isEmpty());
        assertEquals(JobType.BATCH_PROCESS, message.jobType());
    }

    @Test
    void testBatchProcessMessage_FromPayloadParsesStringIds() {
        Map<String, Object> payload = Map.of("itemIds",
                List.of(TestConstants.ITEM_ID.toString(), TestConstants.ITEM_ID_2.toString()), "triggeredBy",
                "retry_cron");

        BatchProcessMessage message = BatchProcessMessage.fromPayload(payload);

        assertEquals(List.of(TestConstants.ITEM_ID, TestConstants.ITEM_ID_2), message.itemIds());
        assertEquals("retry_cron", message.triggeredBy());
    }
}
