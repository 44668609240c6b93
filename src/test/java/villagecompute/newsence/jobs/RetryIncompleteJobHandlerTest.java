package villagecompute.newsence.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.newsence.TestConstants;
import villagecompute.newsence.TestFixtures;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.stores.InMemoryItemStore;
import villagecompute.newsence.queue.BatchProcessMessage;
import villagecompute.newsence.queue.ItemQueue;
import villagecompute.newsence.queue.QueueMessage;

class RetryIncompleteJobHandlerTest {

    @Mock
    ItemQueue itemQueue;

    private RetryIncompleteJobHandler handler;
    private InMemoryItemStore itemStore;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        itemStore = new InMemoryItemStore();
        handler = new RetryIncompleteJobHandler();
        handler.itemStore = itemStore;
        handler.itemQueue = itemQueue;
        handler.lookbackHours = 48;
        handler.batchSize = 2;
        handler.clock = Clock.fixed(TestConstants.NOW, ZoneOffset.UTC);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private void incomplete(UUID id, Duration age) {
        ContentItem item = TestFixtures.article(id);
        item.ingestedAt = TestConstants.NOW.minus(age);
        itemStore.put(item);
    }

    @Test
    void testRequeueIncomplete_ChunksRecentItems() {
        incomplete(TestConstants.ITEM_ID, Duration.ofHours(1));
        incomplete(TestConstants.ITEM_ID_2, Duration.ofHours(2));
        incomplete(TestConstants.ITEM_ID_3, Duration.ofHours(3));

        int queued = handler.requeueIncomplete();

        assertEquals(3, queued);
        ArgumentCaptor<QueueMessage> sent = ArgumentCaptor.forClass(QueueMessage.class);
        verify(itemQueue, times(2)).send(sent.capture());
        BatchProcessMessage first = (BatchProcessMessage) sent.getAllValues().get(0);
        assertEquals(2, first.itemIds().size());
        assertEquals(RetryIncompleteJobHandler.TRIGGERED_BY, first.triggeredBy());
    }

    @Test
    void testRequeueIncomplete_IgnoresOldAndCompleteItems() {
        incomplete(TestConstants.ITEM_ID, Duration.ofHours(72));
        ContentItem done = TestFixtures.item(TestConstants.ITEM_ID_2, TestConstants.ARTICLE_URL, "rss");
        done.titleLocalized = "t";
        done.summaryLocalized = "s";
        done.embedding = TestFixtures.axis();
        itemStore.put(done);

        assertEquals(0, handler.requeueIncomplete());
        verify(itemQueue, never()).send(any());
    }

    @Test
    void testRequeueIncomplete_SingleChunk() {
        incomplete(TestConstants.ITEM_ID, Duration.ofHours(1));

        assertEquals(1, handler.requeueIncomplete());

        ArgumentCaptor<QueueMessage> sent = ArgumentCaptor.forClass(QueueMessage.class);
        verify(itemQueue).send(sent.capture());
        assertEquals(List.of(TestConstants.ITEM_ID), ((BatchProcessMessage) sent.getValue()).itemIds());
    }
}
