package villagecompute.newsence.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.newsence.TestConstants;
import villagecompute.newsence.TestFixtures;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.data.stores.InMemoryItemStore;
import villagecompute.newsence.exceptions.DatastoreException;
import villagecompute.newsence.observability.PipelineMetrics;
import villagecompute.newsence.queue.ItemProcessMessage;
import villagecompute.newsence.queue.ItemQueue;
import villagecompute.newsence.queue.QueueMessage;

class IngestionServiceTest {

    @Mock
    ItemQueue itemQueue;

    @Mock
    PlatformMetadataService platformMetadataService;

    private IngestionService service;
    private InMemoryItemStore itemStore;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        itemStore = new InMemoryItemStore();
        service = new IngestionService();
        service.itemStore = itemStore;
        service.itemQueue = itemQueue;
        service.platformMetadataService = platformMetadataService;
        service.metrics = new PipelineMetrics(new SimpleMeterRegistry());
        service.dedupChunkSize = 2;

        when(platformMetadataService.resolve(anyString(), any(), any()))
                .thenAnswer(invocation -> new PlatformResolution(invocation.getArgument(2), Map.of()));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static IngestionCandidate candidate(String url) {
        return new IngestionCandidate(url, null, (normalizedUrl, platform) -> {
            ContentItem item = new ContentItem();
            item.title = "Title for " + normalizedUrl;
            item.publishedAt = TestConstants.NOW;
            return item;
        });
    }

    @Test
    void testIngest_NewUrls_InsertsAndQueues() {
        IngestionReport report = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a"), candidate("https://example.com/b")));

        assertEquals(2, report.inserted());
        assertEquals(2, report.insertedIds().size());
        assertEquals(2, itemStore.items.size());
        ContentItem stored = itemStore.items.get(report.insertedIds().get(0));
        assertEquals("rss", stored.sourceType);
        assertEquals("Example Feed", stored.source);

        ArgumentCaptor<QueueMessage> sent = ArgumentCaptor.forClass(QueueMessage.class);
        verify(itemQueue, times(2)).send(sent.capture());
        ItemProcessMessage first = (ItemProcessMessage) sent.getAllValues().get(0);
        assertEquals(stored.id, first.itemId());
        assertEquals("rss", first.sourceType());
    }

    @Test
    void testIngest_SameUrlTwiceInBatch_InsertedOnce() {
        IngestionReport report = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a?utm_source=x"), candidate("https://example.com/a")));

        assertEquals(1, report.inserted());
        assertEquals(1, report.duplicates());
        assertEquals(1, itemStore.items.size());
    }

    @Test
    void testIngest_ExistingUrl_CountedAsDuplicate() {
        ContentItem existing = TestFixtures.item(TestConstants.ITEM_ID, "https://example.com/a", "rss");
        existing.source = "Example Feed";
        itemStore.put(existing);

        IngestionReport report = service.ingest("rss", "Other Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a")));

        assertEquals(0, report.inserted());
        assertEquals(1, report.duplicates());
        verify(itemQueue, never()).send(any());
        assertEquals("Example Feed", itemStore.items.get(TestConstants.ITEM_ID).source);
    }

    @Test
    void testIngest_ExistingTwitterItem_UpgradedToFeedSource() {
        ContentItem existing = TestFixtures.item(TestConstants.ITEM_ID, "https://example.com/a", "twitter");
        existing.source = "Twitter";
        itemStore.put(existing);
        when(platformMetadataService.discussionMetadata(isNull())).thenReturn(Optional.empty());

        IngestionReport report = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a")));

        assertEquals(1, report.upgraded());
        ContentItem upgraded = itemStore.items.get(TestConstants.ITEM_ID);
        assertEquals("Example Feed", upgraded.source);
        assertEquals("twitter", upgraded.sourceType, "Source type never changes on upgrade");
    }

    @Test
    void testIngest_SameUpgradeTwice_SecondRunIsNoOp() {
        ContentItem existing = TestFixtures.item(TestConstants.ITEM_ID, "https://example.com/a", "twitter");
        existing.source = "Twitter";
        itemStore.put(existing);
        when(platformMetadataService.discussionMetadata(isNull())).thenReturn(Optional.empty());

        IngestionReport first = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a")));
        IngestionReport second = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a")));

        assertEquals(1, first.upgraded());
        assertEquals(0, second.upgraded());
        assertEquals(1, second.duplicates());
        assertEquals("Example Feed", itemStore.items.get(TestConstants.ITEM_ID).source);
        assertEquals(1, itemStore.items.size());
        verify(itemQueue, never()).send(any());
    }

    @Test
    void testIngest_OneInsertFails_OthersStillStored() {
        IngestionCandidate broken = new IngestionCandidate("https://example.com/broken", null,
                (normalizedUrl, platform) -> {
                    throw new IllegalStateException("draft failed");
                });

        IngestionReport report = service.ingest("rss", "Example Feed", SourceType.RSS,
                List.of(candidate("https://example.com/a"), broken, candidate("https://example.com/c")));

        assertEquals(2, report.inserted());
        assertEquals(1, report.failed());
        assertEquals(3, report.total());
    }

    @Test
    void testIngest_QueueFails_ItemStillCountedAsInserted() {
        when(itemQueue.send(any())).thenThrow(new DatastoreException("queue down"));

        IngestionReport report = service.ingest("social", "Twitter", SourceType.TWITTER,
                List.of(candidate(TestConstants.TWEET_URL)));

        assertEquals(1, report.inserted());
        assertEquals(1, itemStore.items.size());
        verify(platformMetadataService).resolve(eq(TestConstants.TWEET_URL), isNull(), eq(SourceType.TWITTER));
    }
}
