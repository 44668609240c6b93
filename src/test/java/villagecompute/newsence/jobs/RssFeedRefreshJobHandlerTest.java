package villagecompute.newsence.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;

import villagecompute.newsence.TestConstants;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.FeedSource;
import villagecompute.newsence.data.models.FeedSource.ContentSource;
import villagecompute.newsence.data.models.FeedSource.SummarySource;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.services.IngestionCandidate;
import villagecompute.newsence.services.PlatformResolution;

class RssFeedRefreshJobHandlerTest {

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0" xmlns:content="http://purl.org/rss/1.0/modules/content/">
              <channel>
                <title>Example Feed</title>
                <link>https://example.com</link>
                <description>Example</description>
                <item>
                  <title>First &amp; foremost</title>
                  <link>https://example.com/first</link>
                  <comments>https://news.ycombinator.com/item?id=41234567</comments>
                  <description>&lt;p&gt;Short description&lt;/p&gt;</description>
                  <content:encoded><![CDATA[<p>Full body one.</p><p>Full body two.</p>]]></content:encoded>
                  <pubDate>Sat, 31 May 2025 10:00:00 GMT</pubDate>
                </item>
                <item>
                  <title>No link here</title>
                  <description>Orphan</description>
                </item>
                <item>
                  <title></title>
                  <link>https://example.com/third</link>
                  <description>Third description</description>
                </item>
              </channel>
            </rss>
            """;

    @Mock
    ContentExtractor contentExtractor;

    private RssFeedRefreshJobHandler handler;
    private FeedSource source;
    private List<SyndEntry> entries;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        handler = new RssFeedRefreshJobHandler();
        handler.contentExtractor = contentExtractor;
        handler.maxFeedItems = 30;
        handler.clock = Clock.fixed(TestConstants.NOW, ZoneOffset.UTC);

        source = new FeedSource();
        source.id = UUID.randomUUID();
        source.name = "Example Feed";
        source.url = "https://example.com/feed.xml";

        SyndFeed feed = RssFeedRefreshJobHandler.parse(new ByteArrayInputStream(FEED.getBytes(StandardCharsets.UTF_8)));
        entries = feed.getEntries();
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static PlatformResolution web() {
        return new PlatformResolution(SourceType.RSS, Map.of());
    }

    @Test
    void testCandidatesFor_SkipsEntriesWithoutLink() {
        List<IngestionCandidate> candidates = handler.candidatesFor(source, entries);

        assertEquals(2, candidates.size());
        assertEquals("https://example.com/first", candidates.get(0).url());
        assertEquals(TestConstants.HN_DISCUSSION_URL, candidates.get(0).discussionUrl());
        assertNull(candidates.get(1).discussionUrl());
    }

    @Test
    void testCandidatesFor_CapsAtMaxFeedItems() {
        handler.maxFeedItems = 1;

        assertEquals(1, handler.candidatesFor(source, entries).size());
    }

    @Test
    void testDraftFor_ContentEncoded_UsesFullBody() {
        source.summarySource = SummarySource.DESCRIPTION;
        source.contentSource = ContentSource.CONTENT_ENCODED;

        ContentItem item = handler.draftFor(source, entries.get(0), "https://example.com/first", web());

        assertEquals("First & foremost", item.title);
        assertEquals("Short description", item.summary);
        assertEquals("Full body one.\n\nFull body two.", item.content);
        assertEquals(Instant.parse("2025-05-31T10:00:00Z"), item.publishedAt);
    }

    @Test
    void testDraftFor_BlankTitleAndNoDate_UsesDefaults() {
        source.contentSource = ContentSource.DESCRIPTION;

        ContentItem item = handler.draftFor(source, entries.get(2), "https://example.com/third", web());

        assertEquals(RssFeedRefreshJobHandler.NO_TITLE, item.title);
        assertEquals(TestConstants.NOW, item.publishedAt);
        assertEquals("Third description", item.content);
    }

    @Test
    void testDraftFor_AiSummarySource_LeavesSummaryEmpty() {
        source.summarySource = SummarySource.AI;
        source.contentSource = ContentSource.SKIP;

        ContentItem item = handler.draftFor(source, entries.get(0), "https://example.com/first", web());

        assertNull(item.summary);
        assertNull(item.content);
    }

    @Test
    void testDraftFor_Scrape_UsesExtractedArticle() {
        source.contentSource = ContentSource.SCRAPE;
        when(contentExtractor.extract("https://example.com/first"))
                .thenReturn(new ExtractedContent("First", TestConstants.ARTICLE_CONTENT, null,
                        "https://example.com/og.png", "Example", null, Map.of()));

        ContentItem item = handler.draftFor(source, entries.get(0), "https://example.com/first", web());

        assertEquals(TestConstants.ARTICLE_CONTENT, item.content);
        assertEquals("https://example.com/og.png", item.ogImageUrl);
    }

    @Test
    void testDraftFor_ScrapeFails_FallsBackToDescription() {
        source.contentSource = ContentSource.SCRAPE;
        when(contentExtractor.extract(anyString())).thenThrow(new ExtractionException("HTTP 403"));

        ContentItem item = handler.draftFor(source, entries.get(0), "https://example.com/first", web());

        assertEquals("Short description", item.content);
    }

    @Test
    void testDraftFor_ScrapeSkippedForPlatformItems() {
        source.contentSource = ContentSource.SCRAPE;

        ContentItem item = handler.draftFor(source, entries.get(0), TestConstants.YOUTUBE_URL,
                new PlatformResolution(SourceType.YOUTUBE, Map.of()));

        assertNull(item.content);
        verify(contentExtractor, never()).extract(anyString());
    }
}
