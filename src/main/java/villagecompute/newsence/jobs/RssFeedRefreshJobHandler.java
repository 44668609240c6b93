package villagecompute.newsence.jobs;

import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.FeedSource;
import villagecompute.newsence.data.models.FeedSource.ContentSource;
import villagecompute.newsence.data.models.FeedSource.SummarySource;
import villagecompute.newsence.data.models.SourceType;
import villagecompute.newsence.exceptions.ExtractionException;
import villagecompute.newsence.integration.extraction.ContentExtractor;
import villagecompute.newsence.integration.extraction.ExtractedContent;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.observability.PipelineMetrics;
import villagecompute.newsence.services.IngestionCandidate;
import villagecompute.newsence.services.IngestionReport;
import villagecompute.newsence.services.IngestionService;
import villagecompute.newsence.services.PlatformResolution;
import villagecompute.newsence.util.HtmlText;

/**
 * Job handler for RSS/Atom feed refresh.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Load active feeds via {@link FeedSource#findActive()}</li>
 * <li>For each feed:
 * <ul>
 * <li>Fetch the XML via HTTP with a 5-second connect timeout</li>
 * <li>Parse with Rome {@link SyndFeedInput}; keep the first {@code newsence.ingestion.max-feed-items} entries</li>
 * <li>Hand the entries to {@link IngestionService}, which deduplicates against stored URLs and queues new items</li>
 * <li>Stamp {@code last_scraped_at} with {@link FeedSource#recordSuccess(java.util.UUID)}</li>
 * </ul>
 * </li>
 * <li>On error: {@link FeedSource#recordError(java.util.UUID, String)} and continue with the next feed</li>
 * </ol>
 *
 * <p>
 * <b>Content policy:</b> each feed chooses where stored content comes from ({@link ContentSource}) and whether the
 * summary is the entry description or left for AI analysis ({@link SummarySource}). Scraping happens inside the
 * draft factory, so only URLs that are actually new are fetched. Entries whose {@code <comments>} link points at a
 * Hacker News item become {@code hackernews} items.
 *
 * @see RssFeedRefreshScheduler for scheduler
 */
@ApplicationScoped
public class RssFeedRefreshJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RssFeedRefreshJobHandler.class);

    static final String PRODUCER = "rss";

    static final String NO_TITLE = "No Title";

    static final int MAX_SUMMARY_LENGTH = 1000;

    @Inject
    Tracer tracer;

    @Inject
    PipelineMetrics metrics;

    @Inject
    IngestionService ingestionService;

    @Inject
    ContentExtractor contentExtractor;

    @ConfigProperty(
            name = "newsence.ingestion.max-feed-items",
            defaultValue = "30")
    int maxFeedItems;

    Clock clock = Clock.systemUTC();

    private final HttpClient httpClient;

    public RssFeedRefreshJobHandler() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    @Override
    public JobType handlesType() {
        return JobType.RSS_FEED_REFRESH;
    }

    @Override
    public void execute(Long jobId, Map<String, Object> payload) throws Exception {
        Span span = tracer.spanBuilder("job.rss_feed_refresh").setAttribute("job.id", jobId)
                .setAttribute("job.type", JobType.RSS_FEED_REFRESH.name())
                .setAttribute("job.queue", JobType.RSS_FEED_REFRESH.getQueue().name()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(jobId);

            List<FeedSource> sources = FeedSource.findActive();
            LOG.infof("Starting feed refresh job %d: %d active feeds", jobId, sources.size());
            span.setAttribute("sources_count", sources.size());

            int successCount = 0;
            int failureCount = 0;
            for (FeedSource source : sources) {
                LoggingConfig.setFeedSource(source.name);
                try {
                    refreshSingleSource(source);
                    successCount++;
                } catch (Exception e) {
                    failureCount++;
                    span.recordException(e);
                    LOG.errorf(e, "Failed to refresh feed %s (%s): %s", source.id, source.name, e.getMessage());
                    recordError(source, e.getMessage());
                } finally {
                    LoggingConfig.setFeedSource(null);
                }
            }

            span.addEvent("refresh.completed", Attributes.of(AttributeKey.longKey("sources.success"),
                    (long) successCount, AttributeKey.longKey("sources.failure"), (long) failureCount));
            LOG.infof("Feed refresh job %d completed: %d succeeded, %d failed", jobId, successCount, failureCount);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private void refreshSingleSource(FeedSource source) throws Exception {
        Span span = tracer.spanBuilder("refresh.fetch_source").setAttribute("source_id", source.id.toString())
                .setAttribute("source_name", source.name).setAttribute("source_url", source.url).startSpan();
        Instant started = clock.instant();

        try (Scope scope = span.makeCurrent()) {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(source.url)).timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*")
                    .GET().build();
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            span.setAttribute("http.status_code", response.statusCode());

            if (response.statusCode() != 200) {
                response.body().close();
                throw new ExtractionException(String.format("HTTP %d: %s", response.statusCode(), source.url));
            }

            SyndFeed feed;
            try (InputStream inputStream = response.body()) {
                feed = parse(inputStream);
            }
            List<SyndEntry> entries = feed.getEntries();
            span.setAttribute("items_fetched", entries.size());

            IngestionReport report = ingestionService.ingest(PRODUCER, source.name, SourceType.RSS,
                    candidatesFor(source, entries));
            span.setAttribute("items_new", report.inserted());
            span.setAttribute("items_duplicate", report.duplicates());

            FeedSource.recordSuccess(source.id);
            metrics.recordFeedFetch("success", Duration.between(started, clock.instant()));
            LOG.infof("Refreshed feed %s (%s): %d entries, %d new, %d duplicates, %d upgraded", source.id, source.name,
                    entries.size(), report.inserted(), report.duplicates(), report.upgraded());
        } catch (Exception e) {
            span.recordException(e);
            metrics.recordFeedFetch("failure", Duration.between(started, clock.instant()));
            throw e;
        } finally {
            span.end();
        }
    }

    static SyndFeed parse(InputStream inputStream) throws Exception {
        return new SyndFeedInput().build(new XmlReader(inputStream));
    }

    /**
     * Turns the first {@code maxFeedItems} entries of a feed into ingestion candidates. Entries without a link are
     * skipped.
     */
    List<IngestionCandidate> candidatesFor(FeedSource source, List<SyndEntry> entries) {
        List<IngestionCandidate> candidates = new ArrayList<>();
        for (SyndEntry entry : entries) {
            if (candidates.size() >= maxFeedItems) {
                break;
            }
            String link = entry.getLink();
            if (HtmlText.isBlank(link)) {
                LOG.debugf("Skipping entry without link in feed %s: %s", source.name, entry.getTitle());
                continue;
            }
            candidates.add(new IngestionCandidate(link.trim(), entry.getComments(),
                    (url, platform) -> draftFor(source, entry, url, platform)));
        }
        return candidates;
    }

    ContentItem draftFor(FeedSource source, SyndEntry entry, String url, PlatformResolution platform) {
        ContentItem item = new ContentItem();
        item.title = HtmlText.isBlank(entry.getTitle()) ? NO_TITLE : HtmlText.clean(entry.getTitle());
        item.publishedAt = publishedAt(entry);

        String description = description(entry);
        if (source.summarySource == SummarySource.DESCRIPTION && !HtmlText.isBlank(description)) {
            item.summary = HtmlText.truncate(HtmlText.clean(description), MAX_SUMMARY_LENGTH);
        }

        switch (source.contentSource) {
            case CONTENT_ENCODED:
                item.content = firstNonBlank(HtmlText.toParagraphs(encodedContent(entry)),
                        HtmlText.toParagraphs(description));
                break;
            case DESCRIPTION:
                item.content = HtmlText.toParagraphs(description);
                break;
            case SCRAPE:
                item.content = scrape(item, url, platform, description);
                break;
            case SKIP:
            default:
                break;
        }
        return item;
    }

    /**
     * Scrapes the article page for plain web items. Platform items (Hacker News, YouTube, Twitter) are left to their
     * processors, which fetch richer data themselves.
     */
    private String scrape(ContentItem item, String url, PlatformResolution platform, String description) {
        if (platform.sourceType() != SourceType.RSS && platform.sourceType() != SourceType.WEB) {
            return null;
        }
        try {
            ExtractedContent extracted = contentExtractor.extract(url);
            if (item.ogImageUrl == null) {
                item.ogImageUrl = extracted.ogImageUrl();
            }
            return firstNonBlank(extracted.content(), HtmlText.toParagraphs(description));
        } catch (ExtractionException e) {
            LOG.warnf("Scrape failed for %s, using feed description: %s", url, e.getMessage());
            return HtmlText.toParagraphs(description);
        }
    }

    private static String description(SyndEntry entry) {
        SyndContent description = entry.getDescription();
        return description == null ? null : description.getValue();
    }

    private static String encodedContent(SyndEntry entry) {
        if (entry.getContents() == null || entry.getContents().isEmpty()) {
            return null;
        }
        StringBuilder content = new StringBuilder();
        for (SyndContent syndContent : entry.getContents()) {
            if (syndContent.getValue() != null) {
                content.append(syndContent.getValue()).append("\n");
            }
        }
        return content.toString().trim();
    }

    private Instant publishedAt(SyndEntry entry) {
        Date pubDate = entry.getPublishedDate();
        if (pubDate != null) {
            return pubDate.toInstant();
        }
        Date updatedDate = entry.getUpdatedDate();
        if (updatedDate != null) {
            return updatedDate.toInstant();
        }
        return clock.instant();
    }

    private static String firstNonBlank(String first, String second) {
        if (!HtmlText.isBlank(first)) {
            return first;
        }
        return HtmlText.isBlank(second) ? null : second;
    }

    private void recordError(FeedSource source, String errorMessage) {
        try {
            FeedSource.recordError(source.id, errorMessage);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to record error for feed %s", source.id);
        }
    }
}
