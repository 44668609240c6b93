package villagecompute.newsence.util;

import villagecompute.newsence.data.models.SourceType;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies URLs by hosting platform and extracts platform identifiers.
 */
public final class PlatformDetector {

    private static final Set<String> HACKERNEWS_HOSTS = Set.of("news.ycombinator.com", "ycombinator.com",
            "www.ycombinator.com");

    private static final Set<String> YOUTUBE_HOSTS = Set.of("youtube.com", "www.youtube.com", "m.youtube.com",
            "youtu.be", "www.youtu.be");

    private static final Set<String> TWITTER_HOSTS = Set.of("twitter.com", "x.com", "www.twitter.com", "www.x.com",
            "mobile.twitter.com");

    private static final Pattern HN_ITEM_ID = Pattern.compile("[?&]id=(\\d+)");

    private static final Pattern YOUTUBE_WATCH_ID = Pattern.compile("[?&]v=([A-Za-z0-9_-]{6,})");

    private static final Pattern YOUTUBE_PATH_ID = Pattern
            .compile("/(?:shorts|embed|live)/([A-Za-z0-9_-]{6,})|^/([A-Za-z0-9_-]{6,})$");

    private static final Pattern TWEET_ID = Pattern.compile("/status(?:es)?/(\\d+)");

    private PlatformDetector() {
        // Utility class, no instantiation
    }

    /**
     * Detects the platform hosting a URL.
     *
     * @param url
     *            absolute URL
     * @return HACKERNEWS, YOUTUBE or TWITTER for known hosts, WEB otherwise (including unparseable input)
     */
    public static SourceType detect(String url) {
        String host = host(url);
        if (host == null) {
            return SourceType.WEB;
        }
        if (HACKERNEWS_HOSTS.contains(host)) {
            return SourceType.HACKERNEWS;
        }
        if (YOUTUBE_HOSTS.contains(host)) {
            return SourceType.YOUTUBE;
        }
        if (TWITTER_HOSTS.contains(host)) {
            return SourceType.TWITTER;
        }
        return SourceType.WEB;
    }

    public static boolean isTwitterUrl(String url) {
        return detect(url) == SourceType.TWITTER;
    }

    public static boolean isHackerNewsUrl(String url) {
        return detect(url) == SourceType.HACKERNEWS;
    }

    /**
     * Extracts the numeric item id from a Hacker News discussion URL ({@code item?id=123}).
     */
    public static Optional<String> extractHackerNewsId(String url) {
        if (url == null || !isHackerNewsUrl(url)) {
            return Optional.empty();
        }
        Matcher matcher = HN_ITEM_ID.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Optional<String> extractYoutubeVideoId(String url) {
        if (url == null || detect(url) != SourceType.YOUTUBE) {
            return Optional.empty();
        }
        Matcher watch = YOUTUBE_WATCH_ID.matcher(url);
        if (watch.find()) {
            return Optional.of(watch.group(1));
        }
        String path = URI.create(url).getPath();
        if (path == null) {
            return Optional.empty();
        }
        Matcher pathMatcher = YOUTUBE_PATH_ID.matcher(path);
        if (pathMatcher.find()) {
            return Optional.ofNullable(pathMatcher.group(1) != null ? pathMatcher.group(1) : pathMatcher.group(2));
        }
        return Optional.empty();
    }

    public static Optional<String> extractTweetId(String url) {
        if (url == null || !isTwitterUrl(url)) {
            return Optional.empty();
        }
        Matcher matcher = TWEET_ID.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String host(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
