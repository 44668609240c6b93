package villagecompute.newsence.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonicalizes item URLs so that the same article reached through different share links maps to one stored row.
 *
 * <p>
 * <b>Rules:</b>
 * <ol>
 * <li>Scheme and host are lowercased, default ports dropped, an empty path becomes {@code /}</li>
 * <li>Query parameters named in {@link #TRACKING_PARAMS} are removed</li>
 * <li>Remaining parameters are sorted by name (stable, so repeated names keep their relative order) and re-encoded in
 * form encoding</li>
 * <li>The {@code ?} is dropped when no parameter survives; the fragment is preserved</li>
 * </ol>
 *
 * <p>
 * Input that cannot be parsed as an absolute hierarchical URL is returned unchanged. {@code normalize} is idempotent.
 */
public final class UrlNormalizer {

    /**
     * Tracking, session and cache-busting parameters stripped from every URL.
     */
    public static final Set<String> TRACKING_PARAMS = Set.of("utm_source", "utm_medium", "utm_campaign",
            "utm_content", "utm_term", "ref", "fbclid", "gclid", "mc_eid", "mc_cid", "access_token", "token",
            "auth_token", "api_key", "_", "__", "nc", "cachebust", "noCache", "cache", "rand", "random", "_rnd",
            "_refresh", "_t", "_ts", "_dc", "_q", "_nocache", "timestamp", "ts", "time", "cb", "r", "sid", "ttl",
            "vfff", "ttt");

    private UrlNormalizer() {
        // Utility class, no instantiation
    }

    /**
     * Normalizes a URL.
     *
     * @param url
     *            raw URL as received from a feed, social post or submitter
     * @return canonical URL, or the input unchanged when it is not a parseable absolute URL
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            return url;
        }
        if (uri.getScheme() == null || uri.isOpaque() || uri.getHost() == null) {
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder result = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            result.append(uri.getRawUserInfo()).append('@');
        }
        result.append(uri.getHost().toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            result.append(':').append(port);
        }

        String path = uri.getRawPath();
        result.append(path == null || path.isEmpty() ? "/" : path);

        String query = canonicalQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            result.append('?').append(query);
        }
        if (uri.getRawFragment() != null) {
            result.append('#').append(uri.getRawFragment());
        }
        return result.toString();
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String[]> params = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = decode(eq >= 0 ? pair.substring(0, eq) : pair);
            String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
            if (!TRACKING_PARAMS.contains(name)) {
                params.add(new String[]{name, value});
            }
        }
        // List.sort is stable
        params.sort(Comparator.comparing(p -> p[0]));

        StringBuilder query = new StringBuilder();
        for (String[] param : params) {
            if (query.length() > 0) {
                query.append('&');
            }
            query.append(encode(param[0])).append('=').append(encode(param[1]));
        }
        return query.toString();
    }

    private static String decode(String component) {
        try {
            return URLDecoder.decode(component, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed percent escape, keep the raw text
            return component;
        }
    }

    private static String encode(String component) {
        return URLEncoder.encode(component, StandardCharsets.UTF_8);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
