package villagecompute.newsence.services;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import org.jboss.logging.Logger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.newsence.observability.LoggingConfig;
import villagecompute.newsence.observability.PipelineMetrics;

/**
 * Fixed-window rate limiter guarding the manual submission endpoint.
 *
 * <p>
 * Buckets live in a process-local Caffeine cache and are never persisted. A request carries a cost (the number of
 * URLs it submits) and is admitted or rejected as a whole.
 *
 * <p>
 * <b>Thread Safety:</b> each bucket is mutated under its own monitor, so concurrent hits on one key never over-admit.
 */
@ApplicationScoped
public class AdmissionControlService {

    private static final Logger LOG = Logger.getLogger(AdmissionControlService.class);

    static final String ANONYMOUS_KEY = "anon";

    @Inject
    PipelineMetrics metrics;

    Clock clock = Clock.systemUTC();

    /**
     * Buckets idle for a day are evicted; no configured window comes close to that.
     */
    private final Cache<String, RateBucket> buckets = Caffeine.newBuilder().expireAfterAccess(24, TimeUnit.HOURS)
            .maximumSize(100_000).build();

    /**
     * Mutable window state for one key.
     */
    static final class RateBucket {
        int count;
        long resetAtMillis;
    }

    /**
     * Outcome of an admission check.
     *
     * @param admitted
     *            whether the whole cost was admitted
     * @param retryAfterSeconds
     *            seconds until the current window resets, 0 when admitted
     */
    public record AdmissionResult(boolean admitted, long retryAfterSeconds) {

        static AdmissionResult admit() {
            return new AdmissionResult(true, 0);
        }

        static AdmissionResult reject(long retryAfterSeconds) {
            return new AdmissionResult(false, retryAfterSeconds);
        }
    }

    /**
     * Charges {@code cost} against the bucket for {@code key}.
     *
     * <p>
     * With no bucket or an expired window a fresh window starts, admitting iff {@code cost <= max}. Inside an active
     * window the request is admitted iff {@code count + cost <= max}. A rejected request never changes the count.
     *
     * @param key
     *            bucket key, see {@link #bucketKey(String, String)}
     * @param max
     *            window capacity, values below 1 are treated as 1
     * @param windowSeconds
     *            window length, values below 1 are treated as 1
     * @param cost
     *            units requested
     */
    public AdmissionResult hit(String key, int max, int windowSeconds, int cost) {
        int capacity = Math.max(max, 1);
        long windowMillis = Math.max(windowSeconds, 1) * 1000L;
        long now = clock.millis();

        RateBucket bucket = buckets.get(key, k -> new RateBucket());
        AdmissionResult result;
        synchronized (bucket) {
            boolean fresh = bucket.resetAtMillis == 0;
            if (fresh || bucket.resetAtMillis <= now) {
                if (cost > capacity) {
                    long retryAfter = fresh ? Math.max(windowSeconds, 1) : retryAfterSeconds(bucket, now);
                    result = AdmissionResult.reject(retryAfter);
                } else {
                    bucket.count = cost;
                    bucket.resetAtMillis = now + windowMillis;
                    result = AdmissionResult.admit();
                }
            } else if (bucket.count + cost > capacity) {
                result = AdmissionResult.reject(retryAfterSeconds(bucket, now));
            } else {
                bucket.count += cost;
                result = AdmissionResult.admit();
            }
        }

        LoggingConfig.setRateLimitBucket(key);
        metrics.recordAdmission(result.admitted());
        if (!result.admitted()) {
            LOG.warnf("Admission rejected: bucket=%s cost=%d max=%d retryAfter=%ds", key, cost, capacity,
                    result.retryAfterSeconds());
        }
        return result;
    }

    /**
     * Derives the bucket key: authenticated user, else client IP, else the shared anonymous bucket.
     */
    public static String bucketKey(String userId, String clientIp) {
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId.trim();
        }
        if (clientIp != null && !clientIp.isBlank()) {
            return "ip:" + clientIp.trim();
        }
        return ANONYMOUS_KEY;
    }

    private static long retryAfterSeconds(RateBucket bucket, long now) {
        return Math.max((long) Math.ceil((bucket.resetAtMillis - now) / 1000.0), 1);
    }
}
