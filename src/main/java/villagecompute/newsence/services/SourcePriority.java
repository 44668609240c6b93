package villagecompute.newsence.services;

import java.util.Map;

/**
 * Static rank of source labels used when a producer rediscovers an item that is already stored.
 *
 * <p>
 * Social and unattributed sources rank lowest, curated relays next, and every other label (feed names, site names of
 * manual submissions) ranks highest.
 */
public final class SourcePriority {

    public static final int DEFAULT_RANK = 10;

    private static final Map<String, Integer> RANKS = Map.of("Twitter", 0, "Unknown", 0, "Telegram", 1);

    private SourcePriority() {
        // Utility class, no instantiation
    }

    /**
     * Labels absent from the table, a missing label included, rank {@link #DEFAULT_RANK}.
     */
    public static int rankOf(String source) {
        if (source == null) {
            return DEFAULT_RANK;
        }
        return RANKS.getOrDefault(source, DEFAULT_RANK);
    }

    /**
     * Whether {@code incoming} should replace {@code existing} as an item's source. Only a strictly higher rank wins, so
     * a repeat of the same upgrade is a no-op.
     */
    public static boolean shouldUpgrade(String incoming, String existing) {
        return rankOf(incoming) > rankOf(existing);
    }
}
