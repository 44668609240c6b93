package villagecompute.newsence.services;

import java.util.Set;

/**
 * When a topic's headline is (re)synthesized: as soon as a new topic has a second member, then each time the member
 * count reaches 2, 3, 5 or 10. Topics past ten members keep their last headline.
 */
public final class SynthesisPolicy {

    static final Set<Integer> THRESHOLDS = Set.of(2, 3, 5, 10);

    private SynthesisPolicy() {
        // Utility class, no instantiation
    }

    public static boolean needsSynthesis(int memberCount, boolean newTopic) {
        if (newTopic && memberCount >= 2) {
            return true;
        }
        return THRESHOLDS.contains(memberCount);
    }
}
