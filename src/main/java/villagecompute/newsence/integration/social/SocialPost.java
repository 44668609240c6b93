package villagecompute.newsence.integration.social;

import java.time.Instant;
import java.util.List;

/**
 * A post from a monitored social list.
 *
 * @param id
 *            platform post id
 * @param url
 *            permalink
 * @param text
 *            full post text
 * @param authorHandle
 *            author username without the leading {@code @}
 * @param authorName
 *            author display name
 * @param viewCount
 *            impressions at fetch time
 * @param likeCount
 *            likes at fetch time
 * @param repostCount
 *            reposts at fetch time
 * @param hashtags
 *            hashtags without {@code #}
 * @param mediaUrls
 *            attached media, first one is used as preview image
 * @param createdAt
 *            post time
 */
public record SocialPost(String id, String url, String text, String authorHandle, String authorName, long viewCount,
        long likeCount, long repostCount, List<String> hashtags, List<String> mediaUrls, Instant createdAt) {
}
