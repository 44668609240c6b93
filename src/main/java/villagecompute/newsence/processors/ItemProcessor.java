package villagecompute.newsence.processors;

import villagecompute.newsence.data.models.ContentItem;
import villagecompute.newsence.data.models.SourceType;

/**
 * Platform-specific enrichment of one item.
 *
 * <p>
 * Implementations compute their result from the item's current state and never append to it, so re-running a
 * processor on the same item yields an equivalent result. Fields the item already carries are left out of the update.
 */
public interface ItemProcessor {

    SourceType sourceType();

    ProcessorResult process(ContentItem item);
}
