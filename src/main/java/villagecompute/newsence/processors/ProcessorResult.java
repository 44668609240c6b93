package villagecompute.newsence.processors;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import villagecompute.newsence.data.stores.ItemUpdate;

/**
 * Output of an {@link ItemProcessor}: fields to merge into the item and entries for the platform metadata enrichment
 * bag. Checkpointed as JSON between workflow steps.
 */
public record ProcessorResult(ItemUpdate update, Map<String, Object> enrichments) {

    public ProcessorResult {
        update = update == null ? ItemUpdate.empty() : update;
        enrichments = enrichments == null ? Map.of() : Map.copyOf(enrichments);
    }

    public static ProcessorResult of(ItemUpdate update) {
        return new ProcessorResult(update, Map.of());
    }

    @JsonIgnore
    public boolean hasEnrichments() {
        return !enrichments.isEmpty();
    }
}
