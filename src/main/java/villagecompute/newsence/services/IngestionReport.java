package villagecompute.newsence.services;

import java.util.List;
import java.util.UUID;

/**
 * Outcome counts of one ingestion run.
 *
 * @param inserted
 *            new rows written and queued
 * @param duplicates
 *            entries already stored (or repeated within the batch) and left untouched
 * @param upgraded
 *            already stored entries re-attributed to a higher-priority source
 * @param failed
 *            entries skipped because of an error
 * @param insertedIds
 *            ids of the inserted rows, in batch order
 */
public record IngestionReport(int inserted, int duplicates, int upgraded, int failed, List<UUID> insertedIds) {

    public int total() {
        return inserted + duplicates + upgraded + failed;
    }
}
