package villagecompute.newsence.data.stores;

import java.util.UUID;

/**
 * Nearest-neighbour hit returned by {@link ItemStore#findSimilar}.
 *
 * @param id
 *            candidate item id
 * @param topicId
 *            the candidate's topic, or null if it is topicless
 * @param similarity
 *            cosine similarity to the query embedding
 */
public record SimilarItem(UUID id, UUID topicId, double similarity) {
}
