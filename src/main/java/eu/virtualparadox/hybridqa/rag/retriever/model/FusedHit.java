package eu.virtualparadox.hybridqa.rag.retriever.model;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

import java.util.OptionalDouble;

/**
 * A passage in the fused ranking.
 * <p>
 * {@code denseScore} and {@code sparseScore} are empty when the passage was not returned by
 * that ranker; they are never defaulted to zero. At least one of them is present.
 *
 * @param key         identity of the passage
 * @param passage     the passage itself
 * @param denseScore  cosine similarity reported by the dense ranker, if it returned the passage
 * @param sparseScore BM25 score reported by the sparse ranker, if it returned the passage
 * @param fusedScore  sum of the reciprocal-rank contributions
 * @param rank        1-based position in the fused ranking
 */
public record FusedHit(PassageKey key,
                       Passage passage,
                       OptionalDouble denseScore,
                       OptionalDouble sparseScore,
                       double fusedScore,
                       int rank) implements RankedPassage {

    public FusedHit {
        if (denseScore.isEmpty() && sparseScore.isEmpty()) {
            throw new IllegalArgumentException("A fused hit needs dense or sparse evidence: " + key);
        }
    }

    public boolean hasDenseScore() {
        return denseScore.isPresent();
    }
}
