package eu.virtualparadox.hybridqa.rag.retriever.model;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

/**
 * @param key     identity of the passage
 * @param passage the passage itself
 * @param score   raw score of the producing ranker (cosine for dense, BM25 for sparse)
 * @param rank    1-based position after sorting by descending score
 */
public record ScoredHit(PassageKey key, Passage passage, float score, int rank) implements RankedPassage {

    public ScoredHit {
        if (rank < 1) {
            throw new IllegalArgumentException("rank is 1-based, was " + rank);
        }
    }

    public static ScoredHit of(final Passage passage, final float score, final int rank) {
        return new ScoredHit(PassageKey.of(passage), passage, score, rank);
    }
}
