package eu.virtualparadox.hybridqa.rag.retriever.service;

import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;

import java.util.List;

/**
 * One ranking method over one corpus snapshot.
 * <p>
 * Implementations return an empty list instead of failing when they have nothing to offer;
 * only a non-positive {@code k} is rejected.
 */
public interface RetrieverService {

    /**
     * @param query user query string
     * @param k     maximum number of hits, must be positive
     * @return hits ordered by descending score with 1-based contiguous ranks
     */
    List<ScoredHit> search(final String query, final int k);

}
