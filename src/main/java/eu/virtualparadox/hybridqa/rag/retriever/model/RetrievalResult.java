package eu.virtualparadox.hybridqa.rag.retriever.model;

import java.util.List;

/**
 * Everything one retrieval produced.
 *
 * @param dense    raw dense ranking
 * @param sparse   raw sparse ranking (empty when hybrid retrieval is off)
 * @param fused    fused ranking
 * @param hits     what the context is built from: {@code fused}, or a raw fallback list
 * @param fallback true when {@code hits} is a raw list because fusion came back empty
 */
public record RetrievalResult(List<ScoredHit> dense,
                              List<ScoredHit> sparse,
                              List<FusedHit> fused,
                              List<RankedPassage> hits,
                              boolean fallback) {

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of(), List.of(), List.of(), false);
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
