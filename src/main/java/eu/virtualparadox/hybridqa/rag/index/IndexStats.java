package eu.virtualparadox.hybridqa.rag.index;

/**
 * Shape of one published generation.
 *
 * @param generationId id assigned by {@link ReindexService}
 * @param passageCount passages in the sparse index
 * @param vectorCount  passages that also carry a vector
 * @param dimension    vector length, {@code 0} without an embedder
 * @param embedder     simple class name of the embedder, or {@code "none"}
 */
public record IndexStats(long generationId, int passageCount, int vectorCount, int dimension, String embedder) {

    public boolean hasVectors() {
        return vectorCount > 0;
    }
}
