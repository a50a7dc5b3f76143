package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

import java.io.IOException;
import java.util.List;

/**
 * Nearest-neighbour lookup over stored passage vectors.
 * <p>
 * Every stored vector id resolves back to the {@link Passage} it was computed from.
 */
public interface VectorIndexService {

    /**
     * @return {@code true} when the index holds at least one vector and can be queried
     */
    boolean isReady();

    /**
     * @return dimension of the stored vectors, {@code 0} when nothing is stored
     */
    int dimension();

    /**
     * Finds the stored vectors closest to {@code vector}.
     *
     * @param vector query vector, same dimension as the index
     * @param k      maximum number of matches
     * @return matches ordered by descending cosine similarity in [-1, 1]
     * @throws IOException if the underlying index cannot be searched
     */
    List<VectorMatch> nearest(float[] vector, int k) throws IOException;

    /**
     * @param vectorId   identifier of the stored vector
     * @param passage    passage the vector was computed from
     * @param similarity cosine similarity to the query vector
     */
    record VectorMatch(String vectorId, Passage passage, float similarity) {
    }
}
