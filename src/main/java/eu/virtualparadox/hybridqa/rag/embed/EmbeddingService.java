package eu.virtualparadox.hybridqa.rag.embed;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

import java.util.List;

/**
 * Computes dense vector embeddings for passages and queries.
 * <p>
 * All vectors returned by one implementation share the same dimension.
 */
public interface EmbeddingService {

    /**
     * Embeds the given passages.
     *
     * @param passages passages to embed
     * @return one vector per passage, in input order
     */
    List<float[]> embed(List<Passage> passages);

    /**
     * Embeds a single query string.
     *
     * @param text the query string (non-null)
     * @return a dense vector representation of the query
     */
    float[] embedQuery(final String text);
}
