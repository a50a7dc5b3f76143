package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.ingest.model.Passage;

import java.io.IOException;
import java.util.List;

/**
 * BM25 lookup over the analyzed passage text of one corpus snapshot.
 */
public interface KeywordIndexService {

    /**
     * Scores every passage containing at least one of the given terms.
     *
     * @param terms analyzed query terms; repeated terms weigh once per occurrence
     * @param k     maximum number of matches
     * @return matches ordered by descending BM25 score; empty for no terms or an empty corpus
     * @throws IOException if the underlying index cannot be searched
     */
    List<KeywordMatch> search(List<String> terms, int k) throws IOException;

    record KeywordMatch(Passage passage, float score) {
    }
}
