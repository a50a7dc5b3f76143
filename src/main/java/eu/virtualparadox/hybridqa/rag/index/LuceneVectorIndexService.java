package eu.virtualparadox.hybridqa.rag.index;

import org.apache.lucene.document.Document;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.hybridqa.util.LuceneConstants.FIELD_VECTOR;
import static eu.virtualparadox.hybridqa.util.LuceneConstants.FIELD_VECTOR_ID;

/**
 * {@link VectorIndexService} over the HNSW graph of one index generation.
 * <p>
 * Lucene reports cosine matches as {@code (1 + cos) / 2}; scores are mapped back to the
 * cosine range before they leave this class.
 */
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexSearcher searcher;
    private final int dimension;

    public LuceneVectorIndexService(final IndexSearcher searcher, final int dimension) {
        if (dimension < 0) {
            throw new IllegalArgumentException("dimension must be >= 0");
        }
        this.searcher = searcher;
        this.dimension = dimension;
    }

    @Override
    public boolean isReady() {
        return dimension > 0 && searcher.getIndexReader().numDocs() > 0;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<VectorMatch> nearest(final float[] vector, final int k) throws IOException {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                    "Query vector dimension " + vector.length + " does not match index dimension " + dimension);
        }

        final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, vector, k), k);

        final List<VectorMatch> matches = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc sd : topDocs.scoreDocs) {
            final Document doc = searcher.storedFields().document(sd.doc);
            matches.add(new VectorMatch(
                    doc.get(FIELD_VECTOR_ID),
                    PassageDocuments.toPassage(doc),
                    2f * sd.score - 1f));
        }
        return matches;
    }
}
