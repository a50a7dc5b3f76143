package eu.virtualparadox.hybridqa.rag.index;

import org.apache.lucene.document.Document;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.hybridqa.util.LuceneConstants.FIELD_TEXT;

/**
 * {@link KeywordIndexService} backed by Lucene's default {@code BM25Similarity} (k1 = 1.2, b = 0.75).
 * <p>
 * The query is a disjunction of one term query per distinct term, boosted by the number of
 * times the term occurs in the query.
 */
public final class LuceneKeywordIndexService implements KeywordIndexService {

    private final IndexSearcher searcher;

    public LuceneKeywordIndexService(final IndexSearcher searcher) {
        this.searcher = searcher;
    }

    @Override
    public List<KeywordMatch> search(final List<String> terms, final int k) throws IOException {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (terms.isEmpty() || searcher.getIndexReader().numDocs() == 0) {
            return List.of();
        }

        final TopDocs topDocs = searcher.search(toQuery(terms), k);

        final List<KeywordMatch> matches = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc sd : topDocs.scoreDocs) {
            final Document doc = searcher.storedFields().document(sd.doc);
            matches.add(new KeywordMatch(PassageDocuments.toPassage(doc), sd.score));
        }
        return matches;
    }

    private Query toQuery(final List<String> terms) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String term : terms) {
            counts.merge(term, 1, Integer::sum);
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            final Query termQuery = new TermQuery(new Term(FIELD_TEXT, entry.getKey()));
            final Query clause = entry.getValue() == 1 ? termQuery : new BoostQuery(termQuery, entry.getValue());
            builder.add(clause, BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }
}
