package eu.virtualparadox.hybridqa.rag.retriever.service;

import eu.virtualparadox.hybridqa.rag.index.KeywordIndexService;
import eu.virtualparadox.hybridqa.rag.index.KeywordIndexService.KeywordMatch;
import eu.virtualparadox.hybridqa.rag.index.TermAnalyzer;
import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical BM25 ranking over the keyword index of one generation.
 * <p>
 * The query goes through the same {@link TermAnalyzer} as the indexed text. Hits under the
 * minimum score are dropped before ranks are assigned.
 */
@Slf4j
public final class SparseRetrieverService implements RetrieverService {

    private final KeywordIndexService keywordIndexService;
    private final TermAnalyzer analyzer;
    private final float minScore;

    public SparseRetrieverService(final KeywordIndexService keywordIndexService,
                                  final TermAnalyzer analyzer,
                                  final float minScore) {
        this.keywordIndexService = keywordIndexService;
        this.analyzer = analyzer;
        this.minScore = minScore;
    }

    @Override
    public List<ScoredHit> search(final String query, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }

        final List<String> terms = analyzer.tokenize(query);
        if (terms.isEmpty()) {
            return List.of();
        }

        final List<KeywordMatch> matches;
        try {
            matches = keywordIndexService.search(terms, k);
        } catch (final Exception e) {
            log.warn("Keyword retrieval failed for query: {}", query, e);
            return List.of();
        }

        final List<ScoredHit> hits = new ArrayList<>(matches.size());
        for (final KeywordMatch match : matches) {
            if (match.score() < minScore) {
                continue;
            }
            hits.add(ScoredHit.of(match.passage(), match.score(), hits.size() + 1));
        }

        log.debug("Keyword retrieval kept {} of {} matches for terms {}", hits.size(), matches.size(), terms);
        return hits;
    }
}
