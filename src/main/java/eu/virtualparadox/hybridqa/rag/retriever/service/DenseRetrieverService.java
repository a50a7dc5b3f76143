package eu.virtualparadox.hybridqa.rag.retriever.service;

import eu.virtualparadox.hybridqa.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridqa.rag.index.VectorIndexService;
import eu.virtualparadox.hybridqa.rag.index.VectorIndexService.VectorMatch;
import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Semantic ranking over the vector index of one generation.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the query with {@link EmbeddingService}</li>
 *   <li>Ask the {@link VectorIndexService} for the {@code k} nearest passages</li>
 *   <li>Drop matches below the similarity floor, then assign ranks</li>
 * </ol>
 * The floor is applied before ranking so weak matches never occupy rank positions that
 * reciprocal rank fusion would reward.
 */
@Slf4j
public final class DenseRetrieverService implements RetrieverService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final float minSimilarity;

    public DenseRetrieverService(final EmbeddingService embeddingService,
                                 final VectorIndexService vectorIndexService,
                                 final float minSimilarity) {
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.minSimilarity = minSimilarity;
    }

    /**
     * Executes a semantic search against the index.
     *
     * @param query user input string
     * @param k     maximum number of results to return
     * @return ranked hits; empty when the index is not ready or the lookup fails
     */
    @Override
    public List<ScoredHit> search(final String query, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (embeddingService == null || !vectorIndexService.isReady()) {
            log.warn("Vector index not ready; dense retrieval skipped");
            return List.of();
        }

        final List<VectorMatch> matches;
        try {
            final float[] vector = embeddingService.embedQuery(query);
            matches = new ArrayList<>(vectorIndexService.nearest(vector, k));
        } catch (final Exception e) {
            log.warn("Dense retrieval failed for query: {}", query, e);
            return List.of();
        }

        matches.sort(Comparator.comparingDouble(VectorMatch::similarity).reversed());

        final List<ScoredHit> hits = new ArrayList<>(matches.size());
        for (final VectorMatch match : matches) {
            if (match.similarity() < minSimilarity) {
                continue;
            }
            hits.add(ScoredHit.of(match.passage(), match.similarity(), hits.size() + 1));
        }

        log.debug("Dense retrieval kept {} of {} matches (floor {})", hits.size(), matches.size(), minSimilarity);
        return hits;
    }
}
