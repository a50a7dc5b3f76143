package eu.virtualparadox.hybridqa.rag.retriever.service;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.rag.index.IndexGeneration;
import eu.virtualparadox.hybridqa.rag.index.IndexGenerationRegistry;
import eu.virtualparadox.hybridqa.rag.index.IndexLease;
import eu.virtualparadox.hybridqa.rag.retriever.model.FusedHit;
import eu.virtualparadox.hybridqa.rag.retriever.model.RankedPassage;
import eu.virtualparadox.hybridqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hybrid retriever: semantic search plus BM25 keyword search over the same generation,
 * fused with {@link ReciprocalRankFusion}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Lease the current {@link IndexGeneration}</li>
 *   <li>Run the dense ranker, and the sparse ranker when hybrid retrieval is on</li>
 *   <li>Fuse both rankings</li>
 *   <li>If fusion is empty, fall back to the raw dense list, then to the raw sparse list</li>
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HybridRetrieverService {

    private final IndexGenerationRegistry registry;
    private final ReciprocalRankFusion fusion;
    private final ApplicationConfig config;

    /**
     * Executes hybrid retrieval for one query.
     *
     * @param query user query string
     * @return retrieval outcome; {@link RetrievalResult#isEmpty()} when nothing matched
     */
    public RetrievalResult retrieve(final String query) {
        Objects.requireNonNull(query, "query must not be null");

        final Optional<IndexLease> maybeLease = registry.acquire();
        if (maybeLease.isEmpty()) {
            log.warn("No index generation published; nothing to retrieve");
            return RetrievalResult.empty();
        }

        try (IndexLease lease = maybeLease.get()) {
            final IndexGeneration generation = lease.generation();

            final List<ScoredHit> dense = generation.dense().search(query, config.getDenseTopK());
            final List<ScoredHit> sparse = config.isHybridEnabled()
                    ? generation.sparse().search(query, config.getSparseTopK())
                    : List.of();
            final List<FusedHit> fused = fusion.fuse(dense, sparse);

            final RetrievalResult result;
            if (!fused.isEmpty()) {
                result = new RetrievalResult(dense, sparse, fused, List.<RankedPassage>copyOf(fused), false);
            } else if (!dense.isEmpty()) {
                result = new RetrievalResult(dense, sparse, fused, List.<RankedPassage>copyOf(dense), true);
            } else {
                result = new RetrievalResult(dense, sparse, fused, List.<RankedPassage>copyOf(sparse), !sparse.isEmpty());
            }

            log.info("Retrieved generation={} dense={} sparse={} fused={} fallback={}",
                    generation.id(), dense.size(), sparse.size(), fused.size(), result.fallback());
            printDebugHits(result.hits());
            return result;
        }
    }

    private void printDebugHits(final List<RankedPassage> hits) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final RankedPassage hit : hits) {
            sb.append(" - ").append("[").append(hit.rank()).append("] ")
                    .append(hit.key().sourceId()).append(' ').append(hit.key().sectionPath())
                    .append('#').append(hit.key().chunkIndex()).append("\n");
        }
        log.debug(" !!! Ranked passages:\n{}", sb);
    }
}
