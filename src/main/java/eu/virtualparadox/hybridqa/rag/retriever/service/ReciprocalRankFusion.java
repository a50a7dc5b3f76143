package eu.virtualparadox.hybridqa.rag.retriever.service;

import eu.virtualparadox.hybridqa.ingest.model.Passage;
import eu.virtualparadox.hybridqa.rag.retriever.model.FusedHit;
import eu.virtualparadox.hybridqa.rag.retriever.model.PassageKey;
import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Reciprocal Rank Fusion of a dense and a sparse ranking.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>A hit at rank {@code r} contributes {@code 1 / (k + r)} to its passage.</li>
 *   <li>Contributions for the same {@link PassageKey} are summed; a passage seen by one ranker
 *       only keeps the other ranker's score unset.</li>
 *   <li>Ordering is by fused score descending; ties prefer passages with dense evidence, then
 *       first insertion (dense list before sparse list).</li>
 *   <li>The result is cut to {@code topK} and re-ranked from 1.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 *   dense  = [P1, P2], sparse = [P2, P3], k = 60
 *   P2 = 1/62 + 1/61, P1 = 1/61, P3 = 1/62   →   [P2, P1, P3]
 * </pre>
 *
 * Fusing by rank means cosine and BM25 scores never have to be calibrated against each other.
 */
@Component
public class ReciprocalRankFusion {

    private final int rankConstant;
    private final int topK;

    public ReciprocalRankFusion(@Value("${hybridqa.rrf-k:60}") final int rankConstant,
                                @Value("${hybridqa.fused-top-k:3}") final int topK) {
        if (rankConstant <= 0) {
            throw new IllegalArgumentException("rankConstant must be positive");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        this.rankConstant = rankConstant;
        this.topK = topK;
    }

    /**
     * @param rank 1-based rank in one source list
     * @return the contribution of that position to the fused score
     */
    public double contribution(final int rank) {
        return 1.0 / (rankConstant + rank);
    }

    /**
     * Fuses two independently ranked lists.
     *
     * @param dense  dense hits, rank 1-based; may be empty
     * @param sparse sparse hits, rank 1-based; may be empty
     * @return at most {@code topK} fused hits, each passage key exactly once
     */
    public List<FusedHit> fuse(final List<ScoredHit> dense, final List<ScoredHit> sparse) {
        final Map<PassageKey, Accumulator> byKey = new LinkedHashMap<>();

        for (final ScoredHit hit : dense) {
            final Accumulator acc = byKey.computeIfAbsent(hit.key(), k -> new Accumulator(hit.passage()));
            acc.fused += contribution(hit.rank());
            acc.dense = OptionalDouble.of(hit.score());
        }
        for (final ScoredHit hit : sparse) {
            final Accumulator acc = byKey.computeIfAbsent(hit.key(), k -> new Accumulator(hit.passage()));
            acc.fused += contribution(hit.rank());
            acc.sparse = OptionalDouble.of(hit.score());
        }

        // List.sort is stable, so equal entries keep insertion order
        final List<Map.Entry<PassageKey, Accumulator>> entries = new ArrayList<>(byKey.entrySet());
        entries.sort(Comparator
                .comparingDouble((Map.Entry<PassageKey, Accumulator> e) -> e.getValue().fused).reversed()
                .thenComparing(e -> e.getValue().dense.isPresent() ? 0 : 1));

        final int limit = Math.min(topK, entries.size());
        final List<FusedHit> fused = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            final PassageKey key = entries.get(i).getKey();
            final Accumulator acc = entries.get(i).getValue();
            fused.add(new FusedHit(key, acc.passage, acc.dense, acc.sparse, acc.fused, i + 1));
        }
        return fused;
    }

    private static final class Accumulator {
        private final Passage passage;
        private OptionalDouble dense = OptionalDouble.empty();
        private OptionalDouble sparse = OptionalDouble.empty();
        private double fused;

        private Accumulator(final Passage passage) {
            this.passage = passage;
        }
    }
}
