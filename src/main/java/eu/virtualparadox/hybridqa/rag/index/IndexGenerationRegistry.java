package eu.virtualparadox.hybridqa.rag.index;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link IndexGeneration} and hands out leases on it.
 * <p>
 * Publishing swaps the reference in one step, so a query either sees the previous pair of
 * indexes or the new pair, never a mix. A generation replaced while queries still hold it
 * stays open until the last of those leases is closed.
 */
@Service
@Slf4j
public class IndexGenerationRegistry {

    private final AtomicReference<IndexGeneration> current = new AtomicReference<>();

    /**
     * Leases the current generation.
     *
     * @return a lease, or empty when no generation was published yet
     */
    public Optional<IndexLease> acquire() {
        while (true) {
            final IndexGeneration generation = current.get();
            if (generation == null) {
                return Optional.empty();
            }
            if (generation.tryIncRef()) {
                return Optional.of(new IndexLease(generation));
            }
            // retired between get() and tryIncRef(); the replacement is already visible
        }
    }

    /**
     * @return id of the current generation, if any
     */
    public Optional<Long> currentGenerationId() {
        return Optional.ofNullable(current.get()).map(IndexGeneration::id);
    }

    /**
     * @return true once a generation has been published
     */
    public boolean isReady() {
        return current.get() != null;
    }

    /**
     * @return counts, vector dimension and embedder of the current generation, if any
     */
    public Optional<IndexStats> stats() {
        return Optional.ofNullable(current.get()).map(IndexGeneration::stats);
    }

    /**
     * Makes {@code next} current and releases the registry's hold on the previous generation.
     */
    void publish(final IndexGeneration next) throws IOException {
        final IndexGeneration previous = current.getAndSet(next);
        final IndexStats stats = next.stats();
        log.info("Published index generation {} with {} passages ({} vectors, dim {}, embedder {})",
                stats.generationId(), stats.passageCount(), stats.vectorCount(), stats.dimension(), stats.embedder());
        if (previous != null) {
            previous.decRef();
            log.debug("Retired index generation {} (remaining refs: {})", previous.id(), previous.refCount());
        }
    }

    @PreDestroy
    public void close() {
        final IndexGeneration last = current.getAndSet(null);
        if (last == null) {
            return;
        }
        try {
            last.decRef();
        } catch (final IOException e) {
            log.error("Unable to close index generation {}", last.id(), e);
        }
    }
}
