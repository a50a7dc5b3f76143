package eu.virtualparadox.hybridqa.rag.index;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Pins one {@link IndexGeneration} for the duration of a query. Close exactly once.
 */
public final class IndexLease implements Closeable {

    private final IndexGeneration generation;
    private boolean closed;

    IndexLease(final IndexGeneration generation) {
        this.generation = generation;
    }

    public IndexGeneration generation() {
        if (closed) {
            throw new IllegalStateException("Lease on generation " + generation.id() + " already released");
        }
        return generation;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            generation.decRef();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to release generation " + generation.id(), e);
        }
    }
}
