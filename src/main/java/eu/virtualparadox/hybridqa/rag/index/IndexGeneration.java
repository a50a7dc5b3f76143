package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.rag.retriever.service.RetrieverService;
import org.apache.lucene.index.DirectoryReader;

import java.io.IOException;

/**
 * One immutable corpus snapshot: the dense and the sparse ranker built over the same passages,
 * sharing one Lucene reader.
 * <p>
 * Lifetime follows the reader's reference count. The registry holds one reference while the
 * generation is current; every {@link IndexLease} holds another. The reader (and with it the
 * in-memory directory) closes when the last reference is released.
 */
public final class IndexGeneration {

    private final IndexStats stats;
    private final DirectoryReader reader;
    private final RetrieverService dense;
    private final RetrieverService sparse;

    IndexGeneration(final IndexStats stats,
                    final DirectoryReader reader,
                    final RetrieverService dense,
                    final RetrieverService sparse) {
        this.stats = stats;
        this.reader = reader;
        this.dense = dense;
        this.sparse = sparse;
    }

    public long id() {
        return stats.generationId();
    }

    public int passageCount() {
        return stats.passageCount();
    }

    public IndexStats stats() {
        return stats;
    }

    public RetrieverService dense() {
        return dense;
    }

    public RetrieverService sparse() {
        return sparse;
    }

    boolean tryIncRef() {
        return reader.tryIncRef();
    }

    void decRef() throws IOException {
        reader.decRef();
    }

    int refCount() {
        return reader.getRefCount();
    }
}
