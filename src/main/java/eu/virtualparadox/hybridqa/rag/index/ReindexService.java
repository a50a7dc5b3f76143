package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.ingest.model.Passage;
import eu.virtualparadox.hybridqa.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridqa.rag.retriever.service.DenseRetrieverService;
import eu.virtualparadox.hybridqa.rag.retriever.service.SparseRetrieverService;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Builds a complete {@link IndexGeneration} from a corpus snapshot and publishes it:
 * <ol>
 *     <li>Embed all passages (skipped when no {@link EmbeddingService} is configured)</li>
 *     <li>Write passages, analyzed text and vectors into a fresh in-memory Lucene index</li>
 *     <li>Open one reader and bind the dense and sparse rankers to it</li>
 *     <li>Swap the new generation in through {@link IndexGenerationRegistry}</li>
 * </ol>
 * Only one rebuild runs at a time; a concurrent call fails fast instead of queueing.
 */
@Service
@Slf4j
public class ReindexService {

    private final ObjectProvider<EmbeddingService> embeddingServiceProvider;
    private final TermAnalyzer analyzer;
    private final IndexGenerationRegistry registry;
    private final ApplicationConfig config;

    private final ReentrantLock rebuildLock = new ReentrantLock();
    private final AtomicLong generationIds = new AtomicLong();

    public ReindexService(final ObjectProvider<EmbeddingService> embeddingServiceProvider,
                          final TermAnalyzer analyzer,
                          final IndexGenerationRegistry registry,
                          final ApplicationConfig config) {
        this.embeddingServiceProvider = embeddingServiceProvider;
        this.analyzer = analyzer;
        this.registry = registry;
        this.config = config;
    }

    /**
     * Rebuilds both indexes from {@code passages} and publishes them as one generation.
     *
     * @param passages full corpus snapshot; may be empty
     * @return id of the published generation
     * @throws IllegalStateException    if another rebuild is running or Lucene fails
     * @throws IllegalArgumentException if the embedder returns inconsistent vectors
     */
    public long rebuild(final List<Passage> passages) {
        Objects.requireNonNull(passages, "passages must not be null");
        if (!rebuildLock.tryLock()) {
            throw new IllegalStateException("rebuild already in progress");
        }
        try {
            final EmbeddingService embeddingService = embeddingServiceProvider.getIfAvailable();
            final List<float[]> vectors = embeddingService == null || passages.isEmpty()
                    ? null
                    : embeddingService.embed(passages);
            final int dimension = validateVectors(passages, vectors);

            final Directory directory = new ByteBuffersDirectory();
            writeAll(directory, passages, vectors);

            final DirectoryReader reader = DirectoryReader.open(directory);
            reader.getReaderCacheHelper().addClosedListener(key -> directory.close());
            final IndexSearcher searcher = new IndexSearcher(reader);

            final IndexStats stats = new IndexStats(
                    generationIds.incrementAndGet(),
                    passages.size(),
                    vectors == null ? 0 : vectors.size(),
                    dimension,
                    embeddingService == null ? "none" : embeddingService.getClass().getSimpleName());
            final IndexGeneration generation = new IndexGeneration(
                    stats,
                    reader,
                    new DenseRetrieverService(
                            embeddingService,
                            new LuceneVectorIndexService(searcher, dimension),
                            config.getDenseMinSimilarity()),
                    new SparseRetrieverService(
                            new LuceneKeywordIndexService(searcher),
                            analyzer,
                            config.getSparseMinScore()));

            registry.publish(generation);
            if (dimension == 0) {
                log.warn("Generation {} has no vectors; dense retrieval is unavailable", generation.id());
            }
            return generation.id();
        } catch (final IOException e) {
            throw new IllegalStateException("Rebuild failed for " + passages.size() + " passages", e);
        } finally {
            rebuildLock.unlock();
        }
    }

    private void writeAll(final Directory directory,
                          final List<Passage> passages,
                          final List<float[]> vectors) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE);
        try (IndexWriter writer = new IndexWriter(directory, cfg)) {
            for (int i = 0; i < passages.size(); i++) {
                final float[] vector = vectors == null ? null : vectors.get(i);
                writer.addDocument(PassageDocuments.toDocument(String.valueOf(i), passages.get(i), vector));
            }
            writer.commit();
        }
    }

    /**
     * @return the common vector dimension, or {@code 0} when there are no vectors
     */
    private int validateVectors(final List<Passage> passages, final List<float[]> vectors) {
        for (final Passage p : passages) {
            Objects.requireNonNull(p, "passages must not contain null elements");
        }
        if (vectors == null) {
            return 0;
        }
        if (vectors.size() != passages.size()) {
            throw new IllegalArgumentException(
                    "Embedder returned " + vectors.size() + " vectors for " + passages.size() + " passages");
        }
        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }
        return dim;
    }
}
