package eu.virtualparadox.hybridqa.rag.index;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.ingest.model.Passage;
import eu.virtualparadox.hybridqa.rag.embed.EmbeddingProviders;
import eu.virtualparadox.hybridqa.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridqa.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.hybridqa.rag.retriever.model.PassageKey;
import eu.virtualparadox.hybridqa.rag.retriever.model.ScoredHit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Builds real in-memory Lucene generations with a deterministic embedder.
 */
class ReindexServiceTest {

    static final Passage LEAVE = Passage.of("handbook.md", 0, "parental leave lasts sixteen weeks", "Leave", "Parental");
    static final Passage EXPENSE = Passage.of("handbook.md", 1, "expense reports are due monthly", "Finance");
    static final Passage OFFICE = Passage.of("faq.txt", 0, "the office opens at nine");

    private final TermAnalyzer analyzer = new TermAnalyzer();
    private final IndexGenerationRegistry registry = new IndexGenerationRegistry();
    private ApplicationConfig config;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
    }

    @AfterEach
    void tearDown() {
        registry.close();
        analyzer.close();
    }

    private ReindexService reindexService(final EmbeddingService embeddingService) {
        return new ReindexService(EmbeddingProviders.of(embeddingService), analyzer, registry, config);
    }

    @Test
    @DisplayName("Rebuild publishes a generation searchable by both rankers")
    void testRebuildPublishes() {
        final long id = reindexService(new HashingEmbeddingService()).rebuild(List.of(LEAVE, EXPENSE, OFFICE));

        assertEquals(id, registry.currentGenerationId().orElseThrow());
        try (IndexLease lease = registry.acquire().orElseThrow()) {
            final IndexGeneration generation = lease.generation();
            assertEquals(3, generation.passageCount());

            final List<ScoredHit> dense = generation.dense().search("parental leave", 3);
            final List<ScoredHit> sparse = generation.sparse().search("parental leave", 3);

            assertEquals(LEAVE, dense.get(0).passage());
            assertEquals(1, sparse.size());
            assertEquals(LEAVE, sparse.get(0).passage());
        }
    }

    @Test
    @DisplayName("Same stored passage yields equal keys from the dense and the sparse ranker")
    void testPassageKeyIdentity() {
        reindexService(new HashingEmbeddingService()).rebuild(List.of(LEAVE, EXPENSE, OFFICE));

        try (IndexLease lease = registry.acquire().orElseThrow()) {
            final ScoredHit dense = lease.generation().dense().search("expense reports", 3).get(0);
            final ScoredHit sparse = lease.generation().sparse().search("expense reports", 3).get(0);

            assertEquals(dense.key(), sparse.key());
            assertEquals(PassageKey.of(EXPENSE), dense.key());
            assertEquals(List.of("Finance"), dense.passage().sectionPath());
            assertEquals(1, dense.passage().chunkIndex());
        }
    }

    @Test
    @DisplayName("Dense similarity is reported as cosine, not as Lucene's shifted score")
    void testCosineScale() {
        reindexService(new HashingEmbeddingService()).rebuild(List.of(LEAVE));

        try (IndexLease lease = registry.acquire().orElseThrow()) {
            final ScoredHit hit = lease.generation().dense().search(LEAVE.text(), 1).get(0);
            assertEquals(1.0f, hit.score(), 1e-3f);
        }
    }

    @Test
    @DisplayName("Empty corpus publishes a generation that finds nothing")
    void testEmptyCorpus() {
        final HashingEmbeddingService embedder = new HashingEmbeddingService();
        reindexService(embedder).rebuild(List.of());

        try (IndexLease lease = registry.acquire().orElseThrow()) {
            assertEquals(0, lease.generation().passageCount());
            assertTrue(lease.generation().dense().search("parental leave", 3).isEmpty());
            assertTrue(lease.generation().sparse().search("parental leave", 3).isEmpty());
        }
        assertEquals(0, embedder.passageCalls());
    }

    @Test
    @DisplayName("Without an embedder only keyword search answers")
    void testNoEmbedder() {
        reindexService(null).rebuild(List.of(LEAVE, EXPENSE));

        try (IndexLease lease = registry.acquire().orElseThrow()) {
            assertTrue(lease.generation().dense().search("parental leave", 3).isEmpty());
            assertEquals(LEAVE, lease.generation().sparse().search("parental leave", 3).get(0).passage());
        }
        final IndexStats stats = registry.stats().orElseThrow();
        assertEquals(2, stats.passageCount());
        assertFalse(stats.hasVectors());
        assertEquals(0, stats.dimension());
        assertEquals("none", stats.embedder());
    }

    @Test
    @DisplayName("Stats report vector count, dimension and embedder of the current generation")
    void testStats() {
        final long id = reindexService(new HashingEmbeddingService()).rebuild(List.of(LEAVE, EXPENSE, OFFICE));

        assertTrue(registry.isReady());
        final IndexStats stats = registry.stats().orElseThrow();
        assertEquals(id, stats.generationId());
        assertEquals(3, stats.passageCount());
        assertEquals(3, stats.vectorCount());
        assertEquals(HashingEmbeddingService.DIMENSION, stats.dimension());
        assertEquals("HashingEmbeddingService", stats.embedder());
        assertTrue(stats.hasVectors());
    }

    @Test
    @DisplayName("In-flight lease keeps the replaced generation readable until closed")
    void testSwapWithInFlightLease() throws Exception {
        final ReindexService service = reindexService(new HashingEmbeddingService());
        final long first = service.rebuild(List.of(LEAVE));
        final IndexLease inFlight = registry.acquire().orElseThrow();

        final long second = service.rebuild(List.of(EXPENSE, OFFICE));

        assertTrue(second > first);
        assertEquals(second, registry.currentGenerationId().orElseThrow());

        // the old snapshot still answers from its own passages
        final IndexGeneration old = inFlight.generation();
        assertEquals(first, old.id());
        assertEquals(LEAVE, old.sparse().search("parental", 3).get(0).passage());
        assertTrue(old.sparse().search("expense", 3).isEmpty());
        assertEquals(1, old.refCount());

        // new queries see only the new snapshot
        try (IndexLease current = registry.acquire().orElseThrow()) {
            assertEquals(second, current.generation().id());
            assertTrue(current.generation().sparse().search("parental", 3).isEmpty());
        }

        inFlight.close();
        assertEquals(0, old.refCount());
        assertThrows(IllegalStateException.class, inFlight::generation);
    }

    @Test
    @DisplayName("Concurrent rebuild fails fast while another is running")
    void testConcurrentRebuildRejected() throws Exception {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final HashingEmbeddingService blocking = new HashingEmbeddingService() {
            @Override
            public List<float[]> embed(final List<Passage> passages) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return super.embed(passages);
            }
        };
        final ReindexService service = reindexService(blocking);

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<Long> running = executor.submit(() -> service.rebuild(List.of(LEAVE)));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            final IllegalStateException rejected = assertThrows(IllegalStateException.class,
                    () -> service.rebuild(List.of(EXPENSE)));
            assertEquals("rebuild already in progress", rejected.getMessage());

            release.countDown();
            assertEquals(running.get(10, TimeUnit.SECONDS), registry.currentGenerationId().orElseThrow());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        // lock is released afterwards
        assertDoesNotThrow(() -> service.rebuild(List.of(EXPENSE)));
    }

    @Test
    @DisplayName("Inconsistent embedder output fails and keeps the current generation")
    void testInconsistentVectors() {
        final ReindexService good = reindexService(new HashingEmbeddingService());
        final long published = good.rebuild(List.of(LEAVE));

        final EmbeddingService broken = mock(EmbeddingService.class);
        when(broken.embed(List.of(LEAVE, EXPENSE))).thenReturn(List.of(new float[]{1f, 0f}));

        assertThrows(IllegalArgumentException.class,
                () -> reindexService(broken).rebuild(List.of(LEAVE, EXPENSE)));
        assertEquals(published, registry.currentGenerationId().orElseThrow());
    }

    @Test
    @DisplayName("Null corpus is rejected")
    void testNullCorpus() {
        assertThrows(NullPointerException.class, () -> reindexService(null).rebuild(null));
    }
}
