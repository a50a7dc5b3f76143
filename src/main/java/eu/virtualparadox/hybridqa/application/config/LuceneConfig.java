package eu.virtualparadox.hybridqa.application.config;

import eu.virtualparadox.hybridqa.rag.index.TermAnalyzer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Lucene resources shared across index generations.
 * <p>Each generation owns its own in-memory directory and reader; only the analyzer is shared,
 * so indexing and query parsing always tokenize the same way.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private TermAnalyzer analyzer;

    /**
     * Provides the keyword analyzer used by the sparse index.
     *
     * @return {@link TermAnalyzer} instance
     */
    @Bean
    public TermAnalyzer termAnalyzer() {
        this.analyzer = new TermAnalyzer();
        return this.analyzer;
    }

    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
