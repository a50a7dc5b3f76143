package eu.virtualparadox.hybridqa.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Retrieval and answering knobs, bound from {@code hybridqa.*}.
 * <p>
 * Fusion, context and citation limits are injected directly into their components
 * with {@code @Value}; this class carries the settings shared by the orchestration layer.
 */
@Configuration
@ConfigurationProperties(prefix = "hybridqa")
@Getter @Setter
public class ApplicationConfig {

    /** Root holding {@code retriever/model.onnx} and {@code retriever/tokenizer.json}. */
    private Path models;

    private int denseTopK = 6;
    private float denseMinSimilarity = 0.15f;

    private int sparseTopK = 20;
    private float sparseMinScore = 0.1f;

    /** When false only the dense ranker runs. */
    private boolean hybridEnabled = true;

    /** Model calls per request, the first one included; 1 disables retrying. */
    private int llmMaxRetries = 2;

    /** Pause before each retry of a transient model failure. */
    private Duration llmBackoff = Duration.ofSeconds(1);

    /** Fragments buffered between flushes when citations are hidden while streaming. */
    private int streamFlushFragments = 5;

    private String refusalMessage =
            "I couldn't find relevant information in the documents. Please check with the document owner.";

    private String degradedMessage =
            "The answer engine had a temporary issue processing your request. "
                    + "Please try again, or ask a slightly shorter question.";

    @PostConstruct
    public void validate() {
        requirePositive(denseTopK, "hybridqa.dense-top-k");
        requirePositive(sparseTopK, "hybridqa.sparse-top-k");
        requirePositive(streamFlushFragments, "hybridqa.stream-flush-fragments");
        requirePositive(llmMaxRetries, "hybridqa.llm-max-retries");
        if (llmBackoff == null || llmBackoff.isNegative()) {
            throw new IllegalArgumentException("hybridqa.llm-backoff must not be negative");
        }
        if (refusalMessage == null || refusalMessage.isBlank()) {
            throw new IllegalArgumentException("hybridqa.refusal-message must not be blank");
        }
        if (degradedMessage == null || degradedMessage.isBlank()) {
            throw new IllegalArgumentException("hybridqa.degraded-message must not be blank");
        }
    }

    private static void requirePositive(final int value, final String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }
}
