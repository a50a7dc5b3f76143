package eu.virtualparadox.hybridqa.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.ingest.model.Passage;
import eu.virtualparadox.hybridqa.util.OrtInitializer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Sentence embedding with a local ONNX encoder.
 * <p>
 * Expects {@code <models>/retriever/model.onnx} and {@code <models>/retriever/tokenizer.json}.
 * Token vectors are mean-pooled over the attention mask and L2-normalized, so cosine
 * similarity equals the dot product. Only created when {@code hybridqa.models} is set.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "hybridqa", name = "models")
public final class OnnxEmbeddingService implements EmbeddingService {

    private static final int MAX_TOKENS = 512;
    private static final int BATCH_SIZE = 16;

    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;

    public OnnxEmbeddingService(final ApplicationConfig config) {
        final Path root = config.getModels().resolve("retriever");
        this.modelPath = root.resolve("model.onnx");
        this.tokenizerPath = root.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        env = OrtEnvironment.getEnvironment();
        session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt());
        tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath, Map.of(
                "truncation", "true",
                "padding", "true",
                "maxLength", String.valueOf(MAX_TOKENS)));

        log.info("Loaded embedding model {} (inputs {})", modelPath, session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (tokenizer != null) {
            tokenizer.close();
        }
        if (session != null) {
            session.close();
        }
    }

    @Override
    public List<float[]> embed(final List<Passage> passages) {
        final List<float[]> vectors = new ArrayList<>(passages.size());
        for (int from = 0; from < passages.size(); from += BATCH_SIZE) {
            final List<String> batch = passages.subList(from, Math.min(from + BATCH_SIZE, passages.size()))
                    .stream()
                    .map(Passage::text)
                    .toList();
            vectors.addAll(encode(batch));
        }
        log.debug("Embedded {} passages in batches of {}", passages.size(), BATCH_SIZE);
        return vectors;
    }

    @Override
    public float[] embedQuery(final String text) {
        return encode(List.of(text)).get(0);
    }

    private List<float[]> encode(final List<String> texts) {
        final Encoding[] encodings = tokenizer.batchEncode(texts);
        final long[][] masks = matrix(encodings, Encoding::getAttentionMask);

        final Map<String, OnnxTensor> inputs = new LinkedHashMap<>();
        try {
            final Set<String> wanted = session.getInputNames();
            if (wanted.contains("input_ids")) {
                inputs.put("input_ids", OnnxTensor.createTensor(env, matrix(encodings, Encoding::getIds)));
            }
            if (wanted.contains("attention_mask")) {
                inputs.put("attention_mask", OnnxTensor.createTensor(env, masks));
            }
            if (wanted.contains("token_type_ids")) {
                inputs.put("token_type_ids", OnnxTensor.createTensor(env, matrix(encodings, Encoding::getTypeIds)));
            }

            try (OrtSession.Result result = session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                final List<float[]> vectors = new ArrayList<>(hidden.length);
                for (int i = 0; i < hidden.length; i++) {
                    vectors.add(normalize(meanPool(hidden[i], masks[i])));
                }
                return vectors;
            }
        } catch (final OrtException e) {
            throw new IllegalStateException("Embedding failed for a batch of " + texts.size() + " texts", e);
        } finally {
            inputs.values().forEach(OnnxTensor::close);
        }
    }

    /**
     * Stacks one per-encoding array into a rectangular matrix; the tokenizer pads every
     * encoding of a batch to the same length.
     */
    private static long[][] matrix(final Encoding[] encodings, final Function<Encoding, long[]> column) {
        final long[][] rows = new long[encodings.length][];
        for (int i = 0; i < encodings.length; i++) {
            rows[i] = column.apply(encodings[i]);
        }
        return rows;
    }

    private static float[] meanPool(final float[][] tokens, final long[] mask) {
        final float[] pooled = new float[tokens[0].length];
        int counted = 0;
        for (int t = 0; t < tokens.length && t < mask.length; t++) {
            if (mask[t] == 0) {
                continue;
            }
            for (int d = 0; d < pooled.length; d++) {
                pooled[d] += tokens[t][d];
            }
            counted++;
        }
        if (counted > 1) {
            for (int d = 0; d < pooled.length; d++) {
                pooled[d] /= counted;
            }
        }
        return pooled;
    }

    private static float[] normalize(final float[] v) {
        double sum = 0;
        for (final float x : v) {
            sum += x * x;
        }
        if (sum > 0) {
            final float inv = (float) (1.0 / Math.sqrt(sum));
            for (int i = 0; i < v.length; i++) {
                v[i] *= inv;
            }
        }
        return v;
    }
}
