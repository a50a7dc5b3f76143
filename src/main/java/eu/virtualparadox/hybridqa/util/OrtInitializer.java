package eu.virtualparadox.hybridqa.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Session options sized to the host: all cores but one for intra-op work,
     * a single inter-op thread.
     */
    public static OrtSession.SessionOptions initializeOrt() {
        final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();
            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);
            opts.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);

            log.info("ONNX session: intra-op threads {}, inter-op threads {}", intraThreads, 1);
            return opts;
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
