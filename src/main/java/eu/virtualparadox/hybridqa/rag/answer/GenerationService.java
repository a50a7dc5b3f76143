package eu.virtualparadox.hybridqa.rag.answer;

import java.util.stream.Stream;

/**
 * Text generation by a language model.
 * <p>
 * Failures (timeouts, transport or provider errors) surface as unchecked exceptions; any retry
 * policy lives in the implementation.
 */
public interface GenerationService {

    /**
     * @param systemInstruction fixed instruction for the model
     * @param prompt            question and context
     * @return generated text, possibly empty
     */
    String complete(String systemInstruction, String prompt);

    /**
     * Streams generated text as it is produced.
     * <p>
     * The returned stream is lazy, finite and single-use. Closing it, or simply no longer pulling
     * from it, stops the underlying generation.
     *
     * @param systemInstruction fixed instruction for the model
     * @param prompt            question and context
     * @return text fragments in generation order
     */
    Stream<String> completeStream(String systemInstruction, String prompt);
}
