package eu.virtualparadox.hybridqa.rag.answer;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.query.citation.CitationGuard;
import eu.virtualparadox.hybridqa.rag.context.ContextBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Stream;

/**
 * Generates an answer from an assembled context and applies the citation guardrails.
 * <ul>
 *   <li>No citation in the model output: the refusal text is appended as a caveat, the answer is kept.</li>
 *   <li>Too many citations: only the first distinct ones survive, see {@link CitationGuard}.</li>
 *   <li>Model failure: a generic apology, never the raw error. No retry here.</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerService {

    static final String SYSTEM_INSTRUCTIONS = String.join("\n",
            "You are a document question answering assistant.",
            "Follow these rules strictly:",
            "1) Use ONLY the provided CONTEXT. Do not use outside knowledge.",
            "2) Include 1-3 citations in the exact form: [source: filename §Section].",
            "3) If the answer is not clearly supported, say you don't know and suggest contacting the document owner.",
            "4) Do not provide legal or medical advice."
    );

    private final GenerationService generationService;
    private final CitationGuard citationGuard;
    private final ApplicationConfig config;

    /**
     * Calls the model once and guards its output.
     *
     * @param question      the user question
     * @param context       non-empty assembled context
     * @param refusal       text appended when the answer carries no citation
     * @param showCitations when false every marker is stripped and no caveat is appended
     * @return the guarded answer, or a degraded answer if the model call failed
     */
    public GeneratedAnswer answer(final String question,
                                  final ContextBlock context,
                                  final String refusal,
                                  final boolean showCitations) {
        final String prompt = buildPrompt(question, context);
        log.debug(" !!! Prompt: \nSystem: {}\nUser: {}", SYSTEM_INSTRUCTIONS, prompt);

        final String generated;
        try {
            generated = generationService.complete(SYSTEM_INSTRUCTIONS, prompt);
        } catch (final RuntimeException e) {
            log.error("Generation failed for question: {}", question, e);
            return GeneratedAnswer.degraded(config.getDegradedMessage());
        }

        return showCitations ? guard(generated, refusal) : hideCitations(generated, refusal);
    }

    /**
     * Opens the model stream for the given context. Fragments are not guarded.
     */
    public Stream<String> streamAnswer(final String question, final ContextBlock context) {
        final String prompt = buildPrompt(question, context);
        log.debug(" !!! Streaming prompt: \nSystem: {}\nUser: {}", SYSTEM_INSTRUCTIONS, prompt);
        return generationService.completeStream(SYSTEM_INSTRUCTIONS, prompt);
    }

    GeneratedAnswer guard(final String generated, final String refusal) {
        final String raw = generated == null ? "" : generated;
        String text = raw.trim();
        AnswerOutcome outcome = AnswerOutcome.ANSWERED;

        if (!citationGuard.hasCitation(text)) {
            log.info("Answer carries no citation; appending caveat");
            text = text.isEmpty() ? refusal : text + "\n\n" + refusal;
            outcome = AnswerOutcome.NUDGED;
        }

        final String limited = citationGuard.limitCitations(text).trim();
        return new GeneratedAnswer(raw, limited, outcome, citationGuard.citations(limited));
    }

    GeneratedAnswer hideCitations(final String generated, final String refusal) {
        final String raw = generated == null ? "" : generated;
        final String stripped = citationGuard.stripCitations(raw);
        if (stripped.isEmpty()) {
            return new GeneratedAnswer(raw, refusal, AnswerOutcome.NUDGED, List.of());
        }
        return new GeneratedAnswer(raw, stripped, AnswerOutcome.ANSWERED, List.of());
    }

    static String buildPrompt(final String question, final ContextBlock context) {
        return String.join("\n",
                "USER QUESTION:",
                question,
                "",
                "CONTEXT (from the documents):",
                context.text(),
                "",
                "INSTRUCTIONS:",
                "- Answer ONLY based on the context above.",
                "- If not supported, say you don't know and suggest contacting the document owner.",
                "- Always add 1-3 citations like [source: filename §Section].");
    }
}
