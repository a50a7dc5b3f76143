package eu.virtualparadox.hybridqa.rag.answer;

import eu.virtualparadox.hybridqa.query.citation.Citation;

import java.util.List;

/**
 * Result of one query. Never persisted.
 *
 * @param rawText   model output before guarding; empty when the model was not called or failed
 * @param finalText text to show the user
 * @param outcome   terminal state that produced {@code finalText}
 * @param citations distinct citations left in {@code finalText}, in order of appearance
 */
public record GeneratedAnswer(String rawText, String finalText, AnswerOutcome outcome, List<Citation> citations) {

    public GeneratedAnswer {
        rawText = rawText == null ? "" : rawText;
        citations = List.copyOf(citations);
    }

    public static GeneratedAnswer refused(final String refusal) {
        return new GeneratedAnswer("", refusal, AnswerOutcome.REFUSED, List.of());
    }

    public static GeneratedAnswer degraded(final String message) {
        return new GeneratedAnswer("", message, AnswerOutcome.DEGRADED, List.of());
    }
}
