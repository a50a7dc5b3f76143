package eu.virtualparadox.hybridqa.rag.answer;

/**
 * Terminal state a query ended in.
 */
public enum AnswerOutcome {
    /** Model answer carried at least one citation. */
    ANSWERED,
    /** Model answer had no citation; the refusal text was appended as a caveat. */
    NUDGED,
    /** Retrieval found nothing; the model was not called. */
    REFUSED,
    /** The model call failed; a generic apology was returned. */
    DEGRADED
}
