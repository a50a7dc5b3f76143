package eu.virtualparadox.hybridqa.query;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import eu.virtualparadox.hybridqa.query.citation.CitationSuppressingIterator;
import eu.virtualparadox.hybridqa.rag.answer.AnswerService;
import eu.virtualparadox.hybridqa.rag.answer.GeneratedAnswer;
import eu.virtualparadox.hybridqa.rag.context.ContextAssembler;
import eu.virtualparadox.hybridqa.rag.context.ContextBlock;
import eu.virtualparadox.hybridqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.hybridqa.rag.retriever.service.HybridRetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Entry point for questions: retrieve, assemble, generate, guard.
 * <p>
 * A question without evidence is refused before the model is called. A failing model yields
 * the configured degraded message. Nothing here throws for those cases; only a {@code null}
 * question is rejected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class QueryManager {

    private final HybridRetrieverService retrieverService;
    private final ContextAssembler contextAssembler;
    private final AnswerService answerService;
    private final ApplicationConfig config;

    public GeneratedAnswer answer(final String question, final String refusalOverride) {
        return answer(question, refusalOverride, true);
    }

    /**
     * Blocking answer.
     *
     * @param question        the user question
     * @param refusalOverride refusal text for this call; blank means the configured one
     * @param showCitations   false strips every citation marker from the answer
     * @return the final answer, never {@code null}
     */
    public GeneratedAnswer answer(final String question, final String refusalOverride, final boolean showCitations) {
        Objects.requireNonNull(question, "question must not be null");
        final String refusal = resolveRefusal(refusalOverride);

        final ContextBlock context = retrieveContext(question);
        if (context.isEmpty()) {
            return GeneratedAnswer.refused(refusal);
        }

        final GeneratedAnswer answer = answerService.answer(question, context, refusal, showCitations);
        log.info("Answered with outcome {} and {} citations", answer.outcome(), answer.citations().size());
        return answer;
    }

    public Stream<String> answerStream(final String question, final String refusalOverride) {
        return answerStream(question, refusalOverride, true);
    }

    /**
     * Streaming answer. Retrieval and assembly run before this method returns; generation is
     * pulled fragment by fragment as the caller consumes the stream.
     * <p>
     * With citations shown, fragments are passed through raw: the citation ceiling and the
     * missing-citation caveat apply to the blocking path only. With citations hidden, markers
     * are removed in batches of {@code hybridqa.stream-flush-fragments} fragments.
     *
     * @param question        the user question
     * @param refusalOverride refusal text for this call; blank means the configured one
     * @param showCitations   false removes citation markers from the stream
     * @return lazy, finite, single-use stream of text fragments
     */
    public Stream<String> answerStream(final String question, final String refusalOverride, final boolean showCitations) {
        Objects.requireNonNull(question, "question must not be null");
        final String refusal = resolveRefusal(refusalOverride);

        final ContextBlock context = retrieveContext(question);
        if (context.isEmpty()) {
            return Stream.of(refusal);
        }

        final Stream<String> upstream;
        try {
            upstream = answerService.streamAnswer(question, context);
        } catch (final RuntimeException e) {
            log.error("Could not open answer stream for question: {}", question, e);
            return Stream.of(config.getDegradedMessage());
        }

        Iterator<String> fragments = new DegradingFragmentIterator(upstream.iterator(), config.getDegradedMessage());
        if (!showCitations) {
            fragments = new CitationSuppressingIterator(fragments, config.getStreamFlushFragments());
        }

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(fragments, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(upstream::close);
    }

    private ContextBlock retrieveContext(final String question) {
        final RetrievalResult retrieval = retrieverService.retrieve(question);
        if (retrieval.isEmpty()) {
            log.info("No relevant passages found; refusing without calling the model");
            return ContextBlock.empty();
        }

        final ContextBlock context = contextAssembler.assemble(retrieval.hits());
        if (context.isEmpty()) {
            log.info("No passage fits the context budget; refusing without calling the model");
        } else {
            log.debug(" !!! Context ({} chars, citations {}):\n{}",
                    context.text().length(), context.citations(), context.text());
        }
        return context;
    }

    private String resolveRefusal(final String refusalOverride) {
        return StringUtils.isBlank(refusalOverride) ? config.getRefusalMessage() : refusalOverride;
    }
}
