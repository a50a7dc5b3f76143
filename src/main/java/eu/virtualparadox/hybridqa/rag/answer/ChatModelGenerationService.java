package eu.virtualparadox.hybridqa.rag.answer;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * {@link GenerationService} on top of a Spring AI {@link ChatModel}.
 * <p>
 * Transient failures are retried up to {@code hybridqa.llm-max-retries} calls with a
 * {@code hybridqa.llm-backoff} pause; a {@link NonTransientAiException} (client error) is not.
 * A stream is only retried while it has not emitted anything, so a caller never sees a
 * fragment twice.
 * <p>
 * Streaming goes through {@code Flux.toStream(1)}: one fragment is requested at a time and
 * closing the Java stream cancels the model subscription.
 */
@Service
@Slf4j
public class ChatModelGenerationService implements GenerationService {

    private static final int PREFETCH = 1;

    private final ChatModel chatModel;
    private final RetryTemplate retryTemplate;
    private final int maxCalls;
    private final Duration backoff;

    public ChatModelGenerationService(final ChatModel chatModel, final ApplicationConfig config) {
        this.chatModel = chatModel;
        this.maxCalls = config.getLlmMaxRetries();
        this.backoff = config.getLlmBackoff();

        final RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxCalls)
                .notRetryOn(NonTransientAiException.class)
                .traversingCauses();
        this.retryTemplate = (backoff.isZero() ? builder.noBackoff() : builder.fixedBackoff(backoff.toMillis()))
                .build();
    }

    @Override
    public String complete(final String systemInstruction, final String prompt) {
        final ChatResponse response = retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying model call ({}/{}) after: {}",
                        context.getRetryCount() + 1, maxCalls, context.getLastThrowable().toString());
            }
            return chatModel.call(toPrompt(systemInstruction, prompt));
        });
        final String text = textOf(response);
        log.debug("Model returned {} chars", text == null ? 0 : text.length());
        return text == null ? "" : text;
    }

    @Override
    public Stream<String> completeStream(final String systemInstruction, final String prompt) {
        final AtomicBoolean emitted = new AtomicBoolean();
        return Flux.defer(() -> chatModel.stream(toPrompt(systemInstruction, prompt)))
                .doOnNext(response -> emitted.set(true))
                .retryWhen(Retry.fixedDelay(maxCalls - 1L, backoff)
                        .filter(error -> !emitted.get() && !(error instanceof NonTransientAiException))
                        .doBeforeRetry(signal -> log.warn("Retrying model stream ({}/{}) after: {}",
                                signal.totalRetries() + 2, maxCalls, signal.failure().toString()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .mapNotNull(ChatModelGenerationService::textOf)
                .filter(fragment -> !fragment.isEmpty())
                .toStream(PREFETCH);
    }

    private static Prompt toPrompt(final String systemInstruction, final String prompt) {
        return new Prompt(new SystemMessage(systemInstruction), new UserMessage(prompt));
    }

    private static String textOf(final ChatResponse response) {
        if (response == null) {
            return null;
        }
        final Generation result = response.getResult();
        if (result == null) {
            return null;
        }
        final AssistantMessage output = result.getOutput();
        return output == null ? null : output.getText();
    }
}
