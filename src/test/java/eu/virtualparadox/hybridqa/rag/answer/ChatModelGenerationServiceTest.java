package eu.virtualparadox.hybridqa.rag.answer;

import eu.virtualparadox.hybridqa.application.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatModelGenerationServiceTest {

    private ChatModel chatModel;
    private ChatModelGenerationService service;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        final ApplicationConfig config = new ApplicationConfig();
        config.setLlmBackoff(Duration.ZERO);
        service = new ChatModelGenerationService(chatModel, config);
    }

    private static ChatResponse response(final String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("Blocking call sends the system instruction and the prompt as separate messages")
    void testComplete() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("25 days [source: a.md]"));

        assertEquals("25 days [source: a.md]", service.complete("be strict", "USER QUESTION: days?"));

        final ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        final List<Message> messages = captor.getValue().getInstructions();
        assertEquals(2, messages.size());
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertEquals("be strict", messages.get(0).getText());
        assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
        assertEquals("USER QUESTION: days?", messages.get(1).getText());
    }

    @Test
    @DisplayName("Response without generations yields empty text")
    void testCompleteWithoutResult() {
        when(chatModel.call(any(Prompt.class))).thenReturn(new ChatResponse(List.of()));

        assertEquals("", service.complete("s", "p"));
    }

    @Test
    @DisplayName("Stream emits the non-empty fragments in order")
    void testStream() {
        when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.just(
                response("You get "), response(""), response("25 days"), new ChatResponse(List.of())));

        final List<String> fragments = service.completeStream("s", "p").toList();

        assertEquals(List.of("You get ", "25 days"), fragments);
    }

    @Test
    @DisplayName("Stream is pulled on demand and closing it cancels the model")
    void testStreamIsLazyAndCancellable() {
        final AtomicInteger emitted = new AtomicInteger();
        final AtomicBoolean cancelled = new AtomicBoolean();
        final Flux<ChatResponse> endless = Flux.<ChatResponse>generate(sink -> {
                    emitted.incrementAndGet();
                    sink.next(response("x"));
                })
                .doOnCancel(() -> cancelled.set(true));
        when(chatModel.stream(any(Prompt.class))).thenReturn(endless);

        try (Stream<String> stream = service.completeStream("s", "p")) {
            assertEquals(List.of("x", "x", "x"), stream.limit(3).toList());
        }

        assertTrue(emitted.get() < 10, "emitted " + emitted.get());
        assertTrue(cancelled.get());
    }

    @Test
    @DisplayName("Model failure surfaces to the caller of the stream")
    void testStreamError() {
        when(chatModel.stream(any(Prompt.class)))
                .thenReturn(Flux.just(response("partial")).concatWith(Flux.error(new IllegalStateException("reset"))));

        final Stream<String> stream = service.completeStream("s", "p");

        final RuntimeException error = assertThrows(RuntimeException.class, stream::toList);
        assertThat(error).hasMessageContaining("reset");
    }

    @Test
    @DisplayName("Transient failure is retried and the second call answers")
    void testCompleteRetriesTransientFailure() {
        when(chatModel.call(any(Prompt.class)))
                .thenThrow(new TransientAiException("503 Service Unavailable"))
                .thenReturn(response("ok [source: a]"));

        assertEquals("ok [source: a]", service.complete("s", "p"));
        verify(chatModel, times(2)).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Retries stop after the configured number of calls")
    void testCompleteGivesUp() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new TransientAiException("502 Bad Gateway"));

        final RuntimeException error = assertThrows(RuntimeException.class, () -> service.complete("s", "p"));

        assertThat(error).hasMessageContaining("502");
        verify(chatModel, times(2)).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Client errors are not retried")
    void testCompleteDoesNotRetryClientError() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new NonTransientAiException("401 Unauthorized"));

        assertThrows(NonTransientAiException.class, () -> service.complete("s", "p"));
        verify(chatModel, times(1)).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Stream that fails before its first fragment is reopened")
    void testStreamRetriesBeforeFirstFragment() {
        final AtomicInteger subscriptions = new AtomicInteger();
        when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.defer(() -> subscriptions.incrementAndGet() == 1
                ? Flux.<ChatResponse>error(new TransientAiException("503"))
                : Flux.just(response("ok "), response("[source: a]"))));

        assertEquals(List.of("ok ", "[source: a]"), service.completeStream("s", "p").toList());
        assertEquals(2, subscriptions.get());
    }

    @Test
    @DisplayName("Stream that already emitted is not reopened on failure")
    void testStreamNotRetriedAfterFirstFragment() {
        final AtomicInteger subscriptions = new AtomicInteger();
        when(chatModel.stream(any(Prompt.class))).thenReturn(Flux.defer(() -> {
            subscriptions.incrementAndGet();
            return Flux.just(response("partial")).concatWith(Flux.error(new TransientAiException("503")));
        }));

        final Stream<String> stream = service.completeStream("s", "p");

        assertThrows(TransientAiException.class, stream::toList);
        assertEquals(1, subscriptions.get());
    }
}
