package eu.virtualparadox.hybridqa.rag.embed;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.util.Map;

/**
 * Typed {@link ObjectProvider}s for wiring index services without a Spring context.
 */
public final class EmbeddingProviders {

    private EmbeddingProviders() {
    }

    /** Provider returning {@code embeddingService}, or nothing when it is {@code null}. */
    public static ObjectProvider<EmbeddingService> of(final EmbeddingService embeddingService) {
        final Map<String, Object> beans = embeddingService == null
                ? Map.of()
                : Map.of("embeddingService", embeddingService);
        return new StaticListableBeanFactory(beans).getBeanProvider(EmbeddingService.class);
    }

    public static ObjectProvider<EmbeddingService> none() {
        return of(null);
    }
}
