package me.golemcore.analyst.adapter.outbound.llm;

import me.golemcore.analyst.domain.model.LlmRequest;
import me.golemcore.analyst.domain.model.LlmResponse;
import me.golemcore.analyst.infrastructure.config.AnalystProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmAdapterFactoryTest {

    private AnalystProperties properties;
    private LlmProviderAdapter openAi;
    private NoOpLlmAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new AnalystProperties();
        openAi = mock(LlmProviderAdapter.class);
        when(openAi.getProviderId()).thenReturn("langchain4j");
        when(openAi.isAvailable()).thenReturn(true);
        when(openAi.getCurrentModel()).thenReturn("gpt-4o-mini");
        noOp = new NoOpLlmAdapter();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        LlmAdapterFactory factory = factory("langchain4j");

        assertEquals("langchain4j", factory.getProviderId());
        assertEquals("gpt-4o-mini", factory.getCurrentModel());
        assertTrue(factory.isAvailable());
        verify(openAi).initialize();
    }

    @Test
    void shouldDelegateChat() {
        LlmResponse response = LlmResponse.builder().content("{}").build();
        when(openAi.chat(any())).thenReturn(CompletableFuture.completedFuture(response));
        LlmAdapterFactory factory = factory("langchain4j");

        assertSame(response, factory.chat(LlmRequest.builder().build()).join());
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() {
        LlmAdapterFactory factory = factory("anthropic");

        assertEquals(NoOpLlmAdapter.PROVIDER_ID, factory.getProviderId());
        assertFalse(factory.isAvailable());
        verify(openAi, never()).initialize();
    }

    @Test
    void shouldSelectNoOpExplicitly() {
        LlmAdapterFactory factory = factory("none");

        assertFalse(factory.isAvailable());
        assertTrue(factory.chat(LlmRequest.builder().build()).isCompletedExceptionally());
    }

    @Test
    void shouldFailChatWithoutAnyAdapter() {
        properties.getLlm().setProvider("langchain4j");
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of());
        factory.init();

        assertFalse(factory.isAvailable());
        assertTrue(factory.chat(LlmRequest.builder().build()).isCompletedExceptionally());
    }

    private LlmAdapterFactory factory(String provider) {
        properties.getLlm().setProvider(provider);
        LlmAdapterFactory factory = new LlmAdapterFactory(properties, List.of(openAi, noOp));
        factory.init();
        return factory;
    }
}
