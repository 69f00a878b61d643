package me.misix.bot.adapter.outbound.llm;

import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldReportUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldReturnPlaceholderReply() throws Exception {
        LlmResponse response = adapter.chat(LlmRequest.builder().userMessage("привет").build()).get();

        assertEquals("[No LLM configured]", response.getContent());
    }
}
