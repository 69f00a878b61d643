package me.misix.bot.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import me.misix.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private BotProperties properties;
    private ChatModel mockModel;
    private List<String> createdModels;
    private List<Long> backoffs;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        BotProperties.ProviderProperties openai = new BotProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getLangchain4j().getProviders().put("openai", openai);
        mockModel = mock(ChatModel.class);
        createdModels = new ArrayList<>();
        backoffs = new ArrayList<>();

        adapter = new Langchain4jAdapter(properties) {
            @Override
            protected ChatModel createModel(String model) {
                createdModels.add(model);
                return mockModel;
            }

            @Override
            protected void sleepBeforeRetry(long millis) {
                backoffs.add(millis);
            }
        };
    }

    // ===== configuration =====

    @Test
    void shouldReportAvailabilityFromProviderKey() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals("openai/gpt-4o-mini", adapter.getCurrentModel());
        assertTrue(adapter.isAvailable());

        properties.getLlm().getLangchain4j().setModel("anthropic/claude-3-5-haiku");

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldParseProviderPrefix() {
        assertEquals("anthropic", Langchain4jAdapter.providerOf("anthropic/claude-3-5-haiku"));
        assertEquals("openai", Langchain4jAdapter.providerOf("gpt-4o-mini"));
        assertEquals("openai", Langchain4jAdapter.providerOf(null));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4o-mini"));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldRefuseUnconfiguredProvider() {
        Langchain4jAdapter real = new Langchain4jAdapter(properties);

        assertThrows(IllegalStateException.class, () -> real.createModel("anthropic/claude-3-5-haiku"));
    }

    // ===== message conversion =====

    @Test
    void shouldConvertSystemPromptHistoryAndUserMessage() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("Ты дружелюбный ассистент")
                .history(List.of(
                        ConversationTurn.user("Привет", NOW),
                        ConversationTurn.assistant("Привет! Чем помочь?", NOW),
                        ConversationTurn.user("  ", NOW)))
                .userMessage("Как дела?")
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("Ты дружелюбный ассистент", ((SystemMessage) messages.get(0)).text());
        assertEquals("Привет", ((UserMessage) messages.get(1)).singleText());
        assertEquals("Привет! Чем помочь?", ((AiMessage) messages.get(2)).text());
        assertEquals("Как дела?", ((UserMessage) messages.get(3)).singleText());
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        LlmRequest request = LlmRequest.builder().systemPrompt(" ").userMessage("Привет").build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }

    // ===== chat =====

    @Test
    void shouldReturnResponseOnSuccessfulChat() throws Exception {
        when(mockModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("Привет!"))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .userMessage("Привет")
                .temperature(0.1)
                .maxTokens(64)
                .build()).get();

        assertEquals("Привет!", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals("openai/gpt-4o-mini", response.getModel());
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(mockModel).chat(captor.capture());
        assertEquals(0.1, captor.getValue().temperature());
        assertEquals(64, captor.getValue().maxOutputTokens());
    }

    @Test
    void shouldCacheModelPerName() throws Exception {
        when(mockModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("ok"))
                .build());

        adapter.chat(LlmRequest.builder().userMessage("a").build()).get();
        adapter.chat(LlmRequest.builder().userMessage("b").build()).get();
        adapter.chat(LlmRequest.builder().model("openai/gpt-4o").userMessage("c").build()).get();

        assertEquals(List.of("openai/gpt-4o-mini", "openai/gpt-4o"), createdModels);
    }

    @Test
    void shouldRetryRateLimitWithBackoff() throws Exception {
        when(mockModel.chat(any(ChatRequest.class)))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());

        LlmResponse response = adapter.chat(LlmRequest.builder().userMessage("Привет").build()).get();

        assertEquals("ok", response.getContent());
        assertEquals(List.of(1000L), backoffs);
    }

    @Test
    void shouldGiveUpAfterMaxRateLimitRetries() {
        when(mockModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate_limit_exceeded"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("Привет").build()).get());

        assertEquals("rate_limit_exceeded", ex.getCause().getMessage());
        verify(mockModel, times(3)).chat(any(ChatRequest.class));
        assertEquals(List.of(1000L, 2000L), backoffs);
    }

    @Test
    void shouldNotRetryOtherFailures() {
        when(mockModel.chat(any(ChatRequest.class))).thenThrow(new IllegalArgumentException("invalid api key"));

        assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("Привет").build()).get());

        verify(mockModel, times(1)).chat(any(ChatRequest.class));
        assertTrue(backoffs.isEmpty());
    }
}
