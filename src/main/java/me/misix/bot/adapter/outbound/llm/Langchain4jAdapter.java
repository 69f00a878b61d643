package me.misix.bot.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible API endpoint
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/name}; a bare name means
 * {@code openai}. Provider credentials come from
 * {@code bot.llm.langchain4j.providers.*}. Rate limits are retried with
 * exponential backoff, every other failure completes the future
 * exceptionally so callers can fall back.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_BACKOFF_MS = 1_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final BotProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public void initialize() {
        String model = getCurrentModel();
        if (!isAvailable()) {
            log.warn("[LLM] Provider '{}' has no api-key, model {} unavailable", providerOf(model), model);
        }
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel chatModel = models.computeIfAbsent(model, this::createModel);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature())
                    .maxOutputTokens(request.getMaxTokens())
                    .build();

            for (int attempt = 0;; attempt++) {
                try {
                    ChatResponse response = chatModel.chat(chatRequest);
                    return convertResponse(response, model);
                } catch (RuntimeException e) {
                    if (!isRateLimitError(e) || attempt >= MAX_RETRIES) {
                        log.warn("[LLM] Chat with {} failed: {}", model, e.getMessage());
                        throw new CompletionException(e);
                    }
                    long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, MAX_RETRIES, backoffMs);
                    sleepBeforeRetry(backoffMs);
                }
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getLangchain4j().getModel();
    }

    @Override
    public boolean isAvailable() {
        BotProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(providerOf(getCurrentModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    // ==================== Model creation ====================

    protected ChatModel createModel(String model) {
        String provider = providerOf(model);
        BotProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getLangchain4j().getTimeoutMs());
        log.info("[LLM] Creating {} model: {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(properties.getLlm().getLangchain4j().getMaxTokens())
                    .timeout(timeout);
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // All non-Anthropic providers use the OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(timeout);
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private BotProperties.ProviderProperties getProviderConfig(String provider) {
        BotProperties.ProviderProperties config = properties.getLlm().getLangchain4j().getProviders()
                .get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add bot.llm.langchain4j.providers." + provider + ".api-key");
        }
        return config;
    }

    static String providerOf(String model) {
        if (model == null || !model.contains("/")) {
            return PROVIDER_OPENAI;
        }
        return model.substring(0, model.indexOf('/'));
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    // ==================== Conversion ====================

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getHistory() != null) {
            for (ConversationTurn turn : request.getHistory()) {
                if (turn.text() == null || turn.text().isBlank()) {
                    continue;
                }
                switch (turn.role()) {
                case USER -> messages.add(UserMessage.from(turn.text()));
                case ASSISTANT -> messages.add(AiMessage.from(turn.text()));
                }
            }
        }
        messages.add(UserMessage.from(request.getUserMessage()));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        String content = response.aiMessage() != null ? response.aiMessage().text() : null;
        return LlmResponse.builder()
                .content(content)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    protected void sleepBeforeRetry(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CompletionException(new IllegalStateException("LLM chat interrupted during retry backoff", ie));
        }
    }
}
