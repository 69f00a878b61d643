package me.misix.bot.domain.extraction;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.IntentKind;
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import me.misix.bot.domain.service.ConversationContextStore;
import me.misix.bot.domain.service.RuntimeSettings;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Base for extractors that ask the LLM for a JSON object carrying the entity
 * fields plus a {@code confidence}.
 *
 * <p>
 * The pipeline of a single extraction is: prompt, parse, confidence gate,
 * {@link #toDraft}, {@link EntityDraft#validate()}. A missing confidence
 * counts as zero. The last few conversation turns are prepended to the prompt
 * so the model can resolve references to earlier messages.
 */
@Slf4j
public abstract class AbstractLlmExtractor implements EntityExtractor {

    private static final double TEMPERATURE = 0.3;
    private static final int MAX_TOKENS = 200;
    private static final int CONTEXT_TURNS = 4;

    private final LlmPort llmPort;
    private final LlmJsonParser jsonParser;
    private final RuntimeSettings runtimeSettings;
    private final BotProperties properties;

    protected AbstractLlmExtractor(LlmPort llmPort, LlmJsonParser jsonParser, RuntimeSettings runtimeSettings,
            BotProperties properties) {
        this.llmPort = llmPort;
        this.jsonParser = jsonParser;
        this.runtimeSettings = runtimeSettings;
        this.properties = properties;
    }

    protected abstract String systemPrompt();

    protected abstract String buildPrompt(IntentKind kind, String text);

    /**
     * Maps parsed fields to a draft. May return {@code null} or throw when the
     * fields are unusable.
     */
    protected abstract EntityDraft toDraft(IntentKind kind, JsonNode node, String text);

    @Override
    public CompletableFuture<Optional<EntityDraft>> extract(IntentKind kind, String text,
            List<ConversationTurn> context) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(systemPrompt())
                .userMessage(withContext(context, buildPrompt(kind, text)))
                .temperature(TEMPERATURE)
                .maxTokens(MAX_TOKENS)
                .build();
        long timeoutMs = properties.getPipeline().getExtractionTimeout().toMillis();

        CompletableFuture<LlmResponse> call;
        try {
            call = llmPort.chat(request);
        } catch (RuntimeException e) { // NOSONAR - provider failures become "no entity"
            log.warn("[Extraction] {} call failed: {}", kind, FailureClassifier.describe(e));
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return call.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("[Extraction] {} failed ({}): {}", kind,
                                FailureClassifier.classify(error), FailureClassifier.describe(error));
                        return Optional.<EntityDraft>empty();
                    }
                    return interpret(kind, response != null ? response.getContent() : null, text);
                });
    }

    static String withContext(List<ConversationTurn> context, String prompt) {
        if (context == null || context.isEmpty()) {
            return prompt;
        }
        int from = Math.max(0, context.size() - CONTEXT_TURNS);
        return "Контекст разговора:\n"
                + ConversationContextStore.formatForPrompt(context.subList(from, context.size()))
                + "\n\n" + prompt;
    }

    Optional<EntityDraft> interpret(IntentKind kind, String content, String text) {
        Optional<JsonNode> parsed = jsonParser.parseObject(content);
        if (parsed.isEmpty()) {
            log.warn("[Extraction] {} returned unparseable output", kind);
            return Optional.empty();
        }
        JsonNode node = parsed.get();
        double confidence = node.path("confidence").asDouble(0.0);
        double threshold = runtimeSettings.getExtractionThreshold();
        if (confidence < threshold) {
            log.info("[Extraction] {} confidence too low: {} < {}", kind, confidence, threshold);
            return Optional.empty();
        }

        try {
            EntityDraft draft = toDraft(kind, node, text);
            if (draft == null) {
                return Optional.empty();
            }
            draft.validate();
            log.info("[Extraction] extracted {} draft", kind);
            return Optional.of(draft);
        } catch (RuntimeException e) { // NOSONAR - invalid fields mean no entity
            log.warn("[Extraction] {} draft rejected: {}", kind, e.getMessage());
            return Optional.empty();
        }
    }

    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }
}
