package me.misix.bot.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.IntentCandidate;
import me.misix.bot.domain.model.IntentKind;
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * LLM-based intent classifier.
 *
 * <p>
 * Asks the model for every intent present in the message together with a
 * confidence, then keeps only candidates at or above the routing threshold.
 * The threshold is read from {@link RuntimeSettings} on every call.
 *
 * <p>
 * Never throws: a timeout (default 5s), a provider error or an unparseable
 * answer all yield an empty list, which callers treat as "answer
 * conversationally".
 *
 * <p>
 * When the model reports one kind several times, only the most confident
 * entry is kept, at the position of its first appearance.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntentClassifier {

    private static final int CONTEXT_TURNS = 3;

    private static final String SYSTEM_PROMPT = """
            Ты - классификатор намерений. Отвечай только JSON.

            Определи ВСЕ намерения пользователя в сообщении.

            Возможные намерения:
            - create_task: хочет создать задачу или напоминание
            - add_expense: сообщает о расходе
            - add_income: сообщает о доходе
            - save_note: хочет сохранить информацию/заметку
            - track_mood: выражает настроение или эмоцию
            - general_chat: просто общается

            Формат ответа:
            {"intents": [{"type": "create_task", "confidence": 0.95}, {"type": "add_expense", "confidence": 0.85}]}

            Примеры:
            "потратил 200₽ на такси и напомни купить молоко" -> {"intents": [{"type": "add_expense", "confidence": 0.95}, {"type": "create_task", "confidence": 0.9}]}
            "сегодня отличное настроение!" -> {"intents": [{"type": "track_mood", "confidence": 0.95}]}
            "как дела?" -> {"intents": [{"type": "general_chat", "confidence": 0.95}]}

            Верни ТОЛЬКО JSON, без дополнительного текста.
            """;

    private final LlmPort llmPort;
    private final LlmJsonParser jsonParser;
    private final RuntimeSettings runtimeSettings;
    private final BotProperties properties;

    /**
     * Classify a user message.
     *
     * @param text
     *            raw or transcribed user text
     * @param context
     *            recent conversation, oldest first
     * @return candidates at or above the routing threshold, in model order
     */
    public List<IntentCandidate> classify(String text, List<ConversationTurn> context) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        long timeoutMs = properties.getPipeline().getClassifierTimeout().toMillis();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userMessage(buildPrompt(text, context))
                .temperature(0.3)
                .maxTokens(200)
                .build();

        CompletableFuture<LlmResponse> call = null;
        try {
            long startMs = System.currentTimeMillis();
            call = llmPort.chat(request);
            LlmResponse response = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[Classifier] LLM responded in {}ms", System.currentTimeMillis() - startMs);

            List<IntentCandidate> all = parseResponse(response != null ? response.getContent() : null);
            double threshold = runtimeSettings.getRoutingThreshold();
            List<IntentCandidate> accepted = all.stream()
                    .filter(candidate -> candidate.meets(threshold))
                    .toList();
            log.info("[Classifier] {} candidate(s), {} at or above threshold {}: {}",
                    all.size(), accepted.size(), threshold, accepted);
            return accepted;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("[Classifier] timed out after {}ms, routing to conversational fallback", timeoutMs);
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (call != null) {
                call.cancel(true);
            }
            log.warn("[Classifier] interrupted");
            return List.of();
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Classifier] classification FAILED ({}): {}",
                    FailureClassifier.classify(e), FailureClassifier.describe(e));
            return List.of();
        }
    }

    List<IntentCandidate> parseResponse(String content) {
        Optional<JsonNode> parsed = jsonParser.parseObject(content);
        if (parsed.isEmpty()) {
            log.warn("[Classifier] unparseable response, no intents");
            return List.of();
        }
        JsonNode intents = parsed.get().path("intents");
        if (!intents.isArray()) {
            return List.of();
        }

        Map<IntentKind, Double> byKind = new LinkedHashMap<>();
        for (JsonNode intent : intents) {
            String type = intent.path("type").asText(null);
            Optional<IntentKind> kind = IntentKind.fromCode(type);
            if (kind.isEmpty()) {
                log.debug("[Classifier] ignoring unknown intent type: {}", type);
                continue;
            }
            double confidence = clamp(intent.path("confidence").asDouble(0.0));
            byKind.merge(kind.get(), confidence, Math::max);
        }

        List<IntentCandidate> candidates = new ArrayList<>(byKind.size());
        byKind.forEach((kind, confidence) -> candidates.add(new IntentCandidate(kind, confidence)));
        return candidates;
    }

    private String buildPrompt(String text, List<ConversationTurn> context) {
        StringBuilder sb = new StringBuilder();
        if (context != null && !context.isEmpty()) {
            int from = Math.max(0, context.size() - CONTEXT_TURNS);
            sb.append("Контекст разговора:\n")
                    .append(ConversationContextStore.formatForPrompt(context.subList(from, context.size())))
                    .append("\n\n");
        }
        sb.append("Сообщение:\n\"").append(text).append('"');
        return sb.toString();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
