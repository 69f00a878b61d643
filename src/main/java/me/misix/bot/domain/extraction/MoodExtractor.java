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
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.IntentKind;
import me.misix.bot.domain.model.MoodDraft;
import me.misix.bot.domain.model.MoodLevel;
import me.misix.bot.domain.service.RuntimeSettings;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Extracts a mood entry. Unknown moods fall back to {@link MoodLevel#NEUTRAL};
 * intensity defaults to 5 and is clamped into 1..10.
 */
@Component
public class MoodExtractor extends AbstractLlmExtractor {

    private static final String SYSTEM_PROMPT = "Ты - анализатор настроения. Отвечай только JSON.";
    private static final int DEFAULT_INTENSITY = 5;

    public MoodExtractor(LlmPort llmPort, LlmJsonParser jsonParser, RuntimeSettings runtimeSettings,
            BotProperties properties) {
        super(llmPort, jsonParser, runtimeSettings, properties);
    }

    @Override
    public Set<IntentKind> supportedKinds() {
        return Set.of(IntentKind.TRACK_MOOD);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String buildPrompt(IntentKind kind, String text) {
        return """
                Определи настроение из сообщения: "%s"

                Верни JSON:
                {
                    "mood": "happy/sad/anxious/calm/excited/tired/stressed/angry/neutral",
                    "intensity": 1-10,
                    "note": "дополнительная заметка если есть",
                    "confidence": 0.0-1.0
                }

                Примеры:
                "сегодня отличное настроение!" -> {"mood": "happy", "intensity": 9, "note": null, "confidence": 0.95}
                "устал очень" -> {"mood": "tired", "intensity": 7, "note": null, "confidence": 0.9}
                "немного тревожно перед встречей" -> {"mood": "anxious", "intensity": 5, "note": "перед встречей", "confidence": 0.85}

                Верни ТОЛЬКО JSON, без дополнительного текста.
                """.formatted(text);
    }

    @Override
    protected EntityDraft toDraft(IntentKind kind, JsonNode node, String text) {
        MoodLevel mood = MoodLevel.fromCode(textOrNull(node, "mood")).orElse(MoodLevel.NEUTRAL);
        int intensity = node.path("intensity").asInt(DEFAULT_INTENSITY);
        intensity = Math.max(MoodDraft.MIN_INTENSITY, Math.min(MoodDraft.MAX_INTENSITY, intensity));
        return MoodDraft.builder()
                .mood(mood)
                .intensity(intensity)
                .note(textOrNull(node, "note"))
                .build();
    }
}
