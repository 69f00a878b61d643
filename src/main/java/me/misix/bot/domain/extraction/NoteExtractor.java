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
import me.misix.bot.domain.model.NoteDraft;
import me.misix.bot.domain.service.RuntimeSettings;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
public class NoteExtractor extends AbstractLlmExtractor {

    private static final String SYSTEM_PROMPT = "Ты - экстрактор заметок. Отвечай только JSON.";

    public NoteExtractor(LlmPort llmPort, LlmJsonParser jsonParser, RuntimeSettings runtimeSettings,
            BotProperties properties) {
        super(llmPort, jsonParser, runtimeSettings, properties);
    }

    @Override
    public Set<IntentKind> supportedKinds() {
        return Set.of(IntentKind.SAVE_NOTE);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String buildPrompt(IntentKind kind, String text) {
        return """
                Извлеки информацию для заметки из сообщения: "%s"

                Верни JSON:
                {
                    "title": "краткий заголовок",
                    "content": "полное содержание",
                    "confidence": 0.0-1.0
                }

                Примеры:
                "запомни что встреча в офисе на Ленина 5" -> {"title": "Встреча в офисе", "content": "встреча в офисе на Ленина 5", "confidence": 0.9}
                "сохрани пароль от wifi: qwerty123" -> {"title": "Пароль от wifi", "content": "пароль от wifi: qwerty123", "confidence": 0.95}

                Верни ТОЛЬКО JSON, без дополнительного текста.
                """.formatted(text);
    }

    @Override
    protected EntityDraft toDraft(IntentKind kind, JsonNode node, String text) {
        String content = textOrNull(node, "content");
        return NoteDraft.builder()
                .title(textOrNull(node, "title"))
                .content(content != null ? content : text.trim())
                .build();
    }
}
