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
import me.misix.bot.domain.model.TaskDraft;
import me.misix.bot.domain.model.TaskPriority;
import me.misix.bot.domain.service.RuntimeSettings;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Extracts tasks and reminders. Deadlines come back as free text and are
 * resolved by {@link RelativeDateParser}.
 */
@Component
public class TaskExtractor extends AbstractLlmExtractor {

    private static final String SYSTEM_PROMPT = "Ты - экстрактор данных. Отвечай только JSON.";

    private final RelativeDateParser dateParser;

    public TaskExtractor(LlmPort llmPort, LlmJsonParser jsonParser, RuntimeSettings runtimeSettings,
            BotProperties properties, RelativeDateParser dateParser) {
        super(llmPort, jsonParser, runtimeSettings, properties);
        this.dateParser = dateParser;
    }

    @Override
    public Set<IntentKind> supportedKinds() {
        return Set.of(IntentKind.CREATE_TASK);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String buildPrompt(IntentKind kind, String text) {
        return """
                Извлеки информацию о задаче из сообщения: "%s"

                Верни JSON:
                {
                    "title": "описание задачи",
                    "description": "подробности или null",
                    "deadline": "YYYY-MM-DD HH:MM или tomorrow/today/через X дней или null",
                    "priority": "low/medium/high",
                    "confidence": 0.0-1.0
                }

                Примеры:
                "напомни завтра позвонить партнеру" -> {"title": "позвонить партнеру", "description": null, "deadline": "tomorrow 09:00", "priority": "medium", "confidence": 0.95}
                "срочно купить молоко" -> {"title": "купить молоко", "description": null, "deadline": null, "priority": "high", "confidence": 0.9}
                "через 2 дня встреча" -> {"title": "встреча", "description": null, "deadline": "через 2 дня", "priority": "medium", "confidence": 0.85}

                Верни ТОЛЬКО JSON, без дополнительного текста.
                """.formatted(text);
    }

    @Override
    protected EntityDraft toDraft(IntentKind kind, JsonNode node, String text) {
        return TaskDraft.builder()
                .title(textOrNull(node, "title"))
                .description(textOrNull(node, "description"))
                .deadline(dateParser.parse(textOrNull(node, "deadline")))
                .priority(TaskPriority.fromCode(textOrNull(node, "priority")))
                .build();
    }
}
