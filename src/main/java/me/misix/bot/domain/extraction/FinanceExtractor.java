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
import me.misix.bot.domain.model.FinanceDraft;
import me.misix.bot.domain.model.FinanceType;
import me.misix.bot.domain.model.IntentKind;
import me.misix.bot.domain.service.RuntimeSettings;
import me.misix.bot.domain.system.LlmJsonParser;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts expenses and incomes. The record type always follows the routed
 * intent kind, whatever the model says about it.
 */
@Component
public class FinanceExtractor extends AbstractLlmExtractor {

    private static final String SYSTEM_PROMPT = "Ты - экстрактор финансовых данных. Отвечай только JSON.";
    private static final Pattern AMOUNT = Pattern.compile("\\d+(?:[.,]\\d+)?");

    public FinanceExtractor(LlmPort llmPort, LlmJsonParser jsonParser, RuntimeSettings runtimeSettings,
            BotProperties properties) {
        super(llmPort, jsonParser, runtimeSettings, properties);
    }

    @Override
    public Set<IntentKind> supportedKinds() {
        return Set.of(IntentKind.ADD_EXPENSE, IntentKind.ADD_INCOME);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String buildPrompt(IntentKind kind, String text) {
        String typeHint = kind == IntentKind.ADD_INCOME ? "income" : "expense";
        return """
                Извлеки финансовую информацию из сообщения: "%s"
                Тип операции: %s

                Верни JSON:
                {
                    "amount": число,
                    "type": "expense" или "income",
                    "category": "еда и напитки/транспорт/развлечения/здоровье/покупки/другое",
                    "description": "краткое описание",
                    "confidence": 0.0-1.0
                }

                Примеры:
                "потратил 500 рублей на кофе" -> {"amount": 500, "type": "expense", "category": "еда и напитки", "description": "кофе", "confidence": 0.95}
                "заработал 50000" -> {"amount": 50000, "type": "income", "category": "другое", "description": "доход", "confidence": 0.9}
                "200₽ на такси" -> {"amount": 200, "type": "expense", "category": "транспорт", "description": "такси", "confidence": 0.95}

                Верни ТОЛЬКО JSON, без дополнительного текста.
                """.formatted(text, typeHint);
    }

    @Override
    protected EntityDraft toDraft(IntentKind kind, JsonNode node, String text) {
        return FinanceDraft.builder()
                .amount(parseAmount(node.get("amount")))
                .type(kind == IntentKind.ADD_INCOME ? FinanceType.INCOME : FinanceType.EXPENSE)
                .category(textOrNull(node, "category"))
                .description(textOrNull(node, "description"))
                .build();
    }

    static BigDecimal parseAmount(JsonNode amount) {
        if (amount == null || amount.isNull()) {
            return null;
        }
        if (amount.isNumber()) {
            return amount.decimalValue();
        }
        Matcher matcher = AMOUNT.matcher(amount.asText().replace(" ", "").replace("\u00A0", ""));
        if (!matcher.find()) {
            return null;
        }
        return new BigDecimal(matcher.group().replace(',', '.'));
    }
}
