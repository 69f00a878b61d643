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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.EntityResult;
import me.misix.bot.domain.model.FinanceDraft;
import me.misix.bot.domain.model.FinanceType;
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import me.misix.bot.domain.model.MoodDraft;
import me.misix.bot.domain.model.NoteDraft;
import me.misix.bot.domain.model.TaskDraft;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.infrastructure.i18n.MessageService;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Builds the single outbound reply of an update.
 *
 * <p>
 * Persisted entities produce one confirmation line each, in the order given.
 * Without any persisted entity the reply is a conversational answer from the
 * LLM. When generation is impossible (LLM unavailable, failed, blank answer
 * or no budget left) a keyword reply is used if the message is a greeting,
 * thanks or a help request, and the static apology otherwise.
 *
 * <p>
 * {@code compose} never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseComposer {

    private static final String ASSISTANT_PROMPT = """
            Ты - MISIX, персональный AI-ассистент пользователя.

            Твоя задача:
            - Помогать пользователю управлять задачами, финансами и заметками
            - Отвечать дружелюбно и по существу
            - Быть кратким, но информативным
            - Использовать эмодзи для наглядности

            Ты можешь:
            - Создавать задачи и напоминания
            - Записывать расходы и доходы
            - Сохранять заметки
            - Отвечать на вопросы
            - Вести дружескую беседу

            Отвечай на русском языке.
            """;

    private static final Pattern GREETING = Pattern.compile(
            "(?<!\\p{L})(привет|здравствуй|hello(?!\\p{L})|hi(?!\\p{L}))", Pattern.CASE_INSENSITIVE
                    | Pattern.UNICODE_CASE);
    private static final Pattern THANKS = Pattern.compile(
            "(?<!\\p{L})(спасибо|благодарю|thanks?(?!\\p{L}))", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern HELP = Pattern.compile(
            "(?<!\\p{L})(помощь|help(?!\\p{L})|что ты умеешь)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final DateTimeFormatter DEADLINE_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final LlmPort llmPort;
    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;

    /**
     * @param results
     *            entity results in extraction order; failed ones are skipped
     * @param userText
     *            the message being answered
     * @param history
     *            context window before this message, oldest first
     * @param deadline
     *            update deadline, or {@code null} for no budget
     */
    public String compose(List<EntityResult> results, String userText, List<ConversationTurn> history,
            Instant deadline) {
        try {
            String confirmations = confirmations(results);
            if (!confirmations.isEmpty()) {
                return confirmations;
            }
            return conversationalReply(userText, history, deadline);
        } catch (RuntimeException e) { // NOSONAR - reply composition must always produce a message
            log.error("[Composer] unexpected failure, sending apology", e);
            return apology();
        }
    }

    public String apology() {
        return messageService.getMessage("reply.apology");
    }

    String confirmations(List<EntityResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }
        StringBuilder reply = new StringBuilder();
        for (EntityResult result : results) {
            if (result == null || !result.isPersisted()) {
                continue;
            }
            String line = confirmationLine(result.entity().draft());
            if (line == null) {
                continue;
            }
            if (reply.length() > 0) {
                reply.append('\n');
            }
            reply.append(line);
        }
        return reply.toString();
    }

    private String confirmationLine(EntityDraft draft) {
        if (draft instanceof TaskDraft task) {
            if (task.deadline() != null) {
                String date = DEADLINE_FORMAT.format(task.deadline().atZone(clock.getZone()));
                return messageService.getMessage("confirm.task.deadline", task.title(), date);
            }
            return messageService.getMessage("confirm.task", task.title());
        }
        if (draft instanceof FinanceDraft finance) {
            String key = finance.type() == FinanceType.INCOME ? "confirm.income" : "confirm.expense";
            return messageService.getMessage(key, formatAmount(finance.amount()), finance.category());
        }
        if (draft instanceof NoteDraft note) {
            return messageService.getMessage("confirm.note", note.title());
        }
        if (draft instanceof MoodDraft mood) {
            String label = messageService.getMessage("mood.label." + mood.mood().getCode());
            return messageService.getMessage("confirm.mood", mood.mood().getEmoji(), label,
                    String.valueOf(mood.intensity()));
        }
        log.warn("[Composer] no confirmation template for {}", draft.getClass().getSimpleName());
        return null;
    }

    static String formatAmount(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    private String conversationalReply(String userText, List<ConversationTurn> history, Instant deadline) {
        Duration timeout = chatTimeout(deadline);
        if (timeout.isZero() || timeout.isNegative()) {
            log.warn("[Composer] update budget exhausted, sending apology");
            return apology();
        }
        if (!llmPort.isAvailable()) {
            log.warn("[Composer] LLM unavailable, using keyword fallback");
            return keywordReply(userText);
        }

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(ASSISTANT_PROMPT)
                .history(history != null ? List.copyOf(history) : List.of())
                .userMessage(userText)
                .temperature(properties.getLlm().getLangchain4j().getTemperature())
                .maxTokens(properties.getLlm().getLangchain4j().getMaxTokens())
                .build();

        CompletableFuture<LlmResponse> future = null;
        try {
            future = llmPort.chat(request);
            LlmResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String content = response != null ? response.getContent() : null;
            if (content == null || content.isBlank()) {
                log.warn("[Composer] blank LLM reply, using keyword fallback");
                return keywordReply(userText);
            }
            return content.trim();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Composer] LLM reply timed out after {}ms", timeout.toMillis());
            return keywordReply(userText);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return apology();
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Composer] LLM reply FAILED ({}): {}", FailureClassifier.classify(e),
                    FailureClassifier.describe(e));
            return keywordReply(userText);
        }
    }

    String keywordReply(String userText) {
        if (userText != null) {
            if (GREETING.matcher(userText).find()) {
                return messageService.getMessage("reply.greeting");
            }
            if (THANKS.matcher(userText).find()) {
                return messageService.getMessage("reply.thanks");
            }
            if (HELP.matcher(userText).find()) {
                return messageService.getMessage("reply.capabilities");
            }
        }
        return apology();
    }

    private Duration chatTimeout(Instant deadline) {
        Duration timeout = properties.getPipeline().getChatTimeout();
        if (deadline == null) {
            return timeout;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }
}
