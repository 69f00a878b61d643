package me.misix.bot.adapter.inbound.telegram;

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
import me.misix.bot.adapter.outbound.telegram.TelegramApiErrors;
import me.misix.bot.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Telegram outbound channel: sends plain-text replies.
 *
 * <p>
 * Long replies are split at paragraph or line boundaries. Rate limiting (429)
 * is retried honoring {@code retry_after}; transport errors are retried with a
 * short pause. Exhausted retries surface as
 * {@link me.misix.bot.domain.model.exception.TransientNetworkException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int MESSAGE_CHUNK_LENGTH = 3800;
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_AFTER_CAP_SECONDS = 30;
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 5;
    private static final int NETWORK_RETRY_SECONDS = 1;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final Pattern RETRY_AFTER_PATTERN = Pattern.compile("retry after (\\d+)");

    private final TelegramClient telegramClient;

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String text) {
        return CompletableFuture.runAsync(() -> {
            for (String chunk : splitAtNewlines(text, MESSAGE_CHUNK_LENGTH)) {
                SendMessage sendMessage = SendMessage.builder()
                        .chatId(chatId)
                        .text(chunk)
                        .build();
                try {
                    executeWithRetry(() -> telegramClient.execute(sendMessage));
                } catch (TelegramApiException e) {
                    log.error("[Telegram] Failed to send message to chat {}: {}", chatId, e.getMessage());
                    throw new CompletionException(TelegramApiErrors.translate("sendMessage", e));
                }
            }
        });
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }

    // ===== Retry logic =====

    @FunctionalInterface
    interface TelegramApiCall<T> {
        T execute() throws TelegramApiException;
    }

    <T> T executeWithRetry(TelegramApiCall<T> call) throws TelegramApiException {
        for (int attempt = 0;; attempt++) {
            try {
                return call.execute();
            } catch (TelegramApiRequestException e) {
                if (!isRateLimited(e) || attempt >= MAX_RETRY_ATTEMPTS) {
                    throw e;
                }
                int retryAfter = extractRetryAfterSeconds(e);
                log.warn("[Telegram] Rate limited (429), waiting {}s before retry (attempt {}/{})",
                        retryAfter, attempt + 1, MAX_RETRY_ATTEMPTS);
                sleepForRetry(retryAfter);
            } catch (TelegramApiException e) {
                if (attempt >= MAX_RETRY_ATTEMPTS) {
                    throw e;
                }
                log.warn("[Telegram] Request failed ({}), retrying in {}s (attempt {}/{})",
                        e.getMessage(), NETWORK_RETRY_SECONDS, attempt + 1, MAX_RETRY_ATTEMPTS);
                sleepForRetry(NETWORK_RETRY_SECONDS);
            }
        }
    }

    private boolean isRateLimited(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS;
    }

    int extractRetryAfterSeconds(TelegramApiRequestException e) {
        long fromParameters = TelegramApiErrors.retryAfterSeconds(e);
        if (fromParameters > 0) {
            return (int) Math.min(fromParameters, RETRY_AFTER_CAP_SECONDS);
        }
        String message = e.getMessage();
        if (message != null) {
            Matcher matcher = RETRY_AFTER_PATTERN.matcher(message);
            if (matcher.find()) {
                return Math.min(Integer.parseInt(matcher.group(1)), RETRY_AFTER_CAP_SECONDS);
            }
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }

    /**
     * Package-private for testing - allows tests to override sleep behavior.
     */
    void sleepForRetry(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }
}
