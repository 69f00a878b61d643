package me.misix.bot.adapter.outbound.telegram;

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

import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

/**
 * Maps Telegram Bot API failures to domain exceptions.
 *
 * <ul>
 * <li>401, 404: bad token, {@link PlatformAuthException}</li>
 * <li>409: another getUpdates consumer or an active webhook,
 * {@link ModeConflictException}</li>
 * <li>429 (with {@code retry_after}), 5xx and transport errors:
 * {@link TransientNetworkException}</li>
 * <li>anything else: {@link IllegalStateException}</li>
 * </ul>
 */
public final class TelegramApiErrors {

    private TelegramApiErrors() {
    }

    public static RuntimeException translate(String operation, TelegramApiException e) {
        if (!(e instanceof TelegramApiRequestException request) || request.getErrorCode() == null) {
            return new TransientNetworkException(operation + " failed: " + e.getMessage(), e);
        }
        int code = request.getErrorCode();
        String description = operation + " failed with " + code + ": " + request.getApiResponse();
        if (code == 401 || code == 404) {
            return new PlatformAuthException(description, e);
        }
        if (code == 409) {
            return new ModeConflictException(description, e);
        }
        if (code == 429) {
            return new TransientNetworkException(description, e, retryAfterSeconds(request));
        }
        if (code >= 500) {
            return new TransientNetworkException(description, e);
        }
        return new IllegalStateException(description, e);
    }

    public static long retryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() == null || e.getParameters().getRetryAfter() == null) {
            return 0;
        }
        return e.getParameters().getRetryAfter();
    }
}
