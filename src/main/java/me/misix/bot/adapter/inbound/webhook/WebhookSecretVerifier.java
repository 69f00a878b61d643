package me.misix.bot.adapter.inbound.webhook;

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
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the {@code X-Telegram-Bot-Api-Secret-Token} header Telegram sends
 * with every webhook call when a secret was given to {@code setWebhook}.
 *
 * <p>
 * Without a configured secret every request is accepted. Comparison is
 * constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSecretVerifier {

    public static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final BotProperties properties;

    public boolean verify(HttpHeaders headers) {
        String expected = properties.getDelivery().getWebhook().getSecretToken();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        String provided = headers.getFirst(SECRET_HEADER);
        if (provided == null) {
            log.warn("[Webhook] Request without secret token header, rejecting");
            return false;
        }
        return constantTimeEquals(expected.trim(), provided);
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
