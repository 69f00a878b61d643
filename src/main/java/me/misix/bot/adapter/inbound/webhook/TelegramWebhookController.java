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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.adapter.inbound.telegram.TelegramUpdateMapper;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.UpdateReceivedEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.telegram.telegrambots.meta.api.objects.Update;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Receives Telegram updates pushed to the registered webhook (WebFlux).
 *
 * <p>
 * Responses:
 * <ul>
 * <li>{@code 200 {"ok":true}}: accepted, including duplicates, non-message
 * updates and updates whose processing later fails</li>
 * <li>{@code 400}: body is not a Telegram update</li>
 * <li>{@code 403}: secret token header does not match</li>
 * </ul>
 *
 * <p>
 * Processing is asynchronous; the request returns as soon as the update is
 * handed over.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TelegramWebhookController {

    private final WebhookSecretVerifier secretVerifier;
    private final TelegramUpdateMapper updateMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostMapping("${bot.delivery.webhook.path:/bot/webhook}")
    public Mono<ResponseEntity<Map<String, Object>>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            if (!secretVerifier.verify(headers)) {
                return forbidden();
            }
            if (body == null || body.length == 0) {
                return badRequest("empty body");
            }

            Update update;
            try {
                update = objectMapper.readValue(body, Update.class);
            } catch (JsonProcessingException e) {
                log.warn("[Webhook] Malformed update payload: {}", e.getOriginalMessage());
                return badRequest("malformed update");
            } catch (IOException e) {
                log.warn("[Webhook] Unreadable update payload: {}", e.getMessage());
                return badRequest("malformed update");
            }
            if (update == null || update.getUpdateId() == null) {
                return badRequest("update_id is required");
            }

            try {
                PlatformUpdate platformUpdate = updateMapper.map(update);
                eventPublisher.publishEvent(new UpdateReceivedEvent(platformUpdate, clock.instant()));
                log.debug("[Webhook] Update {} accepted", update.getUpdateId());
            } catch (RuntimeException e) { // NOSONAR - Telegram must not redeliver on our failures
                log.error("[Webhook] Failed to hand over update {}: {}", update.getUpdateId(), e.getMessage(), e);
            }
            return ResponseEntity.ok(Map.<String, Object>of("ok", true));
        });
    }

    private ResponseEntity<Map<String, Object>> forbidden() {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of("ok", false, "error", "invalid secret token"));
    }

    private ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest()
                .body(Map.of("ok", false, "error", message));
    }
}
