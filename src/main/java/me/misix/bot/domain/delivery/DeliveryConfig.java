package me.misix.bot.domain.delivery;

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

import me.misix.bot.infrastructure.config.BotProperties;

import java.time.Duration;

/**
 * Snapshot of the delivery settings taken at the start of a mode transition.
 */
public record DeliveryConfig(
        String webhookUrl,
        String secretToken,
        int maxConnections,
        int registrationAttempts,
        Duration registrationRetryDelay,
        int backlogLimit,
        int backlogTimeoutSeconds,
        Duration pollingStopTimeout) {

    public static DeliveryConfig from(BotProperties properties) {
        BotProperties.DeliveryProperties delivery = properties.getDelivery();
        BotProperties.WebhookProperties webhook = delivery.getWebhook();
        return new DeliveryConfig(
                blankToNull(webhook.getUrl()),
                blankToNull(webhook.getSecretToken()),
                webhook.getMaxConnections(),
                Math.max(1, webhook.getRegistrationAttempts()),
                webhook.getRegistrationRetryDelay(),
                delivery.getBacklog().getLimit(),
                delivery.getBacklog().getTimeoutSeconds(),
                delivery.getPolling().getStopTimeout());
    }

    public boolean hasWebhookUrl() {
        return webhookUrl != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
