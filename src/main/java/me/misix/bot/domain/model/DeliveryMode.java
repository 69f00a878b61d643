package me.misix.bot.domain.model;

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

import java.util.EnumSet;
import java.util.Set;

/**
 * How inbound updates reach the bot. Exactly one value is current per process.
 *
 * <pre>
 * DISABLED → POLLING → DISABLED
 * DISABLED → WEBHOOK_PENDING → WEBHOOK_ACTIVE → DISABLED
 * WEBHOOK_PENDING → DISABLED
 * </pre>
 */
public enum DeliveryMode {

    DISABLED,

    POLLING,

    /**
     * Backlog drain and webhook registration in progress.
     */
    WEBHOOK_PENDING,

    WEBHOOK_ACTIVE;

    public Set<DeliveryMode> allowedTargets() {
        return switch (this) {
        case DISABLED -> EnumSet.of(POLLING, WEBHOOK_PENDING);
        case POLLING -> EnumSet.of(DISABLED);
        case WEBHOOK_PENDING -> EnumSet.of(WEBHOOK_ACTIVE, DISABLED);
        case WEBHOOK_ACTIVE -> EnumSet.of(DISABLED);
        };
    }

    public boolean canTransitionTo(DeliveryMode target) {
        return allowedTargets().contains(target);
    }

    public boolean isWebhook() {
        return this == WEBHOOK_PENDING || this == WEBHOOK_ACTIVE;
    }
}
