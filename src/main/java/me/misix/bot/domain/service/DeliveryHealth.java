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

import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.FailureKind;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Outbound channel health as seen by reply delivery.
 *
 * <p>
 * The channel counts as degraded after
 * {@code bot.pipeline.delivery-degraded-after} consecutive failed replies and
 * recovers on the next successful one.
 */
@Service
@Slf4j
public class DeliveryHealth {

    private final int degradedAfter;
    private final Clock clock;

    private int consecutiveFailures;
    private FailureKind lastFailureKind;
    private Instant lastFailureAt;

    public DeliveryHealth(BotProperties properties, Clock clock) {
        this.degradedAfter = Math.max(1, properties.getPipeline().getDeliveryDegradedAfter());
        this.clock = clock;
    }

    public synchronized void recordSuccess() {
        if (consecutiveFailures >= degradedAfter) {
            log.info("[Delivery] reply channel recovered after {} failed replies", consecutiveFailures);
        }
        consecutiveFailures = 0;
    }

    public synchronized void recordFailure(FailureKind kind) {
        consecutiveFailures++;
        lastFailureKind = kind;
        lastFailureAt = clock.instant();
        if (consecutiveFailures == degradedAfter) {
            log.warn("[Delivery] reply channel DEGRADED: {} consecutive failed replies, last {}",
                    consecutiveFailures, kind);
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(consecutiveFailures >= degradedAfter, consecutiveFailures, lastFailureKind,
                lastFailureAt);
    }

    public record Snapshot(boolean degraded, int consecutiveFailures, FailureKind lastFailureKind,
            Instant lastFailureAt) {
    }
}
