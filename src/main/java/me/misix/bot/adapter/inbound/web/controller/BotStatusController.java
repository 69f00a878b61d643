package me.misix.bot.adapter.inbound.web.controller;

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
import me.misix.bot.adapter.inbound.web.dto.BotStatusResponse;
import me.misix.bot.domain.delivery.DeliveryLifecycleManager;
import me.misix.bot.domain.model.PollingStats;
import me.misix.bot.domain.service.DeliveryHealth;
import me.misix.bot.port.outbound.LlmPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;

/**
 * Delivery mode, polling statistics and reply delivery health.
 */
@RestController
@RequestMapping("/bot")
@RequiredArgsConstructor
public class BotStatusController {

    private final DeliveryLifecycleManager deliveryLifecycleManager;
    private final LlmPort llmPort;
    private final DeliveryHealth deliveryHealth;

    @GetMapping("/status")
    public Mono<ResponseEntity<BotStatusResponse>> status() {
        PollingStats stats = deliveryLifecycleManager.getPollingStats();
        DeliveryHealth.Snapshot health = deliveryHealth.snapshot();
        BotStatusResponse response = BotStatusResponse.builder()
                .status("UP")
                .deliveryMode(deliveryLifecycleManager.getMode().name())
                .botUsername(deliveryLifecycleManager.getBotUsername())
                .llmProvider(llmPort.getProviderId())
                .llmAvailable(llmPort.isAvailable())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .polling(BotStatusResponse.PollingStatus.builder()
                        .running(stats.running())
                        .updatesReceived(stats.updatesReceived())
                        .errorsCount(stats.errorsCount())
                        .lastError(stats.lastError())
                        .startedAt(stats.startedAt())
                        .nextOffset(stats.nextOffset())
                        .build())
                .replies(BotStatusResponse.ReplyDeliveryStatus.builder()
                        .degraded(health.degraded())
                        .consecutiveFailures(health.consecutiveFailures())
                        .lastFailureKind(health.lastFailureKind() != null ? health.lastFailureKind().name() : null)
                        .lastFailureAt(health.lastFailureAt())
                        .build())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
