package me.misix.bot.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotStatusResponse {

    private String status;
    private String deliveryMode;
    private String botUsername;
    private String llmProvider;
    private boolean llmAvailable;
    private long uptimeMs;
    private PollingStatus polling;
    private ReplyDeliveryStatus replies;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PollingStatus {
        private boolean running;
        private long updatesReceived;
        private long errorsCount;
        private String lastError;
        private Instant startedAt;
        private long nextOffset;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReplyDeliveryStatus {
        private boolean degraded;
        private int consecutiveFailures;
        private String lastFailureKind;
        private Instant lastFailureAt;
    }
}
