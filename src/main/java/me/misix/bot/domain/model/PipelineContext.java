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

import lombok.Getter;

import java.time.Instant;

/**
 * Per-update processing context.
 *
 * <p>
 * {@code degraded} is set when the user identity could not be resolved. In that
 * mode conversation memory and persistence are skipped and only a
 * conversational reply is produced.
 */
@Getter
public final class PipelineContext {

    private final InboundUpdate update;
    private final UserIdentity identity;
    private final boolean degraded;
    private final Instant deadline;
    private boolean deliveryFailed;

    private PipelineContext(InboundUpdate update, UserIdentity identity, boolean degraded, Instant deadline) {
        this.update = update;
        this.identity = identity;
        this.degraded = degraded;
        this.deadline = deadline;
    }

    public static PipelineContext resolved(InboundUpdate update, UserIdentity identity, Instant deadline) {
        return new PipelineContext(update, identity, false, deadline);
    }

    public static PipelineContext degraded(InboundUpdate update, Instant deadline) {
        return new PipelineContext(update, null, true, deadline);
    }

    /**
     * Internal owner id, {@code null} in degraded mode.
     */
    public String ownerId() {
        return identity != null ? identity.internalId() : null;
    }

    public void markDeliveryFailed() {
        this.deliveryFailed = true;
    }
}
