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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.EntityResult;
import me.misix.bot.domain.model.FailureKind;
import me.misix.bot.domain.model.PersistedEntity;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.EntityStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Persists one entity draft per call. Each call is independent, so a failure
 * for one entity never affects another entity of the same update.
 *
 * <p>
 * Transient store failures are retried through {@link RetryPolicy}; every
 * other failure is reported in the returned {@link EntityResult}. Never
 * throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityPersistenceGateway {

    private final EntityStorePort storePort;
    private final RetryPolicy retryPolicy;
    private final BotProperties properties;
    private final Clock clock;

    public EntityResult create(EntityDraft draft, String ownerId) {
        return create(draft, ownerId, null);
    }

    /**
     * @param deadline
     *            optional update deadline; neither attempts nor backoffs run
     *            past it
     */
    public EntityResult create(EntityDraft draft, String ownerId, Instant deadline) {
        if (ownerId == null) {
            log.warn("[Persistence] {} dropped: no owner", draft.kind());
            return EntityResult.failed(draft.kind(), FailureKind.VALIDATION, "owner is required");
        }
        try {
            draft.validate();
        } catch (RuntimeException e) { // NOSONAR - invalid drafts are reported, not thrown
            log.warn("[Persistence] {} draft rejected: {}", draft.kind(), e.getMessage());
            return EntityResult.failed(draft.kind(), FailureClassifier.classify(e), e.getMessage());
        }

        try {
            PersistedEntity entity = retryPolicy.call("save " + draft.collection(), deadline,
                    () -> saveOnce(draft, ownerId, deadline));
            log.info("[Persistence] {} saved as {}/{}", draft.kind(), draft.collection(), entity.id());
            return EntityResult.persisted(entity);
        } catch (RuntimeException e) { // NOSONAR - per-entity isolation
            FailureKind failure = FailureClassifier.classify(e);
            log.warn("[Persistence] {} NOT saved ({}): {}", draft.kind(), failure, FailureClassifier.describe(e));
            return EntityResult.failed(draft.kind(), failure, FailureClassifier.describe(e));
        }
    }

    private PersistedEntity saveOnce(EntityDraft draft, String ownerId, Instant deadline) {
        long timeoutMs = attemptTimeout(deadline).toMillis();
        if (timeoutMs <= 0) {
            throw new TransientNetworkException("Update budget exhausted before saving " + draft.kind());
        }
        CompletableFuture<PersistedEntity> future = storePort.save(draft, ownerId);
        try {
            PersistedEntity entity = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (entity == null) {
                throw new IllegalStateException("Store returned no entity for " + draft.kind());
            }
            return entity;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientNetworkException("Store save timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientNetworkException("Interrupted while saving " + draft.kind(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private Duration attemptTimeout(Instant deadline) {
        Duration timeout = properties.getPipeline().getPersistenceTimeout();
        if (deadline == null) {
            return timeout;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.compareTo(timeout) < 0 ? remaining : timeout;
    }
}
