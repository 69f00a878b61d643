package me.misix.bot.adapter.outbound.persistence;

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
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.PersistedEntity;
import me.misix.bot.port.outbound.EntityStorePort;
import me.misix.bot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Stores entity drafts as JSON documents under
 * {@code entities/<owner>/<collection>/<id>.json}.
 *
 * <p>
 * Each document carries the generated id, owner, kind and creation time next
 * to the draft fields. Writes go through {@link StoragePort#putTextAtomic} so a
 * crash never leaves a half-written entity behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalEntityStoreAdapter implements EntityStorePort {

    static final String DIRECTORY = "entities";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public CompletableFuture<PersistedEntity> save(EntityDraft draft, String ownerId) {
        String id = UUID.randomUUID().toString();
        Instant createdAt = clock.instant();
        String path = StoragePaths.safeSegment(ownerId) + "/" + draft.collection() + "/" + id + ".json";

        String json;
        try {
            json = objectMapper.writeValueAsString(toDocument(draft, id, ownerId, createdAt));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Failed to serialize " + draft.kind() + " draft", e));
        }

        return storagePort.putTextAtomic(DIRECTORY, path, json)
                .thenApply(ignored -> {
                    log.debug("[EntityStore] Saved {} {} for owner {}", draft.kind(), id, ownerId);
                    return new PersistedEntity(draft, id, ownerId, createdAt);
                });
    }

    private Map<String, Object> toDocument(EntityDraft draft, String id, String ownerId, Instant createdAt) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", id);
        document.put("ownerId", ownerId);
        document.put("kind", draft.kind().name());
        document.put("createdAt", createdAt);
        document.put("data", draft);
        return document;
    }
}
