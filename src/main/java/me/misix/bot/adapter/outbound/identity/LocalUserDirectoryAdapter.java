package me.misix.bot.adapter.outbound.identity;

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
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.UserIdentity;
import me.misix.bot.domain.model.UserProfileHints;
import me.misix.bot.port.outbound.StoragePort;
import me.misix.bot.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * User directory backed by {@code users/<platformUserId>.json} records.
 *
 * <p>
 * Resolution is idempotent: the first call for a platform user creates a
 * record with a fresh internal id, later calls return the same identity.
 * Resolved identities are cached in memory.
 */
@Component
@Slf4j
public class LocalUserDirectoryAdapter implements UserDirectoryPort {

    static final String DIRECTORY = "users";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, UserIdentity> cache = new ConcurrentHashMap<>();

    public LocalUserDirectoryAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<UserIdentity> resolveOrCreateUser(String platformUserId, UserProfileHints hints) {
        if (platformUserId == null || !SAFE_ID.matcher(platformUserId).matches()) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Invalid platform user id: " + platformUserId));
        }
        UserIdentity cached = cache.get(platformUserId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        String path = platformUserId + ".json";
        return storagePort.getText(DIRECTORY, path).thenCompose(existing -> {
            if (existing != null) {
                UserRecord stored = read(existing);
                return CompletableFuture.completedFuture(remember(
                        new UserIdentity(stored.internalId(), platformUserId)));
            }
            UserProfileHints profile = hints != null ? hints : UserProfileHints.empty();
            UserRecord created = new UserRecord(UUID.randomUUID().toString(), platformUserId,
                    profile.username(), profile.firstName(), profile.lastName(), profile.languageCode(),
                    clock.instant());
            return storagePort.putTextAtomic(DIRECTORY, path, write(created))
                    .thenApply(ignored -> {
                        log.info("[Users] Registered user {} as {}", platformUserId, created.internalId());
                        return remember(new UserIdentity(created.internalId(), platformUserId));
                    });
        });
    }

    private UserIdentity remember(UserIdentity identity) {
        UserIdentity previous = cache.putIfAbsent(identity.platformUserId(), identity);
        return previous != null ? previous : identity;
    }

    private UserRecord read(String json) {
        try {
            return objectMapper.readValue(json, UserRecord.class);
        } catch (JsonProcessingException e) {
            throw new CompletionException(new IllegalStateException("Corrupted user record", e));
        }
    }

    private String write(UserRecord userRecord) {
        try {
            return objectMapper.writeValueAsString(userRecord);
        } catch (JsonProcessingException e) {
            throw new CompletionException(new IllegalStateException("Failed to serialize user record", e));
        }
    }

    record UserRecord(String internalId, String platformUserId, String username, String firstName,
            String lastName, String languageCode, Instant createdAt) {
    }
}
