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
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.port.outbound.ConversationMirrorPort;
import me.misix.bot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Appends every conversation turn as one JSON line to
 * {@code conversations/<userId>.jsonl}.
 */
@Component
@RequiredArgsConstructor
public class LocalConversationMirrorAdapter implements ConversationMirrorPort {

    static final String DIRECTORY = "conversations";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    @Override
    public CompletableFuture<Void> mirror(String userId, ConversationTurn turn) {
        String line;
        try {
            line = objectMapper.writeValueAsString(turn) + "\n";
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Failed to serialize turn", e));
        }
        return storagePort.appendText(DIRECTORY, StoragePaths.safeSegment(userId) + ".jsonl", line);
    }
}
