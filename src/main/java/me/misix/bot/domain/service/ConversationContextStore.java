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

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.TurnRole;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.ConversationMirrorPort;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded per-user conversation memory.
 *
 * <p>
 * The in-memory window is authoritative. Every append is mirrored to durable
 * storage on a best-effort basis: a failed mirror write only logs a warning.
 * Mirror writes of one user are chained, so the durable log keeps the append
 * order even though each write completes asynchronously. Windows are
 * partitioned per user, so concurrent tasks of different users never contend
 * on the same window.
 *
 * <p>
 * A {@code null} user id (degraded mode) turns both operations into no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextStore {

    private final ConversationMirrorPort mirrorPort;
    private final BotProperties properties;

    private static final long FLUSH_TIMEOUT_SECONDS = 10;

    private final Map<String, Deque<ConversationTurn>> windows = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> mirrorTails = new ConcurrentHashMap<>();

    public void append(String userId, ConversationTurn turn) {
        if (userId == null) {
            return;
        }
        Objects.requireNonNull(turn, "turn");

        int windowSize = Math.max(1, properties.getPipeline().getContextWindow());
        Deque<ConversationTurn> window = windows.computeIfAbsent(userId, key -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(turn);
            while (window.size() > windowSize) {
                window.removeFirst();
            }
        }
        mirror(userId, turn);
    }

    /**
     * Oldest first. Unknown users get an empty list.
     */
    public List<ConversationTurn> read(String userId) {
        if (userId == null) {
            return List.of();
        }
        Deque<ConversationTurn> window = windows.get(userId);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    /**
     * Renders turns as {@code User: ...} / {@code Assistant: ...} lines for
     * prompts.
     */
    public static String formatForPrompt(List<ConversationTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (ConversationTurn turn : turns) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(turn.role() == TurnRole.USER ? "User: " : "Assistant: ").append(turn.text());
        }
        return builder.toString();
    }

    /**
     * Waits for every pending mirror write. Called on shutdown.
     */
    @PreDestroy
    public void flushMirror() {
        CompletableFuture<?>[] pending = mirrorTails.values().toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return;
        }
        try {
            CompletableFuture.allOf(pending).get(FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Context] interrupted while flushing {} mirror write chain(s)", pending.length);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Context] mirror flush incomplete: {}", e.getMessage());
        }
    }

    private void mirror(String userId, ConversationTurn turn) {
        CompletableFuture<Void> tail = mirrorTails.compute(userId, (key, previous) -> {
            CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
            return start.thenCompose(ignored -> writeMirror(userId, turn));
        });
        tail.whenComplete((ignored, error) -> mirrorTails.remove(userId, tail));
    }

    // Never completes exceptionally, so one failed write does not break the chain.
    private CompletableFuture<Void> writeMirror(String userId, ConversationTurn turn) {
        CompletableFuture<Void> write;
        try {
            write = mirrorPort.mirror(userId, turn);
        } catch (RuntimeException e) { // NOSONAR - mirror is best effort
            log.warn("[Context] durable mirror write failed for user {}: {}", userId, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return write.handle((ignored, error) -> {
            if (error != null) {
                log.warn("[Context] durable mirror write failed for user {}: {}", userId, error.getMessage());
            }
            return null;
        });
    }
}
