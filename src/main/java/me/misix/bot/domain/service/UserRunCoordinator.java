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
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs {@link MessagePipeline} with at most one update in flight per user.
 *
 * <p>
 * Updates of one sender are processed strictly in arrival order; different
 * senders run concurrently on the shared pipeline executor. While a run is in
 * progress further updates of the same sender are queued. The queue is
 * bounded: beyond the limit the oldest queued update is evicted and answered
 * through {@link MessagePipeline#rejectOverflow} instead of being processed.
 * A runner with nothing left to do retires itself and is removed from the map.
 */
@Service
@Slf4j
public class UserRunCoordinator {

    private final MessagePipeline messagePipeline;
    private final ExecutorService pipelineExecutor;
    private final int maxQueuedUpdates;

    private final Map<String, UserRunner> runners = new ConcurrentHashMap<>();

    public UserRunCoordinator(MessagePipeline messagePipeline, ExecutorService pipelineExecutor,
            BotProperties properties) {
        this.messagePipeline = messagePipeline;
        this.pipelineExecutor = pipelineExecutor;
        this.maxQueuedUpdates = Math.max(1, properties.getPipeline().getMaxQueuedUpdatesPerUser());
    }

    public void enqueue(InboundUpdate update) {
        Objects.requireNonNull(update, "update");
        while (true) {
            UserRunner runner = runners.computeIfAbsent(update.senderId(), UserRunner::new);
            if (runner.offer(update)) {
                return;
            }
        }
    }

    int activeRunnerCount() {
        return runners.size();
    }

    private final class UserRunner {

        private final String senderId;
        private final Object lock = new Object();
        private final Deque<InboundUpdate> queued = new ArrayDeque<>();

        private boolean running;
        private boolean retired;

        private UserRunner(String senderId) {
            this.senderId = senderId;
        }

        /**
         * @return {@code false} if this runner retired concurrently and the
         *         caller must look up a fresh one
         */
        boolean offer(InboundUpdate update) {
            InboundUpdate evicted = null;
            boolean start = false;
            synchronized (lock) {
                if (retired) {
                    return false;
                }
                if (running) {
                    evicted = enqueueWithBound(update);
                } else {
                    running = true;
                    start = true;
                }
            }
            if (start) {
                startRun(update);
            }
            if (evicted != null) {
                answerEvicted(evicted);
            }
            return true;
        }

        /**
         * @return the evicted oldest update, or {@code null} when there was room
         */
        private InboundUpdate enqueueWithBound(InboundUpdate update) {
            InboundUpdate evicted = null;
            if (queued.size() >= maxQueuedUpdates) {
                evicted = queued.removeFirst();
                log.warn("[Coordinator] queue limit reached ({}), evicted update {} of sender {}",
                        maxQueuedUpdates, evicted.updateId(), senderId);
            }
            queued.addLast(update);
            return evicted;
        }

        private void answerEvicted(InboundUpdate evicted) {
            try {
                pipelineExecutor.submit(() -> {
                    try {
                        messagePipeline.rejectOverflow(evicted);
                    } catch (Exception e) { // NOSONAR - must not kill executor thread
                        log.error("[Coordinator] overflow notice failed for update {} of sender {}: {}",
                                evicted.updateId(), senderId, e.getMessage(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("[Coordinator] executor rejected overflow notice for update {} of sender {}",
                        evicted.updateId(), senderId);
            }
        }

        private void startRun(InboundUpdate update) {
            try {
                pipelineExecutor.submit(() -> {
                    try {
                        messagePipeline.process(update);
                    } catch (Exception e) { // NOSONAR - must not kill executor thread
                        log.error("[Coordinator] run failed for update {} of sender {}: {}",
                                update.updateId(), senderId, e.getMessage(), e);
                    } finally {
                        onRunComplete();
                    }
                });
            } catch (RejectedExecutionException e) {
                log.warn("[Coordinator] executor rejected update {} of sender {}, dropping {} queued update(s)",
                        update.updateId(), senderId, queuedCount());
                synchronized (lock) {
                    queued.clear();
                    retireLocked();
                }
            }
        }

        private void onRunComplete() {
            InboundUpdate next;
            synchronized (lock) {
                next = queued.pollFirst();
                if (next == null) {
                    retireLocked();
                    return;
                }
            }
            startRun(next);
        }

        private void retireLocked() {
            running = false;
            retired = true;
            if (runners.remove(senderId, this)) {
                log.debug("[Coordinator] evicted idle runner of sender {}", senderId);
            }
        }

        private int queuedCount() {
            synchronized (lock) {
                return queued.size();
            }
        }
    }
}
