package me.misix.bot.domain.delivery;

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
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.PollingStats;
import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.service.UpdateDispatcher;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.PlatformPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Long-polling consumer of {@code getUpdates} running on its own thread.
 *
 * <p>
 * The offset always points one past the highest update id seen, so Telegram
 * confirms everything already dispatched on the next call. Transient errors
 * are counted and retried after {@code bot.delivery.polling.retry-delay}; an
 * authentication failure or a 409 conflict ends the loop and is reported to
 * the {@code onAbnormalStop} callback.
 *
 * <p>
 * {@link #stopAndAwait(Duration)} returns only after the loop thread has
 * exited, so no update is dispatched by this loop afterwards.
 */
@Component
@Slf4j
public class PollingLoop {

    private static final Duration CANCEL_GRACE = Duration.ofSeconds(5);

    private final PlatformPort platformPort;
    private final UpdateDispatcher dispatcher;
    private final BotProperties properties;
    private final Clock clock;

    private final Object stateLock = new Object();
    private final AtomicLong nextOffset = new AtomicLong(0);
    private final AtomicLong updatesReceived = new AtomicLong(0);
    private final AtomicLong errorsCount = new AtomicLong(0);
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile String lastError;
    private volatile Instant startedAt;

    private ExecutorService executor;
    private Future<?> task;
    private CountDownLatch stopSignal;
    private CountDownLatch exited;
    private AtomicBoolean entered;

    public PollingLoop(PlatformPort platformPort, UpdateDispatcher dispatcher, BotProperties properties,
            Clock clock) {
        this.platformPort = platformPort;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts the loop thread.
     *
     * @param onAbnormalStop
     *            invoked on the loop thread with a reason when the loop ends by
     *            itself (auth failure, conflict); may be {@code null}
     * @throws IllegalStateException
     *             if the loop is already running
     */
    public void start(Consumer<String> onAbnormalStop) {
        synchronized (stateLock) {
            if (executor != null) {
                throw new IllegalStateException("Poll loop is already running");
            }
            CountDownLatch stop = new CountDownLatch(1);
            CountDownLatch exit = new CountDownLatch(1);
            AtomicBoolean loopEntered = new AtomicBoolean(false);
            stopSignal = stop;
            exited = exit;
            entered = loopEntered;
            startedAt = clock.instant();
            running.set(true);
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "telegram-poller");
                thread.setDaemon(true);
                return thread;
            });
            task = executor.submit(() -> runLoop(stop, exit, loopEntered, onAbnormalStop));
        }
        log.info("[Polling] started (offset={}, timeout={}s)", nextOffset.get(),
                properties.getDelivery().getPolling().getTimeoutSeconds());
    }

    private void runLoop(CountDownLatch stop, CountDownLatch exit, AtomicBoolean loopEntered,
            Consumer<String> onAbnormalStop) {
        loopEntered.set(true);
        BotProperties.PollingProperties polling = properties.getDelivery().getPolling();
        String abnormalReason = null;
        try {
            while (stop.getCount() > 0 && !Thread.currentThread().isInterrupted()) {
                try {
                    List<PlatformUpdate> updates = platformPort.getUpdates(nextOffset.get(), polling.getLimit(),
                            polling.getTimeoutSeconds());
                    for (PlatformUpdate update : updates) {
                        advanceOffset(update.updateId() + 1);
                        updatesReceived.incrementAndGet();
                        dispatch(update);
                    }
                } catch (PlatformAuthException | ModeConflictException e) {
                    abnormalReason = FailureClassifier.describe(e);
                    recordError(e);
                    log.error("[Polling] stopping: {}", abnormalReason);
                    break;
                } catch (RuntimeException e) { // NOSONAR - keep polling after transient errors
                    recordError(e);
                    log.warn("[Polling] getUpdates failed ({}), retrying in {}ms: {}",
                            FailureClassifier.classify(e), polling.getRetryDelay().toMillis(),
                            FailureClassifier.describe(e));
                    if (stop.await(polling.getRetryDelay().toMillis(), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Polling] interrupted");
        } finally {
            running.set(false);
            exit.countDown();
            log.info("[Polling] stopped (received={}, errors={})", updatesReceived.get(), errorsCount.get());
        }
        if (abnormalReason != null && onAbnormalStop != null) {
            onAbnormalStop.accept(abnormalReason);
        }
    }

    private void dispatch(PlatformUpdate update) {
        try {
            dispatcher.submit(update);
        } catch (RuntimeException e) { // NOSONAR - one bad update must not stop polling
            log.error("[Polling] failed to dispatch update {}: {}", update.updateId(), e.getMessage(), e);
        }
    }

    private void recordError(RuntimeException e) {
        errorsCount.incrementAndGet();
        lastError = FailureClassifier.describe(e);
    }

    /**
     * Signals the loop to stop and blocks until its thread has exited. An
     * in-flight long poll is given {@code timeout} to return before the thread
     * is interrupted.
     *
     * @throws IllegalStateException
     *             if the thread is still alive after the interrupt grace period
     */
    public void stopAndAwait(Duration timeout) {
        ExecutorService loopExecutor;
        Future<?> loopTask;
        CountDownLatch stop;
        CountDownLatch exit;
        AtomicBoolean loopEntered;
        synchronized (stateLock) {
            if (executor == null) {
                return;
            }
            loopExecutor = executor;
            loopTask = task;
            stop = stopSignal;
            exit = exited;
            loopEntered = entered;
        }

        stop.countDown();
        try {
            if (!exit.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Polling] loop did not stop within {}ms, interrupting", timeout.toMillis());
                boolean cancelledBeforeStart = loopTask.cancel(true) && !loopEntered.get();
                if (!cancelledBeforeStart && !exit.await(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new IllegalStateException("Poll loop thread did not exit");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while stopping poll loop", e);
        }

        loopExecutor.shutdown();
        running.set(false);
        synchronized (stateLock) {
            if (executor == loopExecutor) {
                executor = null;
                task = null;
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getNextOffset() {
        return nextOffset.get();
    }

    /**
     * Moves the offset forward; never backwards.
     */
    public void advanceOffset(long offset) {
        nextOffset.accumulateAndGet(offset, Math::max);
    }

    public PollingStats getStats() {
        return new PollingStats(running.get(), updatesReceived.get(), errorsCount.get(), lastError, startedAt,
                nextOffset.get());
    }
}
