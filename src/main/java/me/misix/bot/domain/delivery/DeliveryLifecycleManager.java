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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.ActivationResult;
import me.misix.bot.domain.model.DeliveryMode;
import me.misix.bot.domain.model.DeliveryModeChangedEvent;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.PollingStats;
import me.misix.bot.domain.model.WebhookStatus;
import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.service.UpdateDispatcher;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.PlatformPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the delivery mode of the bot: {@code DISABLED}, {@code POLLING},
 * {@code WEBHOOK_PENDING} or {@code WEBHOOK_ACTIVE}.
 *
 * <p>
 * Exactly one mode is active at a time. Every transition runs under one lock
 * and goes through {@code DISABLED}; leaving {@code POLLING} waits for the
 * poll loop thread to exit before anything else happens, so polling and the
 * webhook never deliver at the same time.
 *
 * <p>
 * Webhook activation:
 * <ol>
 * <li>reject unusable URLs (not https, loopback, placeholder) and poll
 * instead</li>
 * <li>enter {@code WEBHOOK_PENDING} and drain the pending backlog through
 * {@code getUpdates}, resubmitting every update to the pipeline</li>
 * <li>register the webhook with retries and verify it through
 * {@code getWebhookInfo}</li>
 * <li>enter {@code WEBHOOK_ACTIVE}, or fall back to polling if registration
 * failed</li>
 * </ol>
 *
 * <p>
 * Authentication failures are fatal and propagate to the caller.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class DeliveryLifecycleManager {

    private final PlatformPort platformPort;
    private final PollingLoop pollingLoop;
    private final UpdateDispatcher dispatcher;
    private final WebhookUrlValidator urlValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final BotProperties properties;

    private final ReentrantLock transitionLock = new ReentrantLock();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private volatile DeliveryMode mode = DeliveryMode.DISABLED;
    private volatile String botUsername;

    public DeliveryLifecycleManager(PlatformPort platformPort, PollingLoop pollingLoop, UpdateDispatcher dispatcher,
            WebhookUrlValidator urlValidator, ApplicationEventPublisher eventPublisher, BotProperties properties) {
        this.platformPort = platformPort;
        this.pollingLoop = pollingLoop;
        this.dispatcher = dispatcher;
        this.urlValidator = urlValidator;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    /**
     * Verifies the bot credentials and activates the configured mode.
     *
     * @throws PlatformAuthException
     *             if the token is rejected
     */
    public ActivationResult start() {
        botUsername = platformPort.verifyCredentials();
        log.info("[Delivery] authenticated as @{}", botUsername);
        return activate(selectMode(DeliveryConfig.from(properties)));
    }

    public DeliveryMode selectMode(DeliveryConfig config) {
        if (!config.hasWebhookUrl()) {
            log.info("[Delivery] no webhook URL configured, using long polling");
            return DeliveryMode.POLLING;
        }
        WebhookUrlValidator.Validation validation = urlValidator.validate(config.webhookUrl());
        if (!validation.valid()) {
            log.warn("[Delivery] webhook URL {} not usable ({}), using long polling", config.webhookUrl(),
                    validation.reason());
            return DeliveryMode.POLLING;
        }
        log.info("[Delivery] webhook URL {} configured, using webhook", config.webhookUrl());
        return DeliveryMode.WEBHOOK_PENDING;
    }

    /**
     * Switches to {@code requested}, deactivating the current mode first.
     *
     * @param requested
     *            {@code POLLING} or a webhook mode
     * @throws ModeConflictException
     *             while a backlog drain or another transition is in progress
     */
    public ActivationResult activate(DeliveryMode requested) {
        if (requested == null || requested == DeliveryMode.DISABLED) {
            throw new IllegalArgumentException("Cannot activate delivery mode " + requested);
        }
        if (draining.get()) {
            throw new ModeConflictException("Backlog drain in progress, retry after it completes");
        }
        if (!transitionLock.tryLock()) {
            throw new ModeConflictException("Another delivery mode transition is in progress");
        }
        try {
            if (mode != DeliveryMode.DISABLED) {
                deactivateLocked(false, "switching to " + requested);
            }
            if (requested == DeliveryMode.POLLING) {
                startPollingLocked("long polling requested");
                return new ActivationResult(requested, mode, 0, null);
            }
            return activateWebhookLocked(requested, DeliveryConfig.from(properties));
        } finally {
            transitionLock.unlock();
        }
    }

    private ActivationResult activateWebhookLocked(DeliveryMode requested, DeliveryConfig config) {
        WebhookUrlValidator.Validation validation = urlValidator.validate(config.webhookUrl());
        if (!validation.valid()) {
            log.warn("[Delivery] refusing to register webhook ({}), falling back to long polling",
                    validation.reason());
            startPollingLocked("invalid webhook URL");
            return new ActivationResult(requested, mode, 0, "invalid webhook URL: " + validation.reason());
        }

        transition(DeliveryMode.WEBHOOK_PENDING, "registering webhook " + config.webhookUrl());

        int drained = 0;
        try {
            drained = drainBacklogLocked(config);
        } catch (PlatformAuthException e) {
            transition(DeliveryMode.DISABLED, "authentication failed");
            throw e;
        } catch (RuntimeException e) { // NOSONAR - undrained updates stay pending for the webhook
            log.warn("[Delivery] backlog drain failed, pending updates will arrive via webhook: {}",
                    FailureClassifier.describe(e));
        }

        try {
            registerWebhookLocked(config);
        } catch (PlatformAuthException e) {
            transition(DeliveryMode.DISABLED, "authentication failed");
            throw e;
        } catch (RuntimeException e) { // NOSONAR - registration failure falls back to polling
            String reason = "webhook registration failed: " + FailureClassifier.describe(e);
            log.error("[Delivery] {}, falling back to long polling", reason);
            transition(DeliveryMode.DISABLED, reason);
            startPollingLocked("webhook fallback");
            return new ActivationResult(requested, mode, drained, reason);
        }

        transition(DeliveryMode.WEBHOOK_ACTIVE, "webhook registered and verified");
        return new ActivationResult(requested, mode, drained, null);
    }

    private void registerWebhookLocked(DeliveryConfig config) {
        int attempts = config.registrationAttempts();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                platformPort.setWebhook(config.webhookUrl(), config.secretToken(), config.maxConnections());
                verifyWebhook(config.webhookUrl());
                log.info("[Delivery] webhook registered: {} (max connections {})", config.webhookUrl(),
                        config.maxConnections());
                return;
            } catch (PlatformAuthException e) {
                throw e;
            } catch (RuntimeException e) { // NOSONAR - retried below
                lastFailure = e;
                log.warn("[Delivery] webhook registration attempt {}/{} failed: {}", attempt, attempts,
                        FailureClassifier.describe(e));
                if (attempt < attempts) {
                    sleepForRetry(config.registrationRetryDelay());
                }
            }
        }
        throw lastFailure;
    }

    private void verifyWebhook(String expectedUrl) {
        WebhookStatus status = platformPort.getWebhookInfo();
        if (status == null || !expectedUrl.equals(status.url())) {
            throw new TransientNetworkException("Webhook verification failed, registered URL is "
                    + (status != null ? status.url() : null));
        }
        if (status.lastErrorMessage() != null) {
            log.warn("[Delivery] webhook reports last error: {}", status.lastErrorMessage());
        }
        log.debug("[Delivery] webhook verified, {} pending update(s)", status.pendingUpdateCount());
    }

    /**
     * Pulls pending updates with {@code getUpdates} and resubmits them to the
     * pipeline. Only valid outside of active delivery.
     *
     * @return number of updates resubmitted
     * @throws ModeConflictException
     *             while polling or webhook delivery is active, or another
     *             transition holds the lock
     */
    public int drainBacklog() {
        DeliveryMode current = mode;
        if (current == DeliveryMode.POLLING || current == DeliveryMode.WEBHOOK_ACTIVE) {
            throw new ModeConflictException("Cannot drain backlog while " + current + " is active");
        }
        if (!transitionLock.tryLock()) {
            throw new ModeConflictException("Another delivery mode transition is in progress");
        }
        try {
            return drainBacklogLocked(DeliveryConfig.from(properties));
        } finally {
            transitionLock.unlock();
        }
    }

    private int drainBacklogLocked(DeliveryConfig config) {
        draining.set(true);
        try {
            // getUpdates is refused while a webhook is set; pending updates are kept
            platformPort.deleteWebhook(false);

            long offset = pollingLoop.getNextOffset();
            List<PlatformUpdate> backlog = platformPort.getUpdates(offset, config.backlogLimit(),
                    config.backlogTimeoutSeconds());
            if (backlog.isEmpty()) {
                log.info("[Delivery] no pending updates to drain");
                return 0;
            }

            long lastUpdateId = offset - 1;
            int resubmitted = 0;
            for (PlatformUpdate update : backlog) {
                lastUpdateId = Math.max(lastUpdateId, update.updateId());
                try {
                    if (dispatcher.submit(update)) {
                        resubmitted++;
                    }
                } catch (RuntimeException e) { // NOSONAR - one failed update must not abort the drain
                    log.warn("[Delivery] backlog update {} could not be resubmitted: {}", update.updateId(),
                            FailureClassifier.describe(e));
                }
            }

            platformPort.getUpdates(lastUpdateId + 1, 1, 0);
            pollingLoop.advanceOffset(lastUpdateId + 1);
            log.info("[Delivery] drained {} pending update(s), {} resubmitted", backlog.size(), resubmitted);
            return resubmitted;
        } finally {
            draining.set(false);
        }
    }

    public void deactivate() {
        deactivate(false);
    }

    /**
     * Stops the current mode and enters {@code DISABLED}.
     *
     * @param deregisterWebhook
     *            also delete the webhook registration
     */
    public void deactivate(boolean deregisterWebhook) {
        transitionLock.lock();
        try {
            deactivateLocked(deregisterWebhook, "deactivation requested");
        } finally {
            transitionLock.unlock();
        }
    }

    private void deactivateLocked(boolean deregisterWebhook, String reason) {
        DeliveryMode current = mode;
        if (current == DeliveryMode.POLLING) {
            pollingLoop.stopAndAwait(properties.getDelivery().getPolling().getStopTimeout());
        }
        if (current.isWebhook() && deregisterWebhook) {
            try {
                platformPort.deleteWebhook(false);
                log.info("[Delivery] webhook deregistered");
            } catch (RuntimeException e) { // NOSONAR - best effort on the way down
                log.warn("[Delivery] failed to deregister webhook: {}", FailureClassifier.describe(e));
            }
        }
        if (current != DeliveryMode.DISABLED) {
            transition(DeliveryMode.DISABLED, reason);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Delivery] shutting down");
        deactivate(properties.getDelivery().getWebhook().isDeregisterOnShutdown());
    }

    private void startPollingLocked(String reason) {
        try {
            platformPort.deleteWebhook(false);
        } catch (PlatformAuthException e) {
            throw e;
        } catch (RuntimeException e) { // NOSONAR - the loop reports a remaining webhook as conflict
            log.warn("[Delivery] could not clear webhook before polling: {}", FailureClassifier.describe(e));
        }
        transition(DeliveryMode.POLLING, reason);
        pollingLoop.start(this::onPollingTerminated);
    }

    void onPollingTerminated(String reason) {
        if (!transitionLock.tryLock()) {
            log.warn("[Delivery] poll loop ended ({}) during a transition, leaving state to it", reason);
            return;
        }
        try {
            if (mode == DeliveryMode.POLLING) {
                log.error("[Delivery] poll loop ended: {}", reason);
                deactivateLocked(false, "poll loop ended: " + reason);
            }
        } finally {
            transitionLock.unlock();
        }
    }

    private void transition(DeliveryMode target, String reason) {
        DeliveryMode from = mode;
        if (!from.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal delivery transition " + from + " -> " + target);
        }
        mode = target;
        log.info("[Delivery] {} -> {} ({})", from, target, reason);
        eventPublisher.publishEvent(new DeliveryModeChangedEvent(from, target, reason));
    }

    protected void sleepForRetry(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry webhook registration", e);
        }
    }

    public DeliveryMode getMode() {
        return mode;
    }

    public String getBotUsername() {
        return botUsername;
    }

    public PollingStats getPollingStats() {
        return pollingLoop.getStats();
    }
}
