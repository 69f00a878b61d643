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
import me.misix.bot.domain.extraction.ExtractionEngine;
import me.misix.bot.domain.model.FailureKind;
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.EntityResult;
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.IntentCandidate;
import me.misix.bot.domain.model.IntentKind;
import me.misix.bot.domain.model.PipelineContext;
import me.misix.bot.domain.model.PipelineOutcome;
import me.misix.bot.domain.model.UserIdentity;
import me.misix.bot.domain.model.exception.DuplicateUpdateException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.reminder.TaskReminderScheduler;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.infrastructure.i18n.MessageService;
import me.misix.bot.port.inbound.ChannelPort;
import me.misix.bot.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Processes one inbound update end to end and sends exactly one reply.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>deduplicate by update id</li>
 * <li>transcribe voice input, echoing the transcript</li>
 * <li>resolve the user identity; failure switches to degraded mode (no
 * context, no persistence, conversational reply only)</li>
 * <li>answer {@code /start} and {@code /help} directly</li>
 * <li>classify intents, extract all drafts concurrently, persist them one by
 * one in classification order</li>
 * <li>compose the reply, record the user turn, deliver, record the assistant
 * turn only when the user actually received it</li>
 * </ol>
 *
 * <p>
 * Every reply attempt feeds {@link DeliveryHealth}; a failed one marks the
 * {@link PipelineContext} so the outcome and the conversation memory reflect
 * it.
 *
 * <p>
 * The whole run is bounded by {@code bot.pipeline.update-budget}. When it
 * expires, pending extractions are cancelled and whatever was already
 * persisted is confirmed.
 *
 * <p>
 * Calls for one user must be serialized by the caller, see
 * {@link UserRunCoordinator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessagePipeline {

    private final UpdateDeduplicator deduplicator;
    private final UserDirectoryPort userDirectoryPort;
    private final ConversationContextStore contextStore;
    private final IntentClassifier intentClassifier;
    private final ExtractionEngine extractionEngine;
    private final EntityPersistenceGateway persistenceGateway;
    private final ResponseComposer responseComposer;
    private final CommandHandler commandHandler;
    private final VoiceInputService voiceInputService;
    private final ChannelPort channelPort;
    private final DeliveryHealth deliveryHealth;
    private final TaskReminderScheduler reminderScheduler;
    private final MessageService messageService;
    private final RetryPolicy retryPolicy;
    private final BotProperties properties;
    private final Clock clock;

    public PipelineOutcome process(InboundUpdate update) {
        try {
            deduplicator.register(update.updateId());
        } catch (DuplicateUpdateException e) {
            log.info("[Pipeline] update {} already processed, acknowledging", update.updateId());
            return PipelineOutcome.DUPLICATE;
        }

        Instant deadline = clock.instant().plus(properties.getPipeline().getUpdateBudget());
        long startMs = System.currentTimeMillis();

        InboundUpdate effective = update;
        if (update.isVoice()) {
            Optional<String> transcript = voiceInputService.transcribe(update);
            if (transcript.isEmpty()) {
                return deliver(update.chatId(), messageService.getMessage("voice.unavailable"), null);
            }
            deliverQuietly(update.chatId(), messageService.getMessage("voice.recognized", transcript.get()));
            effective = update.withText(transcript.get());
        }

        if (!effective.hasText()) {
            log.debug("[Pipeline] update {} has no text, skipping", update.updateId());
            return PipelineOutcome.SKIPPED;
        }

        PipelineContext context = resolveContext(effective, deadline);

        Optional<String> commandReply = commandHandler.handle(effective);
        if (commandReply.isPresent()) {
            return deliver(effective.chatId(), commandReply.get(), context);
        }

        String userId = context.ownerId();
        List<ConversationTurn> history = contextStore.read(userId);
        List<EntityResult> results = context.isDegraded()
                ? List.of()
                : routeAndPersist(context, effective.text(), history);

        String reply = responseComposer.compose(results, effective.text(), history, deadline);

        contextStore.append(userId, ConversationTurn.user(effective.text(), effective.timestamp()));
        deliver(effective.chatId(), reply, context);
        if (!context.isDeliveryFailed()) {
            contextStore.append(userId, ConversationTurn.assistant(reply, clock.instant()));
        }

        PipelineOutcome outcome = context.isDeliveryFailed()
                ? PipelineOutcome.DELIVERY_FAILED
                : PipelineOutcome.REPLIED;
        log.info("[Pipeline] update {} done in {}ms: {} entities persisted, degraded={}, outcome={}",
                update.updateId(), System.currentTimeMillis() - startMs,
                results.stream().filter(EntityResult::isPersisted).count(), context.isDegraded(), outcome);
        return outcome;
    }

    /**
     * Answers an update that was evicted from a full per-user queue instead of
     * being processed. The update id is registered, so a redelivery of the same
     * update is acknowledged without a second reply.
     */
    public PipelineOutcome rejectOverflow(InboundUpdate update) {
        try {
            deduplicator.register(update.updateId());
        } catch (DuplicateUpdateException e) {
            return PipelineOutcome.DUPLICATE;
        }
        log.warn("[Pipeline] update {} of sender {} evicted by queue limit, sending notice", update.updateId(),
                update.senderId());
        return deliver(update.chatId(), messageService.getMessage("reply.overloaded"), null);
    }

    private PipelineContext resolveContext(InboundUpdate update, Instant deadline) {
        try {
            UserIdentity identity = retryPolicy.call("resolve user", deadline,
                    () -> resolveOnce(update));
            return PipelineContext.resolved(update, identity, deadline);
        } catch (RuntimeException e) { // NOSONAR - identity failure degrades the update
            log.warn("[Pipeline] identity resolution FAILED for sender {} ({}), continuing degraded: {}",
                    update.senderId(), FailureClassifier.classify(e), FailureClassifier.describe(e));
            return PipelineContext.degraded(update, deadline);
        }
    }

    private UserIdentity resolveOnce(InboundUpdate update) {
        long timeoutMs = properties.getPipeline().getPersistenceTimeout().toMillis();
        CompletableFuture<UserIdentity> future = userDirectoryPort.resolveOrCreateUser(update.senderId(),
                update.profile());
        UserIdentity identity = await(future, timeoutMs, "resolve user " + update.senderId());
        if (identity == null || identity.internalId() == null) {
            throw new IllegalStateException("User directory returned no identity for " + update.senderId());
        }
        return identity;
    }

    List<EntityResult> routeAndPersist(PipelineContext context, String text, List<ConversationTurn> history) {
        List<IntentCandidate> candidates = intentClassifier.classify(text, history);

        Map<IntentKind, CompletableFuture<Optional<EntityDraft>>> extractions = new LinkedHashMap<>();
        for (IntentCandidate candidate : candidates) {
            if (extractionEngine.supports(candidate.kind())) {
                extractions.put(candidate.kind(), extractionEngine.extract(candidate.kind(), text, history));
            }
        }
        if (extractions.isEmpty()) {
            return List.of();
        }

        List<EntityResult> results = new ArrayList<>();
        for (Map.Entry<IntentKind, CompletableFuture<Optional<EntityDraft>>> entry : extractions.entrySet()) {
            Duration remaining = Duration.between(clock.instant(), context.getDeadline());
            if (remaining.isZero() || remaining.isNegative()) {
                log.warn("[Pipeline] update budget exhausted, abandoning remaining extractions");
                cancelAll(extractions);
                break;
            }
            Optional<EntityDraft> draft = awaitDraft(entry.getKey(), entry.getValue(), remaining);
            if (draft.isEmpty()) {
                continue;
            }
            EntityResult result = persistenceGateway.create(draft.get(), context.ownerId(), context.getDeadline());
            if (result.isPersisted()) {
                reminderScheduler.track(result.entity(), context.getUpdate().chatId());
            }
            results.add(result);
        }
        return results;
    }

    private Optional<EntityDraft> awaitDraft(IntentKind kind, CompletableFuture<Optional<EntityDraft>> future,
            Duration remaining) {
        try {
            Optional<EntityDraft> draft = future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
            return draft != null ? draft : Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Pipeline] extraction of {} did not finish within the update budget", kind);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("[Pipeline] extraction of {} failed: {}", kind, FailureClassifier.describe(e));
            return Optional.empty();
        }
    }

    private void cancelAll(Map<IntentKind, CompletableFuture<Optional<EntityDraft>>> extractions) {
        extractions.values().forEach(future -> future.cancel(true));
    }

    private PipelineOutcome deliver(String chatId, String text, PipelineContext context) {
        try {
            sendOnce(chatId, text);
            deliveryHealth.recordSuccess();
            return PipelineOutcome.REPLIED;
        } catch (RuntimeException e) { // NOSONAR - delivery failure is reported as outcome
            FailureKind kind = FailureClassifier.classify(e);
            deliveryHealth.recordFailure(kind);
            if (context != null) {
                context.markDeliveryFailed();
            }
            log.warn("[Pipeline] delivery to chat {} FAILED ({}): {}", chatId, kind, FailureClassifier.describe(e));
            return PipelineOutcome.DELIVERY_FAILED;
        }
    }

    private void deliverQuietly(String chatId, String text) {
        try {
            sendOnce(chatId, text);
        } catch (RuntimeException e) { // NOSONAR - echo is informational
            log.warn("[Pipeline] transcript echo to chat {} failed: {}", chatId, FailureClassifier.describe(e));
        }
    }

    private void sendOnce(String chatId, String text) {
        long timeoutMs = properties.getPipeline().getDeliveryTimeout().toMillis();
        await(channelPort.sendMessage(chatId, text), timeoutMs, "send to chat " + chatId);
    }

    private static <T> T await(CompletableFuture<T> future, long timeoutMs, String operation) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientNetworkException(operation + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientNetworkException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(operation + " failed: " + cause.getMessage(), cause);
        }
    }
}
