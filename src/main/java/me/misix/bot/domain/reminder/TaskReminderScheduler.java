package me.misix.bot.domain.reminder;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.PersistedEntity;
import me.misix.bot.domain.model.TaskDraft;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.infrastructure.i18n.MessageService;
import me.misix.bot.port.inbound.ChannelPort;
import me.misix.bot.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends deadline reminders for persisted tasks.
 *
 * <p>
 * Every task with a deadline gets up to two messages: one
 * {@code bot.reminders.lead-time} before the deadline and one when it is
 * reached. A deadline missed by more than {@code bot.reminders.grace-period}
 * (for example while the bot was down) is dropped silently. Pending reminders
 * survive restarts in {@code reminders/pending.json}.
 *
 * <p>
 * Ticks run on a single daemon thread every
 * {@code bot.reminders.check-interval}; a tick that finds the previous one
 * still running is skipped. A failed send is retried on the next tick.
 */
@Component
@Slf4j
public class TaskReminderScheduler {

    static final String DIRECTORY = "reminders";
    static final String FILE = "pending.json";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
    private static final long STORAGE_TIMEOUT_SECONDS = 5;

    private final StoragePort storagePort;
    private final ChannelPort channelPort;
    private final MessageService messageService;
    private final ObjectMapper objectMapper;
    private final BotProperties.ReminderProperties settings;
    private final Duration sendTimeout;
    private final Clock clock;

    private final Map<String, PendingReminder> pending = new LinkedHashMap<>();
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public TaskReminderScheduler(StoragePort storagePort, ChannelPort channelPort, MessageService messageService,
            ObjectMapper objectMapper, BotProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.channelPort = channelPort;
        this.messageService = messageService;
        this.objectMapper = objectMapper;
        this.settings = properties.getReminders();
        this.sendTimeout = properties.getPipeline().getDeliveryTimeout();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Reminders] Task reminders disabled");
            return;
        }
        load();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-reminders");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(1000, settings.getCheckInterval().toMillis());
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Reminders] Started with check interval {}ms, {} pending", intervalMs, pendingCount());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Starts tracking a freshly persisted task. Entities other than tasks, and
     * tasks without a deadline or with one already past, are ignored.
     */
    public void track(PersistedEntity entity, String chatId) {
        if (!settings.isEnabled() || !(entity.draft() instanceof TaskDraft task) || task.deadline() == null) {
            return;
        }
        Instant now = clock.instant();
        if (task.deadline().isBefore(now)) {
            log.debug("[Reminders] Task {} deadline already passed, not tracked", entity.id());
            return;
        }
        boolean tooCloseForLead = !task.deadline().minus(settings.getLeadTime()).isAfter(now);
        PendingReminder reminder = new PendingReminder(entity.id(), entity.ownerId(), chatId, task.title(),
                task.deadline(), tooCloseForLead);
        synchronized (pending) {
            pending.put(reminder.taskId(), reminder);
            persistLocked();
        }
        log.info("[Reminders] Tracking task {} due {}", entity.id(), task.deadline());
    }

    int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Reminders] Tick skipped: previous check still in progress");
            return;
        }
        try {
            List<PendingReminder> snapshot;
            synchronized (pending) {
                snapshot = new ArrayList<>(pending.values());
            }
            Instant now = clock.instant();
            boolean changed = false;
            for (PendingReminder reminder : snapshot) {
                changed |= process(reminder, now);
            }
            if (changed) {
                synchronized (pending) {
                    persistLocked();
                }
            }
        } catch (Exception e) { // NOSONAR - must not kill the scheduler thread
            log.error("[Reminders] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private boolean process(PendingReminder reminder, Instant now) {
        if (now.isAfter(reminder.deadline().plus(settings.getGracePeriod()))) {
            log.info("[Reminders] Task {} deadline missed, dropping reminder", reminder.taskId());
            return remove(reminder);
        }
        if (!now.isBefore(reminder.deadline())) {
            if (send(reminder, messageService.getMessage("reminder.deadline", reminder.title()))) {
                return remove(reminder);
            }
            return false;
        }
        if (!reminder.leadSent() && !now.isBefore(reminder.deadline().minus(settings.getLeadTime()))) {
            String at = TIME_FORMAT.format(reminder.deadline().atZone(clock.getZone()));
            if (send(reminder, messageService.getMessage("reminder.lead", reminder.title(), at))) {
                synchronized (pending) {
                    pending.replace(reminder.taskId(), reminder, reminder.withLeadSent());
                }
                return true;
            }
        }
        return false;
    }

    private boolean remove(PendingReminder reminder) {
        synchronized (pending) {
            return pending.remove(reminder.taskId(), reminder);
        }
    }

    private boolean send(PendingReminder reminder, String text) {
        try {
            channelPort.sendMessage(reminder.chatId(), text).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[Reminders] Sent reminder for task {} to chat {}", reminder.taskId(), reminder.chatId());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reminders] Interrupted while sending reminder for task {}", reminder.taskId());
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Reminders] Failed to send reminder for task {}, retrying next tick: {}",
                    reminder.taskId(), FailureClassifier.describe(e));
            return false;
        }
    }

    private void load() {
        try {
            String json = storagePort.getText(DIRECTORY, FILE).get(STORAGE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (json == null || json.isBlank()) {
                return;
            }
            List<PendingReminder> stored = objectMapper.readValue(json, new TypeReference<List<PendingReminder>>() {
            });
            synchronized (pending) {
                stored.forEach(reminder -> pending.put(reminder.taskId(), reminder));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reminders] Interrupted while loading pending reminders");
        } catch (ExecutionException | TimeoutException | JsonProcessingException e) {
            log.warn("[Reminders] Failed to load pending reminders, starting empty: {}", e.getMessage());
        }
    }

    private void persistLocked() {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(pending.values()));
            storagePort.putTextAtomic(DIRECTORY, FILE, json).get(STORAGE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Reminders] Interrupted while saving pending reminders");
        } catch (ExecutionException | TimeoutException | JsonProcessingException e) {
            log.warn("[Reminders] Failed to save pending reminders: {}", e.getMessage());
        }
    }
}
