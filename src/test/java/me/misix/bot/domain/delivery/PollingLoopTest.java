package me.misix.bot.domain.delivery;

import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.PollingStats;
import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.service.UpdateDispatcher;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.PlatformPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PollingLoopTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(2);

    private PlatformPort platformPort;
    private UpdateDispatcher dispatcher;
    private PollingLoop loop;

    @BeforeEach
    void setUp() {
        platformPort = mock(PlatformPort.class);
        dispatcher = mock(UpdateDispatcher.class);
        BotProperties properties = new BotProperties();
        properties.getDelivery().getPolling().setTimeoutSeconds(1);
        properties.getDelivery().getPolling().setRetryDelay(Duration.ofMillis(10));
        loop = new PollingLoop(platformPort, dispatcher, properties,
                Clock.fixed(NOW, ZoneId.of("Europe/Moscow")));
    }

    @AfterEach
    void tearDown() {
        loop.stopAndAwait(STOP_TIMEOUT);
    }

    @Test
    void shouldDispatchUpdatesAndAdvanceOffset() {
        PlatformUpdate first = update(10);
        PlatformUpdate second = update(11);
        AtomicInteger calls = new AtomicInteger();
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenAnswer(invocation -> {
            if (calls.getAndIncrement() == 0) {
                return List.of(first, second);
            }
            Thread.sleep(10);
            return List.of();
        });

        loop.start(null);

        verify(dispatcher, timeout(2000)).submit(first);
        verify(dispatcher, timeout(2000)).submit(second);
        verify(platformPort, timeout(2000).atLeastOnce()).getUpdates(eq(12L), eq(100), eq(1));

        loop.stopAndAwait(STOP_TIMEOUT);

        assertFalse(loop.isRunning());
        assertEquals(12, loop.getNextOffset());
        PollingStats stats = loop.getStats();
        assertEquals(2, stats.updatesReceived());
        assertEquals(NOW, stats.startedAt());
    }

    @Test
    void shouldStopOnAuthFailureAndReportReason() throws Exception {
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt()))
                .thenThrow(new PlatformAuthException("Unauthorized"));
        CompletableFuture<String> reason = new CompletableFuture<>();

        loop.start(reason::complete);

        String reported = reason.get(2, TimeUnit.SECONDS);
        assertTrue(reported.contains("Unauthorized"));
        assertFalse(loop.isRunning());
        assertEquals(1, loop.getStats().errorsCount());
    }

    @Test
    void shouldStopOnConflict() throws Exception {
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt()))
                .thenThrow(new ModeConflictException("terminated by other getUpdates request"));
        CompletableFuture<String> reason = new CompletableFuture<>();

        loop.start(reason::complete);

        assertNotNull(reason.get(2, TimeUnit.SECONDS));
        assertFalse(loop.isRunning());
    }

    @Test
    void shouldKeepPollingAfterTransientError() {
        PlatformUpdate update = update(5);
        AtomicInteger calls = new AtomicInteger();
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenAnswer(invocation -> {
            int call = calls.getAndIncrement();
            if (call == 0) {
                throw new TransientNetworkException("connection reset");
            }
            if (call == 1) {
                return List.of(update);
            }
            Thread.sleep(10);
            return List.of();
        });

        loop.start(null);

        verify(dispatcher, timeout(2000)).submit(update);
        PollingStats stats = loop.getStats();
        assertEquals(1, stats.errorsCount());
        assertNotNull(stats.lastError());
        assertTrue(loop.isRunning());
    }

    @Test
    void shouldKeepPollingWhenDispatchFails() {
        PlatformUpdate broken = update(1);
        PlatformUpdate next = update(2);
        AtomicInteger calls = new AtomicInteger();
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenAnswer(invocation -> {
            if (calls.getAndIncrement() == 0) {
                return List.of(broken, next);
            }
            Thread.sleep(10);
            return List.of();
        });
        doThrow(new IllegalStateException("boom")).when(dispatcher).submit(broken);

        loop.start(null);

        verify(dispatcher, timeout(2000)).submit(next);
        verify(platformPort, timeout(2000).atLeastOnce()).getUpdates(eq(3L), anyInt(), anyInt());
    }

    @Test
    void shouldRejectSecondStart() {
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(10);
            return List.of();
        });
        loop.start(null);

        assertThrows(IllegalStateException.class, () -> loop.start(null));
    }

    @Test
    void shouldRestartAfterStop() {
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(10);
            return List.of();
        });
        loop.start(null);
        loop.stopAndAwait(STOP_TIMEOUT);

        loop.start(null);

        assertTrue(loop.isRunning());
        verify(platformPort, timeout(2000).atLeastOnce()).getUpdates(anyLong(), anyInt(), anyInt());
    }

    @Test
    void shouldNeverMoveOffsetBackwards() {
        loop.advanceOffset(20);
        loop.advanceOffset(15);

        assertEquals(20, loop.getNextOffset());
    }

    @Test
    void shouldIgnoreStopWhenNotStarted() {
        loop.stopAndAwait(STOP_TIMEOUT);

        assertFalse(loop.isRunning());
        verifyNoInteractions(platformPort);
    }

    private static PlatformUpdate update(long id) {
        return new PlatformUpdate(id, InboundUpdate.builder()
                .updateId(id)
                .senderId("42")
                .chatId("42")
                .text("msg " + id)
                .build());
    }
}
