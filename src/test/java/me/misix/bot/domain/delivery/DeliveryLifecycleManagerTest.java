package me.misix.bot.domain.delivery;

import me.misix.bot.domain.model.ActivationResult;
import me.misix.bot.domain.model.DeliveryMode;
import me.misix.bot.domain.model.DeliveryModeChangedEvent;
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.WebhookStatus;
import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.service.UpdateDispatcher;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.PlatformPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeliveryLifecycleManagerTest {

    private static final String WEBHOOK_URL = "https://bot.misix.app/bot/webhook";
    private static final String SECRET = "s3cr3t";

    private PlatformPort platformPort;
    private PollingLoop pollingLoop;
    private UpdateDispatcher dispatcher;
    private ApplicationEventPublisher eventPublisher;
    private BotProperties properties;
    private DeliveryLifecycleManager manager;

    @BeforeEach
    void setUp() {
        platformPort = mock(PlatformPort.class);
        pollingLoop = mock(PollingLoop.class);
        dispatcher = mock(UpdateDispatcher.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        properties = new BotProperties();
        properties.getDelivery().getWebhook().setSecretToken(SECRET);

        when(platformPort.verifyCredentials()).thenReturn("misix_bot");
        when(platformPort.getUpdates(anyLong(), anyInt(), anyInt())).thenReturn(List.of());
        when(platformPort.getWebhookInfo()).thenReturn(new WebhookStatus(WEBHOOK_URL, 0, null));
        when(pollingLoop.getNextOffset()).thenReturn(0L);
        when(dispatcher.submit(any())).thenReturn(true);

        manager = spy(new DeliveryLifecycleManager(platformPort, pollingLoop, dispatcher,
                new WebhookUrlValidator(), eventPublisher, properties));
        doNothing().when(manager).sleepForRetry(any());
    }

    // ==================== Mode selection ====================

    @Test
    void shouldPollWhenNoWebhookUrlConfigured() {
        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.POLLING, result.mode());
        assertEquals(DeliveryMode.POLLING, manager.getMode());
        assertEquals("misix_bot", manager.getBotUsername());
        verify(pollingLoop).start(any());
        verify(platformPort, never()).setWebhook(anyString(), any(), anyInt());
    }

    @Test
    void shouldPollWhenWebhookUrlIsLoopback() {
        properties.getDelivery().getWebhook().setUrl("https://127.0.0.1:8443/bot/webhook");

        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.POLLING, result.mode());
        verify(pollingLoop).start(any());
        verify(platformPort, never()).setWebhook(anyString(), any(), anyInt());
    }

    @Test
    void shouldFallBackToPollingWhenWebhookRequestedWithUnusableUrl() {
        properties.getDelivery().getWebhook().setUrl("http://bot.misix.app/bot/webhook");

        ActivationResult result = manager.activate(DeliveryMode.WEBHOOK_PENDING);

        assertEquals(DeliveryMode.POLLING, result.mode());
        assertTrue(result.isFallback());
        verify(platformPort, never()).setWebhook(anyString(), any(), anyInt());
    }

    @Test
    void shouldPropagateAuthFailureOnStart() {
        when(platformPort.verifyCredentials()).thenThrow(new PlatformAuthException("Unauthorized"));

        assertThrows(PlatformAuthException.class, () -> manager.start());

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(pollingLoop, never()).start(any());
    }

    @Test
    void shouldRejectDisabledAsActivationTarget() {
        assertThrows(IllegalArgumentException.class, () -> manager.activate(DeliveryMode.DISABLED));
        assertThrows(IllegalArgumentException.class, () -> manager.activate(null));
    }

    // ==================== Webhook activation ====================

    @Test
    void shouldDrainBacklogBeforeRegisteringWebhook() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        PlatformUpdate first = update(7);
        PlatformUpdate second = update(8);
        when(platformPort.getUpdates(0L, 100, 10)).thenReturn(List.of(first, second));

        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, result.mode());
        assertEquals(2, result.backlogDrained());
        assertFalse(result.isFallback());
        InOrder order = inOrder(platformPort, dispatcher, pollingLoop);
        order.verify(platformPort).deleteWebhook(false);
        order.verify(platformPort).getUpdates(0L, 100, 10);
        order.verify(dispatcher).submit(first);
        order.verify(dispatcher).submit(second);
        order.verify(platformPort).getUpdates(9L, 1, 0);
        order.verify(pollingLoop).advanceOffset(9L);
        order.verify(platformPort).setWebhook(WEBHOOK_URL, SECRET, 40);
        order.verify(platformPort).getWebhookInfo();
        verify(pollingLoop, never()).start(any());
    }

    @Test
    void shouldPublishTransitionEvents() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);

        manager.start();

        ArgumentCaptor<DeliveryModeChangedEvent> captor = ArgumentCaptor.forClass(DeliveryModeChangedEvent.class);
        verify(eventPublisher, times(2)).publishEvent(captor.capture());
        List<DeliveryModeChangedEvent> events = captor.getAllValues();
        assertEquals(DeliveryMode.DISABLED, events.get(0).from());
        assertEquals(DeliveryMode.WEBHOOK_PENDING, events.get(0).to());
        assertEquals(DeliveryMode.WEBHOOK_PENDING, events.get(1).from());
        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, events.get(1).to());
    }

    @Test
    void shouldStopPollingBeforeRegisteringWebhook() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        manager.activate(DeliveryMode.POLLING);

        ActivationResult result = manager.activate(DeliveryMode.WEBHOOK_PENDING);

        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, result.mode());
        InOrder order = inOrder(pollingLoop, platformPort);
        order.verify(pollingLoop).start(any());
        order.verify(pollingLoop).stopAndAwait(Duration.ofSeconds(45));
        order.verify(platformPort).setWebhook(WEBHOOK_URL, SECRET, 40);
    }

    @Test
    void shouldContinueDrainWhenOneUpdateFails() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        PlatformUpdate broken = update(3);
        PlatformUpdate good = update(4);
        when(platformPort.getUpdates(0L, 100, 10)).thenReturn(List.of(broken, good));
        doThrow(new IllegalStateException("queue closed")).when(dispatcher).submit(broken);

        ActivationResult result = manager.start();

        assertEquals(1, result.backlogDrained());
        verify(dispatcher).submit(good);
        verify(pollingLoop).advanceOffset(5L);
        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, manager.getMode());
    }

    @Test
    void shouldRegisterWebhookEvenWhenDrainFails() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        when(platformPort.getUpdates(0L, 100, 10)).thenThrow(new TransientNetworkException("timeout"));

        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, result.mode());
        assertEquals(0, result.backlogDrained());
    }

    @Test
    void shouldRetryRegistrationUntilVerified() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        when(platformPort.getWebhookInfo())
                .thenReturn(new WebhookStatus("", 0, null))
                .thenReturn(new WebhookStatus(WEBHOOK_URL, 3, null));

        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, result.mode());
        verify(platformPort, times(2)).setWebhook(WEBHOOK_URL, SECRET, 40);
        verify(manager).sleepForRetry(Duration.ofSeconds(2));
    }

    @Test
    void shouldFallBackToPollingWhenRegistrationFails() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        doThrow(new TransientNetworkException("connection refused"))
                .when(platformPort).setWebhook(anyString(), any(), anyInt());

        ActivationResult result = manager.start();

        assertEquals(DeliveryMode.WEBHOOK_PENDING, result.requested());
        assertEquals(DeliveryMode.POLLING, result.mode());
        assertTrue(result.isFallback());
        assertTrue(result.fallbackReason().contains("connection refused"));
        verify(platformPort, times(3)).setWebhook(WEBHOOK_URL, SECRET, 40);
        verify(manager, times(2)).sleepForRetry(any());
        verify(pollingLoop).start(any());
    }

    @Test
    void shouldDisableWhenRegistrationIsUnauthorized() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        doThrow(new PlatformAuthException("Unauthorized"))
                .when(platformPort).setWebhook(anyString(), any(), anyInt());

        assertThrows(PlatformAuthException.class, () -> manager.activate(DeliveryMode.WEBHOOK_PENDING));

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(platformPort, times(1)).setWebhook(anyString(), any(), anyInt());
        verify(pollingLoop, never()).start(any());
    }

    // ==================== Conflicts ====================

    @Test
    void shouldRefuseTransitionWhileDraining() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        PlatformUpdate update = update(1);
        when(platformPort.getUpdates(0L, 100, 10)).thenReturn(List.of(update));
        AtomicReference<Throwable> nested = new AtomicReference<>();
        doAnswer(invocation -> {
            try {
                manager.activate(DeliveryMode.POLLING);
            } catch (RuntimeException e) {
                nested.set(e);
            }
            return true;
        }).when(dispatcher).submit(update);

        manager.start();

        assertInstanceOf(ModeConflictException.class, nested.get());
        assertEquals(DeliveryMode.WEBHOOK_ACTIVE, manager.getMode());
    }

    @Test
    void shouldRefuseBacklogDrainWhileDeliveryIsActive() {
        manager.activate(DeliveryMode.POLLING);

        assertThrows(ModeConflictException.class, () -> manager.drainBacklog());
    }

    @Test
    void shouldDrainBacklogWhenDisabled() {
        when(platformPort.getUpdates(0L, 100, 10)).thenReturn(List.of(update(20)));

        int drained = manager.drainBacklog();

        assertEquals(1, drained);
        verify(pollingLoop).advanceOffset(21L);
        assertEquals(DeliveryMode.DISABLED, manager.getMode());
    }

    // ==================== Deactivation ====================

    @Test
    void shouldDisableWhenPollLoopEnds() {
        manager.activate(DeliveryMode.POLLING);

        manager.onPollingTerminated("Conflict: terminated by other getUpdates request");

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(pollingLoop).stopAndAwait(any());
    }

    @Test
    void shouldIgnorePollLoopEndWhenNotPolling() {
        manager.onPollingTerminated("late");

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void shouldDeregisterWebhookOnShutdownWhenConfigured() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        properties.getDelivery().getWebhook().setDeregisterOnShutdown(true);
        manager.start();

        manager.shutdown();

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(platformPort, times(2)).deleteWebhook(false);
    }

    @Test
    void shouldKeepWebhookOnShutdownByDefault() {
        properties.getDelivery().getWebhook().setUrl(WEBHOOK_URL);
        manager.start();

        manager.shutdown();

        assertEquals(DeliveryMode.DISABLED, manager.getMode());
        verify(platformPort, times(1)).deleteWebhook(anyBoolean());
    }

    @Test
    void shouldExposeNoUsernameBeforeStart() {
        assertNull(manager.getBotUsername());
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
