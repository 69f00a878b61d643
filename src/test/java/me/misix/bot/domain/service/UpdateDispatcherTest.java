package me.misix.bot.domain.service;

import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.UpdateReceivedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class UpdateDispatcherTest {

    private UserRunCoordinator coordinator;
    private UpdateDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        coordinator = mock(UserRunCoordinator.class);
        dispatcher = new UpdateDispatcher(coordinator);
    }

    @Test
    void shouldEnqueueMessages() {
        InboundUpdate message = InboundUpdate.builder().updateId(1).senderId("1").chatId("1").text("hi").build();

        assertTrue(dispatcher.submit(new PlatformUpdate(1, message)));

        verify(coordinator).enqueue(message);
    }

    @Test
    void shouldAcknowledgeUpdatesWithoutMessage() {
        assertFalse(dispatcher.submit(PlatformUpdate.ignored(2)));
        assertFalse(dispatcher.submit(null));

        verify(coordinator, never()).enqueue(any());
    }

    @Test
    void shouldHandleReceivedEvents() {
        InboundUpdate message = InboundUpdate.builder().updateId(3).senderId("1").chatId("1").text("hi").build();

        dispatcher.onUpdateReceived(new UpdateReceivedEvent(new PlatformUpdate(3, message), Instant.now()));

        verify(coordinator).enqueue(message);
    }
}
