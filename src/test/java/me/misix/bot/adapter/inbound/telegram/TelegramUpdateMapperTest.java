package me.misix.bot.adapter.inbound.telegram;

import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.InputChannel;
import me.misix.bot.domain.model.PlatformUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelegramUpdateMapperTest {

    private TelegramUpdateMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new TelegramUpdateMapper();
    }

    @Test
    void shouldMapTextMessage() {
        Message message = createMessage(42L, 100L);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn("Купил кофе за 300");

        PlatformUpdate result = mapper.map(createUpdate(7, message));

        assertEquals(7, result.updateId());
        assertTrue(result.hasMessage());
        InboundUpdate inbound = result.message();
        assertEquals("42", inbound.senderId());
        assertEquals("100", inbound.chatId());
        assertEquals("Купил кофе за 300", inbound.text());
        assertEquals(InputChannel.TEXT, inbound.channel());
        assertEquals(Instant.ofEpochSecond(1772359200L), inbound.timestamp());
        assertEquals("ivan", inbound.profile().username());
        assertEquals("Иван", inbound.profile().firstName());
        assertEquals("ru", inbound.profile().languageCode());
    }

    @Test
    void shouldMapVoiceMessage() {
        Message message = createMessage(42L, 100L);
        when(message.hasText()).thenReturn(false);
        when(message.hasVoice()).thenReturn(true);
        when(message.getVoice().getFileId()).thenReturn("voice-file-1");

        PlatformUpdate result = mapper.map(createUpdate(8, message));

        InboundUpdate inbound = result.message();
        assertEquals(InputChannel.VOICE, inbound.channel());
        assertEquals("voice-file-1", inbound.voiceFileId());
        assertNull(inbound.text());
    }

    @Test
    void shouldIgnoreUpdateWithoutMessage() {
        Update update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(9);
        when(update.hasMessage()).thenReturn(false);

        PlatformUpdate result = mapper.map(update);

        assertEquals(9, result.updateId());
        assertFalse(result.hasMessage());
    }

    @Test
    void shouldIgnoreMessageWithoutSender() {
        Message message = mock(Message.class);
        when(message.getFrom()).thenReturn(null);

        PlatformUpdate result = mapper.map(createUpdate(10, message));

        assertFalse(result.hasMessage());
    }

    @Test
    void shouldIgnoreUnsupportedContent() {
        Message message = createMessage(42L, 100L);
        when(message.hasText()).thenReturn(false);
        when(message.hasVoice()).thenReturn(false);

        PlatformUpdate result = mapper.map(createUpdate(11, message));

        assertEquals(11, result.updateId());
        assertFalse(result.hasMessage());
    }

    private Update createUpdate(int updateId, Message message) {
        Update update = mock(Update.class);
        when(update.getUpdateId()).thenReturn(updateId);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    private Message createMessage(long userId, long chatId) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);
        when(user.getUserName()).thenReturn("ivan");
        when(user.getFirstName()).thenReturn("Иван");
        when(user.getLanguageCode()).thenReturn("ru");

        Message message = mock(Message.class, RETURNS_DEEP_STUBS);
        when(message.getFrom()).thenReturn(user);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getDate()).thenReturn(1772359200);
        return message;
    }
}
