package me.misix.bot.adapter.inbound.telegram;

import me.misix.bot.domain.model.exception.TransientNetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterRetryTest {

    private static final String CHAT_ID = "123";

    private TelegramAdapter adapter;
    private TelegramClient telegramClient;

    @BeforeEach
    void setUp() {
        telegramClient = mock(TelegramClient.class);
        adapter = spy(new TelegramAdapter(telegramClient));
        doNothing().when(adapter).sleepForRetry(anyInt());
    }

    // ===== executeWithRetry =====

    @Test
    void shouldRetryOn429AndSucceedOnSecondAttempt() throws Exception {
        TelegramApiRequestException rateLimitEx = createRateLimitException(5);
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(rateLimitEx)
                .thenReturn(mock(Message.class));

        adapter.sendMessage(CHAT_ID, "Привет").get();

        verify(telegramClient, times(2)).execute(any(SendMessage.class));
        verify(adapter).sleepForRetry(5);
    }

    @Test
    void shouldCapRetryAfter() throws Exception {
        TelegramApiRequestException rateLimitEx = createRateLimitException(120);
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(rateLimitEx)
                .thenReturn(mock(Message.class));

        adapter.sendMessage(CHAT_ID, "Привет").get();

        verify(adapter).sleepForRetry(30);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() throws Exception {
        TelegramApiRequestException rateLimitEx = createRateLimitException(1);
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(rateLimitEx);

        CompletableFuture<Void> future = adapter.sendMessage(CHAT_ID, "Привет");
        ExecutionException ex = assertThrows(ExecutionException.class, future::get);

        assertInstanceOf(TransientNetworkException.class, ex.getCause());
        // 1 initial + 3 retries = 4 total attempts
        verify(telegramClient, times(4)).execute(any(SendMessage.class));
        verify(adapter, times(3)).sleepForRetry(1);
    }

    @Test
    void shouldNotRetryBadRequest() throws Exception {
        TelegramApiRequestException badRequestEx = mock(TelegramApiRequestException.class);
        when(badRequestEx.getErrorCode()).thenReturn(400);
        when(badRequestEx.getMessage()).thenReturn("Bad Request: chat not found");
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(badRequestEx);

        CompletableFuture<Void> future = adapter.sendMessage(CHAT_ID, "Привет");
        ExecutionException ex = assertThrows(ExecutionException.class, future::get);

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        verify(telegramClient, times(1)).execute(any(SendMessage.class));
        verify(adapter, never()).sleepForRetry(anyInt());
    }

    @Test
    void shouldRetryNetworkErrors() throws Exception {
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(new TelegramApiException("Connection reset"))
                .thenReturn(mock(Message.class));

        adapter.sendMessage(CHAT_ID, "Привет").get();

        verify(telegramClient, times(2)).execute(any(SendMessage.class));
        verify(adapter).sleepForRetry(1);
    }

    @Test
    void shouldReadRetryAfterFromMessageWhenParametersMissing() {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(429);
        when(ex.getMessage()).thenReturn("[429] Too Many Requests: retry after 7");

        assertEquals(7, adapter.extractRetryAfterSeconds(ex));
    }

    @Test
    void shouldUseDefaultRetryAfterWhenUnknown() {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(429);

        assertEquals(5, adapter.extractRetryAfterSeconds(ex));
    }

    // ===== Message splitting =====

    @Test
    void shouldSendLongTextInChunks() throws Exception {
        String paragraph = "а".repeat(3000);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));

        adapter.sendMessage(CHAT_ID, paragraph + "\n\n" + paragraph).get();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, times(2)).execute(captor.capture());
        List<SendMessage> sent = captor.getAllValues();
        assertEquals(paragraph, sent.get(0).getText());
        assertEquals(paragraph, sent.get(1).getText());
        assertEquals(CHAT_ID, sent.get(0).getChatId());
    }

    @Test
    void shouldSplitAtLineBreakWhenNoParagraph() {
        String line = "б".repeat(60);
        String text = line + "\n" + line;

        List<String> chunks = TelegramAdapter.splitAtNewlines(text, 100);

        assertEquals(List.of(line, line), chunks);
    }

    @Test
    void shouldHardSplitWithoutBreaks() {
        List<String> chunks = TelegramAdapter.splitAtNewlines("x".repeat(250), 100);

        assertEquals(3, chunks.size());
        assertEquals(100, chunks.get(0).length());
        assertEquals(50, chunks.get(2).length());
    }

    @Test
    void shouldKeepShortTextWhole() {
        assertEquals(List.of("hi"), TelegramAdapter.splitAtNewlines("hi", 100));
    }

    private TelegramApiRequestException createRateLimitException(int retryAfterSeconds) {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(429);
        when(ex.getMessage()).thenReturn("[429] Too Many Requests: retry after " + retryAfterSeconds);
        ResponseParameters params = new ResponseParameters(null, retryAfterSeconds);
        when(ex.getParameters()).thenReturn(params);
        return ex;
    }
}
