package me.misix.bot.adapter.outbound.telegram;

import me.misix.bot.adapter.inbound.telegram.TelegramUpdateMapper;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.WebhookStatus;
import me.misix.bot.domain.model.exception.ModeConflictException;
import me.misix.bot.domain.model.exception.PlatformAuthException;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.updates.DeleteWebhook;
import org.telegram.telegrambots.meta.api.methods.updates.GetUpdates;
import org.telegram.telegrambots.meta.api.methods.updates.GetWebhookInfo;
import org.telegram.telegrambots.meta.api.methods.updates.SetWebhook;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.WebhookInfo;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramPlatformAdapterTest {

    private TelegramClient telegramClient;
    private TelegramUpdateMapper updateMapper;
    private TelegramPlatformAdapter adapter;

    @BeforeEach
    void setUp() {
        telegramClient = mock(TelegramClient.class);
        updateMapper = mock(TelegramUpdateMapper.class);
        adapter = new TelegramPlatformAdapter(telegramClient, updateMapper);
    }

    @Test
    void shouldReturnBotUsername() throws Exception {
        User me = mock(User.class);
        when(me.getUserName()).thenReturn("misix_bot");
        when(telegramClient.execute(any(GetMe.class))).thenReturn(me);

        assertEquals("misix_bot", adapter.verifyCredentials());
    }

    @Test
    void shouldMapUnauthorizedToAuthFailure() throws Exception {
        when(telegramClient.execute(any(GetMe.class))).thenThrow(requestException(401, "Unauthorized"));

        assertThrows(PlatformAuthException.class, () -> adapter.verifyCredentials());
    }

    @Test
    void shouldMapConflictOnGetUpdates() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class)))
                .thenThrow(requestException(409, "Conflict: can't use getUpdates method while webhook is active"));

        assertThrows(ModeConflictException.class, () -> adapter.getUpdates(0, 100, 30));
    }

    @Test
    void shouldMapServerErrorToTransient() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class))).thenThrow(requestException(502, "Bad Gateway"));

        assertThrows(TransientNetworkException.class, () -> adapter.getUpdates(0, 100, 30));
    }

    @Test
    void shouldMapNetworkErrorToTransient() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class))).thenThrow(new TelegramApiException("timeout"));

        assertThrows(TransientNetworkException.class, () -> adapter.getUpdates(0, 100, 30));
    }

    @Test
    void shouldMapUpdatesAndPassOffset() throws Exception {
        Update update = mock(Update.class);
        PlatformUpdate mapped = PlatformUpdate.ignored(15);
        when(updateMapper.map(update)).thenReturn(mapped);
        when(telegramClient.execute(any(GetUpdates.class))).thenReturn(new ArrayList<>(List.of(update)));

        List<PlatformUpdate> result = adapter.getUpdates(15, 50, 25);

        assertEquals(List.of(mapped), result);
        ArgumentCaptor<GetUpdates> captor = ArgumentCaptor.forClass(GetUpdates.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals(15, captor.getValue().getOffset());
        assertEquals(50, captor.getValue().getLimit());
        assertEquals(25, captor.getValue().getTimeout());
    }

    @Test
    void shouldReturnEmptyListWhenNoUpdates() throws Exception {
        when(telegramClient.execute(any(GetUpdates.class))).thenReturn(new ArrayList<>());

        assertTrue(adapter.getUpdates(0, 100, 30).isEmpty());
    }

    @Test
    void shouldSendWebhookRegistration() throws Exception {
        when(telegramClient.execute(any(SetWebhook.class))).thenReturn(true);

        adapter.setWebhook("https://bot.misix.app/bot/webhook", "s3cr3t", 40);

        ArgumentCaptor<SetWebhook> captor = ArgumentCaptor.forClass(SetWebhook.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("https://bot.misix.app/bot/webhook", captor.getValue().getUrl());
        assertEquals("s3cr3t", captor.getValue().getSecretToken());
        assertEquals(40, captor.getValue().getMaxConnections());
    }

    @Test
    void shouldFailWhenWebhookNotAccepted() throws Exception {
        when(telegramClient.execute(any(SetWebhook.class))).thenReturn(false);

        assertThrows(TransientNetworkException.class,
                () -> adapter.setWebhook("https://bot.misix.app/bot/webhook", null, 40));
    }

    @Test
    void shouldKeepPendingUpdatesWhenDeletingWebhook() throws Exception {
        when(telegramClient.execute(any(DeleteWebhook.class))).thenReturn(true);

        adapter.deleteWebhook(false);

        ArgumentCaptor<DeleteWebhook> captor = ArgumentCaptor.forClass(DeleteWebhook.class);
        verify(telegramClient).execute(captor.capture());
        assertFalse(captor.getValue().getDropPendingUpdates());
    }

    @Test
    void shouldReadWebhookInfo() throws Exception {
        WebhookInfo info = mock(WebhookInfo.class);
        when(info.getUrl()).thenReturn("https://bot.misix.app/bot/webhook");
        when(info.getPendingUpdatesCount()).thenReturn(4);
        when(info.getLastErrorMessage()).thenReturn("Connection timed out");
        when(telegramClient.execute(any(GetWebhookInfo.class))).thenReturn(info);

        WebhookStatus status = adapter.getWebhookInfo();

        assertEquals("https://bot.misix.app/bot/webhook", status.url());
        assertEquals(4, status.pendingUpdateCount());
        assertEquals("Connection timed out", status.lastErrorMessage());
        assertTrue(status.isRegistered());
    }

    @Test
    void shouldCarryRetryAfterOnRateLimit() {
        TelegramApiRequestException ex = requestException(429, "Too Many Requests: retry after 12");
        when(ex.getParameters()).thenReturn(new ResponseParameters(null, 12));

        RuntimeException translated = TelegramApiErrors.translate("sendMessage", ex);

        assertTrue(translated instanceof TransientNetworkException);
        assertEquals(12, ((TransientNetworkException) translated).getRetryAfterSeconds());
    }

    @Test
    void shouldTreatClientErrorAsPermanent() {
        RuntimeException translated = TelegramApiErrors.translate("sendMessage",
                requestException(400, "Bad Request: chat not found"));

        assertTrue(translated instanceof IllegalStateException);
    }

    private static TelegramApiRequestException requestException(int code, String response) {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(code);
        when(ex.getApiResponse()).thenReturn(response);
        when(ex.getMessage()).thenReturn("[" + code + "] " + response);
        return ex;
    }
}
