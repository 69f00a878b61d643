package me.misix.bot.domain.service;

import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.InputChannel;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.port.outbound.PlatformPort;
import me.misix.bot.port.outbound.VoiceTranscriptionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VoiceInputServiceTest {

    private static final byte[] AUDIO = { 1, 2, 3 };

    private PlatformPort platformPort;
    private VoiceTranscriptionPort transcriptionPort;
    private VoiceInputService service;

    @BeforeEach
    void setUp() {
        platformPort = mock(PlatformPort.class);
        transcriptionPort = mock(VoiceTranscriptionPort.class);
        when(transcriptionPort.isAvailable()).thenReturn(true);
        service = new VoiceInputService(platformPort, transcriptionPort);
    }

    private static InboundUpdate voice() {
        return InboundUpdate.builder()
                .updateId(7)
                .senderId("100")
                .chatId("100")
                .channel(InputChannel.VOICE)
                .voiceFileId("file-1")
                .build();
    }

    @Test
    void shouldDownloadAndTranscribe() {
        when(platformPort.downloadFile("file-1")).thenReturn(AUDIO);
        when(transcriptionPort.transcribe(AUDIO, "audio/ogg")).thenReturn(" потратил 300 на кофе ");

        assertEquals(Optional.of("потратил 300 на кофе"), service.transcribe(voice()));
    }

    @Test
    void shouldSkipTextUpdates() {
        InboundUpdate text = InboundUpdate.builder().updateId(1).senderId("1").chatId("1").text("hi").build();

        assertTrue(service.transcribe(text).isEmpty());
        verify(platformPort, never()).downloadFile(anyString());
    }

    @Test
    void shouldReturnEmptyWhenTranscriptionUnavailable() {
        when(transcriptionPort.isAvailable()).thenReturn(false);

        assertTrue(service.transcribe(voice()).isEmpty());
        verify(platformPort, never()).downloadFile(anyString());
    }

    @Test
    void shouldReturnEmptyOnDownloadFailure() {
        when(platformPort.downloadFile("file-1")).thenThrow(new TransientNetworkException("timeout"));

        assertTrue(service.transcribe(voice()).isEmpty());
        verify(transcriptionPort, never()).transcribe(any(), anyString());
    }

    @Test
    void shouldReturnEmptyOnBlankTranscript() {
        when(platformPort.downloadFile("file-1")).thenReturn(AUDIO);
        when(transcriptionPort.transcribe(AUDIO, "audio/ogg")).thenReturn("  ");

        assertTrue(service.transcribe(voice()).isEmpty());
    }
}
