package me.misix.bot.adapter.inbound.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.misix.bot.adapter.inbound.telegram.TelegramUpdateMapper;
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.UpdateReceivedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramWebhookControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String UPDATE_JSON = """
            {"update_id":100,"message":{"message_id":1,"date":1772359200,
             "chat":{"id":42,"type":"private"},
             "from":{"id":42,"is_bot":false,"first_name":"Иван"},
             "text":"привет"}}
            """;

    private WebhookSecretVerifier secretVerifier;
    private TelegramUpdateMapper updateMapper;
    private ApplicationEventPublisher eventPublisher;
    private TelegramWebhookController controller;

    @BeforeEach
    void setUp() {
        secretVerifier = mock(WebhookSecretVerifier.class);
        updateMapper = mock(TelegramUpdateMapper.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        controller = new TelegramWebhookController(secretVerifier, updateMapper, eventPublisher, new ObjectMapper(),
                Clock.fixed(NOW, ZoneId.of("Europe/Moscow")));

        when(secretVerifier.verify(any())).thenReturn(true);
    }

    @Test
    void shouldAcceptValidUpdate() {
        PlatformUpdate mapped = new PlatformUpdate(100, InboundUpdate.builder()
                .updateId(100).senderId("42").chatId("42").text("привет").build());
        when(updateMapper.map(any(Update.class))).thenReturn(mapped);

        ResponseEntity<Map<String, Object>> response = controller.receive(body(UPDATE_JSON), new HttpHeaders())
                .block();

        assertNotNull(response);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("ok"));
        ArgumentCaptor<UpdateReceivedEvent> captor = ArgumentCaptor.forClass(UpdateReceivedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(mapped, captor.getValue().update());
        assertEquals(NOW, captor.getValue().timestamp());
    }

    @Test
    void shouldRejectWrongSecret() {
        when(secretVerifier.verify(any())).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = controller.receive(body(UPDATE_JSON), new HttpHeaders())
                .block();

        assertNotNull(response);
        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void shouldRejectMalformedJson() {
        ResponseEntity<Map<String, Object>> response = controller.receive(body("{not json"), new HttpHeaders())
                .block();

        assertNotNull(response);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    void shouldRejectEmptyBody() {
        ResponseEntity<Map<String, Object>> response = controller.receive(new byte[0], new HttpHeaders()).block();

        assertNotNull(response);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void shouldRejectUpdateWithoutId() {
        ResponseEntity<Map<String, Object>> response = controller.receive(body("{\"message\":null}"),
                new HttpHeaders()).block();

        assertNotNull(response);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void shouldAcknowledgeEvenWhenHandOverFails() {
        when(updateMapper.map(any(Update.class))).thenThrow(new IllegalStateException("mapper broke"));

        ResponseEntity<Map<String, Object>> response = controller.receive(body(UPDATE_JSON), new HttpHeaders())
                .block();

        assertNotNull(response);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(eventPublisher, never()).publishEvent(any());
    }

    private static byte[] body(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
