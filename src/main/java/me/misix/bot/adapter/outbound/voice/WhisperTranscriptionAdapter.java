package me.misix.bot.adapter.outbound.voice;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.infrastructure.config.BotProperties;
import me.misix.bot.port.outbound.VoiceTranscriptionPort;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Whisper-compatible speech-to-text adapter for voice message transcription.
 *
 * <p>
 * Posts the audio as multipart form data to
 * {@code <whisper-url>/v1/audio/transcriptions} and returns the {@code text}
 * field of the JSON response. Telegram voice notes (OGG/Opus) are sent as is.
 *
 * <p>
 * Available only when {@code bot.voice.enabled} is set and a Whisper URL is
 * configured.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhisperTranscriptionAdapter implements VoiceTranscriptionPort {

    private static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";

    private final OkHttpClient okHttpClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String transcribe(byte[] audio, String mimeType) {
        if (!isAvailable()) {
            throw new IllegalStateException("Voice transcription is not configured");
        }
        BotProperties.VoiceProperties voice = properties.getVoice();

        RequestBody fileBody = RequestBody.create(audio, MediaType.parse(mimeType));
        MultipartBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "voice" + extensionOf(mimeType), fileBody)
                .addFormDataPart("model", voice.getModel())
                .addFormDataPart("response_format", "json")
                .build();

        Request.Builder request = new Request.Builder()
                .url(endpoint(voice.getWhisperUrl()))
                .post(requestBody);
        if (voice.getApiKey() != null && !voice.getApiKey().isBlank()) {
            request.header("Authorization", "Bearer " + voice.getApiKey());
        }

        try (Response response = okHttpClient.newCall(request.build()).execute()) {
            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[Voice] Whisper API error {}: {}", response.code(), payload);
                throw new IllegalStateException("Whisper API error: HTTP " + response.code());
            }
            WhisperResponse whisperResponse = objectMapper.readValue(payload, WhisperResponse.class);
            return whisperResponse.getText() != null ? whisperResponse.getText().trim() : null;
        } catch (IOException e) {
            throw new TransientNetworkException("Whisper transcription failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        BotProperties.VoiceProperties voice = properties.getVoice();
        return voice.isEnabled() && voice.getWhisperUrl() != null && !voice.getWhisperUrl().isBlank();
    }

    static String endpoint(String whisperUrl) {
        String base = whisperUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.endsWith(TRANSCRIPTIONS_PATH) ? base : base + TRANSCRIPTIONS_PATH;
    }

    private static String extensionOf(String mimeType) {
        if (mimeType == null) {
            return ".ogg";
        }
        return switch (mimeType) {
        case "audio/mpeg" -> ".mp3";
        case "audio/wav", "audio/x-wav" -> ".wav";
        default -> ".ogg";
        };
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WhisperResponse {
        private String text;
    }
}
