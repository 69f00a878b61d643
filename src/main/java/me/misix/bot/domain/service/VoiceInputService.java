package me.misix.bot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.port.outbound.PlatformPort;
import me.misix.bot.port.outbound.VoiceTranscriptionPort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a voice update into text: download from the platform, then
 * transcribe. Telegram voice notes are OGG/Opus.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoiceInputService {

    private static final String VOICE_MIME_TYPE = "audio/ogg";

    private final PlatformPort platformPort;
    private final VoiceTranscriptionPort transcriptionPort;

    public Optional<String> transcribe(InboundUpdate update) {
        if (!update.isVoice() || update.voiceFileId() == null) {
            return Optional.empty();
        }
        if (!transcriptionPort.isAvailable()) {
            log.info("[Voice] transcription not configured, skipping voice update {}", update.updateId());
            return Optional.empty();
        }
        try {
            byte[] audio = platformPort.downloadFile(update.voiceFileId());
            String transcript = transcriptionPort.transcribe(audio, VOICE_MIME_TYPE);
            if (transcript == null || transcript.isBlank()) {
                log.warn("[Voice] empty transcript for update {}", update.updateId());
                return Optional.empty();
            }
            log.info("[Voice] transcribed update {} ({} bytes -> {} chars)", update.updateId(), audio.length,
                    transcript.length());
            return Optional.of(transcript.trim());
        } catch (RuntimeException e) { // NOSONAR - voice failure degrades to a notice
            log.warn("[Voice] transcription FAILED for update {} ({}): {}", update.updateId(),
                    FailureClassifier.classify(e), FailureClassifier.describe(e));
            return Optional.empty();
        }
    }
}
