package me.misix.bot.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.Objects;

/**
 * One user message received from the chat platform.
 *
 * <p>
 * {@code updateId} is assigned by the platform and is unique per bot, which
 * makes it the deduplication key. Voice updates arrive without text and carry
 * {@code voiceFileId}; after transcription a copy with the transcript is made
 * via {@link #withText(String)}.
 */
@Builder(toBuilder = true)
public record InboundUpdate(
        long updateId,
        String senderId,
        String chatId,
        String text,
        Instant timestamp,
        InputChannel channel,
        String voiceFileId,
        UserProfileHints profile) {

    public InboundUpdate {
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(chatId, "chatId");
        channel = channel != null ? channel : InputChannel.TEXT;
        timestamp = timestamp != null ? timestamp : Instant.EPOCH;
        profile = profile != null ? profile : UserProfileHints.empty();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean isVoice() {
        return channel == InputChannel.VOICE;
    }

    public InboundUpdate withText(String transcript) {
        return toBuilder().text(transcript).build();
    }
}
