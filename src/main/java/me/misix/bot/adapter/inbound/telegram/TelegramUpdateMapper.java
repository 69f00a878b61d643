package me.misix.bot.adapter.inbound.telegram;

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

import lombok.extern.slf4j.Slf4j;
import me.misix.bot.domain.model.InboundUpdate;
import me.misix.bot.domain.model.InputChannel;
import me.misix.bot.domain.model.PlatformUpdate;
import me.misix.bot.domain.model.UserProfileHints;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;

import java.time.Instant;

/**
 * Converts Telegram {@link Update}s into platform-neutral updates. Only new
 * messages with text or a voice note from a user carry a payload; edits,
 * callbacks, stickers and channel posts map to
 * {@link PlatformUpdate#ignored(long)}.
 */
@Component
@Slf4j
public class TelegramUpdateMapper {

    public PlatformUpdate map(Update update) {
        long updateId = update.getUpdateId() != null ? update.getUpdateId() : 0;
        if (!update.hasMessage()) {
            return PlatformUpdate.ignored(updateId);
        }
        Message message = update.getMessage();
        User from = message.getFrom();
        if (from == null || message.getChatId() == null) {
            return PlatformUpdate.ignored(updateId);
        }

        InboundUpdate.InboundUpdateBuilder builder = InboundUpdate.builder()
                .updateId(updateId)
                .senderId(String.valueOf(from.getId()))
                .chatId(String.valueOf(message.getChatId()))
                .timestamp(message.getDate() != null ? Instant.ofEpochSecond(message.getDate()) : null)
                .profile(new UserProfileHints(from.getUserName(), from.getFirstName(), from.getLastName(),
                        from.getLanguageCode()));

        if (message.hasText()) {
            return new PlatformUpdate(updateId, builder.channel(InputChannel.TEXT).text(message.getText()).build());
        }
        if (message.hasVoice()) {
            return new PlatformUpdate(updateId, builder.channel(InputChannel.VOICE)
                    .voiceFileId(message.getVoice().getFileId())
                    .build());
        }
        log.debug("[Telegram] update {} has no text or voice, ignoring", updateId);
        return PlatformUpdate.ignored(updateId);
    }
}
