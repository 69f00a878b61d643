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
import me.misix.bot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Answers slash commands without classification. Only {@code /start},
 * {@code /help} and {@code /profile} are known; a {@code @botname} suffix is
 * accepted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandHandler {

    private final MessageService messageService;

    public Optional<String> handle(InboundUpdate update) {
        String command = commandOf(update.text());
        if (command == null) {
            return Optional.empty();
        }
        return switch (command) {
        case "/start" -> {
            log.info("[Command] /start from {}", update.senderId());
            yield Optional.of(messageService.getMessage("command.start", displayName(update)));
        }
        case "/help" -> Optional.of(messageService.getMessage("command.help"));
        case "/profile" -> {
            log.info("[Command] /profile from {}", update.senderId());
            yield Optional.of(profile(update));
        }
        default -> Optional.empty();
        };
    }

    static String commandOf(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("/")) {
            return null;
        }
        String first = trimmed.split("\\s+", 2)[0];
        int at = first.indexOf('@');
        if (at > 0) {
            first = first.substring(0, at);
        }
        return first.toLowerCase(Locale.ROOT);
    }

    private String profile(InboundUpdate update) {
        String unset = messageService.getMessage("command.profile.unset");
        String firstName = update.profile().firstName();
        String username = update.profile().username();
        return messageService.getMessage("command.profile",
                firstName != null && !firstName.isBlank() ? firstName : unset,
                update.senderId(),
                username != null && !username.isBlank() ? "@" + username : unset);
    }

    private String displayName(InboundUpdate update) {
        String firstName = update.profile().firstName();
        if (firstName != null && !firstName.isBlank()) {
            return firstName;
        }
        String username = update.profile().username();
        if (username != null && !username.isBlank()) {
            return username;
        }
        return messageService.getMessage("command.start.anonymous");
    }
}
