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

import java.util.Locale;
import java.util.Optional;

/**
 * Moods the assistant can log, with the emoji used in confirmations.
 */
public enum MoodLevel {

    HAPPY("😊"),
    SAD("😢"),
    ANXIOUS("😰"),
    CALM("😌"),
    EXCITED("🤩"),
    TIRED("😴"),
    STRESSED("😫"),
    ANGRY("😠"),
    NEUTRAL("😐");

    private final String emoji;

    MoodLevel(String emoji) {
        this.emoji = emoji;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MoodLevel> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MoodLevel.valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
