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
 * Closed set of user goals the classifier can recognize.
 */
public enum IntentKind {

    CREATE_TASK("create_task"),

    ADD_EXPENSE("add_expense"),

    ADD_INCOME("add_income"),

    SAVE_NOTE("save_note"),

    TRACK_MOOD("track_mood"),

    /**
     * Small talk and questions. Never produces an entity.
     */
    GENERAL_CHAT("general_chat");

    private final String code;

    IntentKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<IntentKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (IntentKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
