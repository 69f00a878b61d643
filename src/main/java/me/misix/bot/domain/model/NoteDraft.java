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
import me.misix.bot.domain.model.exception.DraftValidationException;

@Builder
public record NoteDraft(String title, String content) implements EntityDraft {

    private static final int DERIVED_TITLE_LENGTH = 50;

    public NoteDraft {
        if ((title == null || title.isBlank()) && content != null) {
            String trimmed = content.trim();
            title = trimmed.length() > DERIVED_TITLE_LENGTH ? trimmed.substring(0, DERIVED_TITLE_LENGTH) : trimmed;
        }
    }

    @Override
    public IntentKind kind() {
        return IntentKind.SAVE_NOTE;
    }

    @Override
    public String collection() {
        return "notes";
    }

    @Override
    public void validate() {
        if (content == null || content.isBlank()) {
            throw new DraftValidationException("Note content is required");
        }
    }
}
