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
public record MoodDraft(MoodLevel mood, int intensity, String note) implements EntityDraft {

    public static final int MIN_INTENSITY = 1;
    public static final int MAX_INTENSITY = 10;

    @Override
    public IntentKind kind() {
        return IntentKind.TRACK_MOOD;
    }

    @Override
    public String collection() {
        return "moods";
    }

    @Override
    public void validate() {
        if (mood == null) {
            throw new DraftValidationException("Mood is required");
        }
        if (intensity < MIN_INTENSITY || intensity > MAX_INTENSITY) {
            throw new DraftValidationException("Mood intensity must be within 1..10: " + intensity);
        }
    }
}
