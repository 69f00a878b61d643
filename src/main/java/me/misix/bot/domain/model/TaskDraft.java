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

import java.time.Instant;

@Builder
public record TaskDraft(String title, String description, Instant deadline, TaskPriority priority)
        implements EntityDraft {

    public TaskDraft {
        priority = priority != null ? priority : TaskPriority.MEDIUM;
    }

    @Override
    public IntentKind kind() {
        return IntentKind.CREATE_TASK;
    }

    @Override
    public String collection() {
        return "tasks";
    }

    @Override
    public void validate() {
        if (title == null || title.isBlank()) {
            throw new DraftValidationException("Task title is required");
        }
    }
}
