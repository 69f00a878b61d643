package me.misix.bot.domain.reminder;

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

import java.time.Instant;

/**
 * Reminder state of one task with a deadline. {@code leadSent} is set once the
 * early reminder went out, or up front when the task was created too close
 * to its deadline for one.
 */
public record PendingReminder(String taskId, String ownerId, String chatId, String title, Instant deadline,
        boolean leadSent) {

    PendingReminder withLeadSent() {
        return new PendingReminder(taskId, ownerId, chatId, title, deadline, true);
    }
}
