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

/**
 * Unpersisted structured record produced by extraction.
 *
 * <p>
 * Implementations: {@link TaskDraft}, {@link FinanceDraft}, {@link NoteDraft},
 * {@link MoodDraft}. Drafts are ephemeral; only a {@link PersistedEntity}
 * reaches storage.
 */
public interface EntityDraft {

    /**
     * Intent that produced this draft, used for confirmation templates.
     */
    IntentKind kind();

    /**
     * Storage collection name, e.g. {@code tasks}.
     */
    String collection();

    /**
     * @throws me.misix.bot.domain.model.exception.DraftValidationException
     *             when a required field is missing or out of range
     */
    void validate();
}
