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
 * Classification of failures inside the pipeline and delivery layer. Decides
 * whether a call site retries, drops the single entity, or gives up.
 */
public enum FailureKind {

    /**
     * Collaborator unreachable, timed out or rate limited. Retried with bounded
     * backoff.
     */
    TRANSIENT_NETWORK,

    /**
     * Invalid credentials against the platform or the language model.
     */
    AUTH,

    /**
     * Extracted draft is missing required fields.
     */
    VALIDATION,

    /**
     * Update id already processed.
     */
    DUPLICATE_UPDATE,

    /**
     * Delivery mode change requested while another mode is still active or
     * draining.
     */
    MODE_CONFLICT,

    UNKNOWN;

    public boolean isRetryable() {
        return this == TRANSIENT_NETWORK;
    }
}
