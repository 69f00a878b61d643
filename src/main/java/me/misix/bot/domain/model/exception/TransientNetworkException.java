package me.misix.bot.domain.model.exception;

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

import me.misix.bot.domain.model.FailureKind;

/**
 * A collaborator (language model, store, platform API) could not be reached in
 * time. Call sites retry with bounded backoff and then treat the collaborator
 * as unavailable for the current update only.
 */
public class TransientNetworkException extends AssistantException {

    private static final long serialVersionUID = 1L;

    private final long retryAfterSeconds;

    public TransientNetworkException(String message) {
        this(message, null, 0);
    }

    public TransientNetworkException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public TransientNetworkException(String message, Throwable cause, long retryAfterSeconds) {
        super(FailureKind.TRANSIENT_NETWORK, message, cause);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Server supplied back-off hint, 0 when absent.
     */
    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
