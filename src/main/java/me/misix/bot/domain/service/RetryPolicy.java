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
import me.misix.bot.domain.model.exception.TransientNetworkException;
import me.misix.bot.domain.system.FailureClassifier;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for transient collaborator failures.
 *
 * <p>
 * Only failures classified as transient are retried. A server supplied
 * {@code retry_after} hint wins over the computed backoff. When a deadline is
 * given, no sleep extends past it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryPolicy {

    private final BotProperties properties;
    private final Clock clock;

    public <T> T call(String operation, Supplier<T> attempt) {
        return call(operation, null, attempt);
    }

    public <T> T call(String operation, Instant deadline, Supplier<T> attempt) {
        BotProperties.RetryProperties retry = properties.getRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());

        for (int attemptNo = 1;; attemptNo++) {
            try {
                return attempt.get();
            } catch (RuntimeException e) {
                if (!FailureClassifier.isTransient(e) || attemptNo >= maxAttempts) {
                    throw e;
                }
                long backoffMs = backoffMillis(attemptNo, e);
                if (deadline != null && clock.instant().plusMillis(backoffMs).isAfter(deadline)) {
                    log.warn("[Retry] {} failed, no budget left for another attempt: {}",
                            operation, FailureClassifier.describe(e));
                    throw e;
                }
                log.info("[Retry] {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attemptNo, maxAttempts, backoffMs, FailureClassifier.describe(e));
                sleepBeforeRetry(backoffMs);
            }
        }
    }

    long backoffMillis(int attemptNo, Throwable failure) {
        BotProperties.RetryProperties retry = properties.getRetry();
        double computed = retry.getInitialBackoff().toMillis() * Math.pow(retry.getMultiplier(), attemptNo - 1.0);
        long backoffMs = (long) Math.min(computed, retry.getMaxBackoff().toMillis());
        if (failure instanceof TransientNetworkException transientFailure
                && transientFailure.getRetryAfterSeconds() > 0) {
            backoffMs = Math.max(backoffMs, transientFailure.getRetryAfterSeconds() * 1000);
        }
        return backoffMs;
    }

    protected void sleepBeforeRetry(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry backoff interrupted", e);
        }
    }
}
