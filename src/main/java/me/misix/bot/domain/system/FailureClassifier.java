package me.misix.bot.domain.system;

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
import me.misix.bot.domain.model.exception.AssistantException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary failures from collaborators onto {@link FailureKind}.
 *
 * <p>
 * The cause chain is walked until a known type is found. Domain exceptions
 * carry their own kind; timeouts and I/O errors are transient; langchain4j
 * exceptions are matched by class name so the domain layer does not depend on
 * the library.
 */
public final class FailureClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final Set<String> LANGCHAIN4J_TRANSIENT = Set.of(
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "InternalServerException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException");
    private static final String LANGCHAIN4J_AUTHENTICATION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";

    private FailureClassifier() {
    }

    public static FailureKind classify(Throwable throwable) {
        if (throwable == null) {
            return FailureKind.UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            FailureKind byType = classifyKnownThrowable(current);
            if (byType != FailureKind.UNKNOWN) {
                return byType;
            }
            current = current.getCause();
        }
        return FailureKind.UNKNOWN;
    }

    public static boolean isTransient(Throwable throwable) {
        return classify(throwable).isRetryable();
    }

    /**
     * Short single-line description of the innermost cause, safe for logs.
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        Throwable root = throwable;
        Set<Throwable> visited = new HashSet<>();
        while (root.getCause() != null && visited.add(root)) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    private static FailureKind classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof AssistantException assistantException) {
            return assistantException.getKind();
        }
        if (throwable instanceof TimeoutException
                || throwable instanceof SocketTimeoutException
                || throwable instanceof CancellationException) {
            return FailureKind.TRANSIENT_NETWORK;
        }
        if (throwable instanceof IOException) {
            return FailureKind.TRANSIENT_NETWORK;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return FailureKind.UNKNOWN;
        }
        if (LANGCHAIN4J_AUTHENTICATION.equals(className)) {
            return FailureKind.AUTH;
        }
        if (LANGCHAIN4J_TRANSIENT.contains(className)) {
            return FailureKind.TRANSIENT_NETWORK;
        }
        return FailureKind.UNKNOWN;
    }
}
