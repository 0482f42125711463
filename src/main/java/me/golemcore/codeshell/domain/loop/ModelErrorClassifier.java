package me.golemcore.codeshell.domain.loop;

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

import me.golemcore.codeshell.domain.exception.ModelException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps model failures to stable machine-readable codes and decides which of
 * them are worth one automatic retry.
 */
public final class ModelErrorClassifier {

    public static final String REQUEST_TIMEOUT = "model.request.timeout";
    public static final String REQUEST_ABORTED = "model.request.aborted";
    public static final String RATE_LIMIT = "model.rate_limit";
    public static final String SERVER_ERROR = "model.server_error";
    public static final String CONNECTION = "model.connection";
    public static final String AUTHENTICATION = "model.authentication";
    public static final String INVALID_REQUEST = "model.invalid_request";
    public static final String CONTEXT_LENGTH_EXCEEDED = "model.context.length_exceeded";
    public static final String STREAM_INTERRUPTED = "model.stream.interrupted";
    public static final String UNKNOWN = "model.error.unknown";

    private ModelErrorClassifier() {
    }

    /**
     * Classify a failure from its type, embedded code or message, walking the
     * cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof ModelException modelException && modelException.getCode() != null) {
                return modelException.getCode();
            }

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return REQUEST_TIMEOUT.equals(code)
                || RATE_LIMIT.equals(code)
                || SERVER_ERROR.equals(code)
                || CONNECTION.equals(code)
                || STREAM_INTERRUPTED.equals(code);
    }

    public static boolean isTransient(Throwable throwable) {
        return isTransientCode(classifyFromThrowable(throwable));
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[model.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof ConnectException || throwable instanceof SocketException) {
            return CONNECTION;
        }
        if (throwable instanceof IOException && throwable.getMessage() != null
                && throwable.getMessage().toLowerCase(Locale.ROOT).contains("stream")) {
            return STREAM_INTERRUPTED;
        }
        return UNKNOWN;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit") || lower.contains("429") || lower.contains("too many requests")) {
            return RATE_LIMIT;
        }
        if (lower.contains("context length") || lower.contains("context_length") || lower.contains("too many tokens")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (lower.contains("401") || lower.contains("unauthorized") || lower.contains("invalid api key")) {
            return AUTHENTICATION;
        }
        if (lower.contains("500") || lower.contains("502") || lower.contains("503") || lower.contains("overloaded")) {
            return SERVER_ERROR;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return REQUEST_TIMEOUT;
        }
        if (lower.contains("connection reset") || lower.contains("connection refused")) {
            return CONNECTION;
        }
        if (lower.contains("400") || lower.contains("bad request")) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }
}
