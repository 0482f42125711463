package me.golemcore.codeshell.domain.system.toolloop;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.component.ToolComponent;
import me.golemcore.codeshell.domain.exception.ToolUnavailableException;
import me.golemcore.codeshell.domain.exception.WorkspaceAccessDeniedException;
import me.golemcore.codeshell.domain.model.CancellationToken;
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolInvocation;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.service.StreamBroker;
import me.golemcore.codeshell.domain.service.ToolLease;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs one tool invocation to completion or cancellation and normalizes the
 * outcome into a {@link ToolResult}.
 *
 * <p>
 * Checks happen in a fixed order: cancellation before start, tool lookup,
 * remote availability, schema validation. The handler is only called when
 * all of them pass, exactly once. While it runs the invocation holds a
 * registry lease, so its server cannot be removed underneath it.
 *
 * <p>
 * Incremental handler output is published as
 * {@link me.golemcore.codeshell.domain.model.StreamEventType#TOOL_OUTPUT_DELTA}
 * until the invocation returns; later output is dropped.
 */
@Component
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private static final String TRUNCATION_SUFFIX = "\n... [truncated, %d chars total]";

    private final ToolRegistry toolRegistry;
    private final ToolSchemaValidator schemaValidator;
    private final StreamBroker streamBroker;
    private final int maxResultChars;
    private final Duration executionTimeout;

    public DefaultToolExecutor(ToolRegistry toolRegistry, ToolSchemaValidator schemaValidator,
            StreamBroker streamBroker, ShellProperties properties) {
        this.toolRegistry = toolRegistry;
        this.schemaValidator = schemaValidator;
        this.streamBroker = streamBroker;
        this.maxResultChars = properties.getTools().getMaxResultChars();
        this.executionTimeout = properties.getTools().getExecutionTimeout();
    }

    @Override
    public ToolResult execute(ToolInvocation invocation) {
        try {
            return truncate(doExecute(invocation));
        } catch (RuntimeException e) { // NOSONAR - executor must never throw
            log.error("[ToolExecutor] Unexpected failure in '{}': {}", invocation.toolName(), e.getMessage(), e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + e.getMessage());
        }
    }

    private ToolResult doExecute(ToolInvocation invocation) {
        String toolName = invocation.toolName();
        CancellationToken token = invocation.cancellationToken();
        if (token != null && token.isCancelled()) {
            return ToolResult.cancelled(token.getReason());
        }

        Optional<ToolLease> lease;
        try {
            lease = toolRegistry.acquire(toolName);
        } catch (ToolUnavailableException e) {
            return ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE, e.getMessage());
        }
        if (lease.isEmpty()) {
            log.warn("[ToolExecutor] Unknown tool requested: {}", toolName);
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Unknown tool: " + toolName);
        }

        try (ToolLease pinned = lease.get()) {
            ToolComponent tool = pinned.tool();
            if (!tool.isEnabled()) {
                return ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE, "Tool is not available: " + toolName);
            }

            Map<String, Object> arguments = invocation.arguments() != null ? invocation.arguments() : Map.of();
            List<String> violations = schemaValidator.validate(tool.getDefinition().getInputSchema(), arguments);
            if (!violations.isEmpty()) {
                log.info("[ToolExecutor] Rejected arguments for '{}': {}", toolName, violations);
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "Invalid arguments for " + toolName + ": " + String.join("; ", violations));
            }

            OutputGate outputGate = new OutputGate(chunk -> streamBroker.publish(
                    StreamEvent.toolOutputDelta(invocation.runId(), invocation.id(), toolName, chunk)));
            ToolExecutionContext context = new ToolExecutionContext(invocation.id(), toolName,
                    token != null ? token : new CancellationToken(), outputGate);

            log.debug("[ToolExecutor] Executing '{}' ({})", toolName, invocation.id());
            try {
                CompletableFuture<ToolResult> future;
                try {
                    future = tool.execute(arguments, context);
                } catch (RuntimeException e) {
                    return mapFailure(toolName, e);
                }
                return await(toolName, future, context.cancellationToken());
            } finally {
                outputGate.close();
            }
        }
    }

    private ToolResult await(String toolName, CompletableFuture<ToolResult> future, CancellationToken token) {
        if (future == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + toolName);
        }
        Runnable unregister = token.onCancel(() -> future.cancel(true));
        try {
            ToolResult result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return normalize(toolName, result, token);
        } catch (CancellationException e) {
            return ToolResult.cancelled(token.getReason() != null ? token.getReason() : "tool cancelled");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ToolExecutor] '{}' exceeded {}", toolName, executionTimeout);
            return ToolResult.failure(ToolFailureKind.TIMED_OUT,
                    "Tool timed out after " + executionTimeout.toSeconds() + "s: " + toolName);
        } catch (ExecutionException e) {
            return mapFailure(toolName, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            token.cancel("interrupted");
            return ToolResult.cancelled("interrupted");
        } finally {
            unregister.run();
        }
    }

    private ToolResult normalize(String toolName, ToolResult result, CancellationToken token) {
        if (result == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result: " + toolName);
        }
        if (!result.isSuccess() && result.getFailureKind() == null) {
            ToolFailureKind kind = token.isCancelled() ? ToolFailureKind.CANCELLED : ToolFailureKind.EXECUTION_FAILED;
            return result.toBuilder().failureKind(kind).build();
        }
        return result;
    }

    private ToolResult mapFailure(String toolName, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WorkspaceAccessDeniedException) {
            log.warn("[ToolExecutor] Access denied in '{}': {}", toolName, cause.getMessage());
            return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, cause.getMessage());
        }
        if (cause instanceof ToolUnavailableException) {
            return ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE, cause.getMessage());
        }
        if (cause instanceof CancellationException) {
            return ToolResult.cancelled("tool cancelled");
        }
        if (cause instanceof IllegalArgumentException) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, cause.getMessage());
        }
        log.warn("[ToolExecutor] '{}' failed: {}", toolName, cause != null ? cause.getMessage() : "unknown", cause);
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                "Tool execution failed: " + (cause != null ? cause.getMessage() : "unknown error"));
    }

    private ToolResult truncate(ToolResult result) {
        if (!exceedsLimit(result.getOutput()) && !exceedsLimit(result.getError())) {
            return result;
        }
        return result.toBuilder()
                .output(truncate(result.getOutput()))
                .error(truncate(result.getError()))
                .build();
    }

    private boolean exceedsLimit(String text) {
        return text != null && text.length() > maxResultChars;
    }

    private String truncate(String text) {
        if (!exceedsLimit(text)) {
            return text;
        }
        return text.substring(0, maxResultChars) + String.format(TRUNCATION_SUFFIX, text.length());
    }

    /**
     * Output sink that stops forwarding once the invocation has returned. A
     * cancelled handler may still be draining its streams at that point.
     */
    static final class OutputGate implements Consumer<String> {

        private final Consumer<String> delegate;
        private boolean closed;

        OutputGate(Consumer<String> delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized void accept(String chunk) {
            if (!closed) {
                delegate.accept(chunk);
            }
        }

        synchronized void close() {
            closed = true;
        }
    }
}
