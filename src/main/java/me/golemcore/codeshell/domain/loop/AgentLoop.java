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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.exception.ModelException;
import me.golemcore.codeshell.domain.model.CancellationToken;
import me.golemcore.codeshell.domain.model.ModelChunk;
import me.golemcore.codeshell.domain.model.ModelRequest;
import me.golemcore.codeshell.domain.model.RunFailureKind;
import me.golemcore.codeshell.domain.model.RunHandle;
import me.golemcore.codeshell.domain.model.RunOutcome;
import me.golemcore.codeshell.domain.model.RunState;
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolInvocation;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.service.ConversationState;
import me.golemcore.codeshell.domain.service.StreamBroker;
import me.golemcore.codeshell.domain.service.SystemPromptService;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.domain.system.toolloop.ToolExecutorPort;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.port.outbound.ModelPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Orchestration core: drives one run from a user turn to a final assistant
 * message.
 *
 * <p>
 * State machine: {@code IDLE -> MODEL_TURN -> (DISPATCHING | DONE | FAILED)},
 * {@code DISPATCHING -> MODEL_TURN}, and {@code CANCELLED} from any
 * non-terminal state. The run thread is the only writer of its turns.
 *
 * <ul>
 * <li>MODEL_TURN streams the model response. Text deltas grow a streaming
 * assistant turn and are published live; tool calls are collected and only
 * parsed once the turn ends.</li>
 * <li>DISPATCHING appends all tool calls in emission order, runs them
 * concurrently, then appends their results in emission order whatever the
 * completion order.</li>
 * <li>A transient model error is retried once; any other model error, or a
 * second one, fails the run. The partial transcript stays.</li>
 * <li>After {@code maxIterations} dispatch cycles, a model turn asking for
 * more tools fails the run with
 * {@link RunFailureKind#ITERATION_LIMIT_EXCEEDED}; those calls are not
 * appended.</li>
 * </ul>
 *
 * <p>
 * The run token is checked before every model call, between stream chunks and
 * before and after dispatch. Every invocation holds a child token, so
 * cancelling the run reaches all running tools. Whatever way the run ends, its
 * pending calls are resolved and its turns sealed before the terminal event is
 * published.
 */
@Service
@Slf4j
public class AgentLoop {

    private static final long POLL_MILLIS = 50;

    private final ConversationState conversation;
    private final ToolRegistry toolRegistry;
    private final ToolExecutorPort toolExecutor;
    private final ModelPort modelPort;
    private final StreamBroker streamBroker;
    private final SystemPromptService systemPromptService;
    private final ExecutorService toolExecutorService;
    private final ObjectMapper objectMapper;
    private final ShellProperties.LoopProperties settings;
    private final Clock clock;

    public AgentLoop(ConversationState conversation, ToolRegistry toolRegistry, ToolExecutorPort toolExecutor,
            ModelPort modelPort, StreamBroker streamBroker, SystemPromptService systemPromptService,
            @Qualifier("toolExecutorService") ExecutorService toolExecutorService, ObjectMapper objectMapper,
            ShellProperties properties, Clock clock) {
        this.conversation = conversation;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.modelPort = modelPort;
        this.streamBroker = streamBroker;
        this.systemPromptService = systemPromptService;
        this.toolExecutorService = toolExecutorService;
        this.objectMapper = objectMapper;
        this.settings = properties.getLoop();
        this.clock = clock;
    }

    /**
     * Runs to a terminal state on the calling thread. Never throws; the
     * outcome is also recorded on the handle.
     */
    public RunOutcome run(RunHandle handle) {
        RunContext ctx = new RunContext(handle);
        log.info("[AgentLoop] Run {} started", ctx.runId);
        RunOutcome outcome;
        try {
            outcome = drive(ctx);
        } catch (RunCancelledException e) {
            outcome = RunOutcome.cancelled(ctx.runId, e.getMessage(), ctx.modelCalls, ctx.cycles);
        } catch (ModelException e) {
            String code = ModelErrorClassifier.classifyFromThrowable(e);
            log.warn("[AgentLoop] Run {} failed on model error {}: {}", ctx.runId, code, e.getMessage());
            outcome = RunOutcome.failed(ctx.runId, RunFailureKind.MODEL_ERROR,
                    ModelErrorClassifier.withCode(code, e.getMessage()), ctx.modelCalls, ctx.cycles);
        } catch (RuntimeException e) { // NOSONAR - a run must always reach a terminal state
            log.error("[AgentLoop] Run {} failed: {}", ctx.runId, e.getMessage(), e);
            outcome = RunOutcome.failed(ctx.runId, RunFailureKind.INTERNAL_ERROR,
                    "Internal error: " + e.getMessage(), ctx.modelCalls, ctx.cycles);
        }
        return complete(ctx, outcome);
    }

    private RunOutcome drive(RunContext ctx) {
        while (true) {
            checkCancelled(ctx);
            ctx.handle.transitionTo(RunState.MODEL_TURN);
            ModelTurnResult turn = modelTurnWithRetry(ctx);

            if (turn.calls().isEmpty()) {
                if (turn.assistantTurnId() == null) {
                    conversation.appendAssistant(ctx.runId, "");
                }
                return RunOutcome.done(ctx.runId, ctx.modelCalls, ctx.cycles);
            }

            if (ctx.cycles >= settings.getMaxIterations()) {
                log.warn("[AgentLoop] Run {} requested tools after {} cycles, stopping", ctx.runId, ctx.cycles);
                return RunOutcome.failed(ctx.runId, RunFailureKind.ITERATION_LIMIT_EXCEEDED,
                        "Iteration limit exceeded: " + settings.getMaxIterations() + " tool cycles",
                        ctx.modelCalls, ctx.cycles);
            }

            checkCancelled(ctx);
            dispatch(ctx, turn.calls());
            ctx.cycles++;
        }
    }

    // ==================== MODEL TURN ====================

    private ModelTurnResult modelTurnWithRetry(RunContext ctx) {
        int retries = 0;
        while (true) {
            try {
                return modelTurn(ctx);
            } catch (ModelException e) {
                String code = ModelErrorClassifier.classifyFromThrowable(e);
                if (!ModelErrorClassifier.isTransientCode(code) || retries >= settings.getModelRetries()) {
                    throw e;
                }
                checkCancelled(ctx);
                retries++;
                log.warn("[AgentLoop] Transient model error {} in run {}, retry {}/{}", code, ctx.runId, retries,
                        settings.getModelRetries());
            }
        }
    }

    private ModelTurnResult modelTurn(RunContext ctx) {
        checkCancelled(ctx);
        ctx.modelCalls++;
        List<ToolDefinition> tools = toolRegistry.list();
        ModelRequest request = ModelRequest.builder()
                .runId(ctx.runId)
                .systemPrompt(systemPromptService.render(tools))
                .transcript(conversation.snapshot())
                .tools(tools)
                .build();

        BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
        Disposable subscription;
        try {
            subscription = modelPort.completeStream(request).subscribe(
                    chunk -> signals.add(new Signal(chunk, null)),
                    error -> signals.add(new Signal(null, error)),
                    () -> signals.add(Signal.COMPLETE));
        } catch (RuntimeException e) {
            throw asModelException(e);
        }
        Runnable unregister = ctx.token.onCancel(subscription::dispose);

        ToolCallAccumulator accumulator = new ToolCallAccumulator(objectMapper, ctx.runId, ctx.usedCallIds);
        String assistantTurnId = null;
        try {
            long idleLimitNanos = settings.getModelIdleTimeout().toNanos();
            long lastSignal = System.nanoTime();
            boolean endOfTurn = false;
            while (!endOfTurn) {
                Signal signal = signals.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                checkCancelled(ctx);
                if (signal == null) {
                    if (System.nanoTime() - lastSignal > idleLimitNanos) {
                        throw new ModelException(ModelErrorClassifier.REQUEST_TIMEOUT,
                                "No model output for " + settings.getModelIdleTimeout().toSeconds() + "s");
                    }
                    continue;
                }
                lastSignal = System.nanoTime();
                if (signal.error() != null) {
                    throw asModelException(signal.error());
                }
                if (signal == Signal.COMPLETE) {
                    break;
                }
                ModelChunk chunk = signal.chunk();
                switch (chunk.getType()) {
                case TEXT_DELTA -> assistantTurnId = appendText(ctx, assistantTurnId, chunk.getText());
                case TOOL_CALL, TOOL_CALL_DELTA -> accumulator.accept(chunk);
                case END_OF_TURN -> endOfTurn = true;
                default -> log.debug("[AgentLoop] Ignoring chunk {}", chunk.getType());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.dispose();
            throw new RunCancelledException("interrupted");
        } catch (RuntimeException e) {
            subscription.dispose();
            if (assistantTurnId != null) {
                conversation.finishAssistant(assistantTurnId);
            }
            throw e;
        } finally {
            unregister.run();
        }
        subscription.dispose();

        if (assistantTurnId != null) {
            conversation.finishAssistant(assistantTurnId);
        }
        return new ModelTurnResult(assistantTurnId, accumulator.drain());
    }

    private String appendText(RunContext ctx, String assistantTurnId, String text) {
        if (text == null || text.isEmpty()) {
            return assistantTurnId;
        }
        String turnId = assistantTurnId != null ? assistantTurnId : conversation.beginAssistant(ctx.runId);
        conversation.appendAssistantDelta(turnId, text);
        streamBroker.publish(StreamEvent.assistantDelta(ctx.runId, turnId, text));
        return turnId;
    }

    private ModelException asModelException(Throwable error) {
        if (error instanceof ModelException modelException) {
            return modelException;
        }
        String code = ModelErrorClassifier.classifyFromThrowable(error);
        return new ModelException(code, error.getMessage() != null ? error.getMessage() : code, error);
    }

    // ==================== DISPATCH ====================

    private void dispatch(RunContext ctx, List<ToolCallAccumulator.ParsedToolCall> calls) {
        ctx.handle.transitionTo(RunState.DISPATCHING);
        for (ToolCallAccumulator.ParsedToolCall call : calls) {
            conversation.appendToolCall(ctx.runId, call.id(), call.name(), call.arguments());
            streamBroker.publish(StreamEvent.toolCallStarted(ctx.runId, call.id(), call.name(), call.arguments()));
        }

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(calls.size());
        for (ToolCallAccumulator.ParsedToolCall call : calls) {
            if (call.isMalformed()) {
                futures.add(CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, call.parseError())));
                continue;
            }
            ToolInvocation invocation = new ToolInvocation(call.id(), ctx.runId, call.name(), call.arguments(),
                    clock.instant(), ctx.token.child());
            ctx.handle.addInvocation(invocation);
            futures.add(submit(invocation));
        }

        for (int i = 0; i < calls.size(); i++) {
            ToolCallAccumulator.ParsedToolCall call = calls.get(i);
            ToolResult result = collect(ctx, futures.get(i));
            conversation.appendToolResult(ctx.runId, call.id(), result);
            streamBroker.publish(StreamEvent.toolResultAppended(ctx.runId, call.id(), call.name(), result));
        }
        log.debug("[AgentLoop] Run {} cycle {} dispatched {} call(s)", ctx.runId, ctx.cycles + 1, calls.size());
        checkCancelled(ctx);
    }

    private CompletableFuture<ToolResult> submit(ToolInvocation invocation) {
        try {
            return CompletableFuture.supplyAsync(() -> toolExecutor.execute(invocation), toolExecutorService);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE,
                    "Tool executor is shut down"));
        }
    }

    /**
     * Waits for one result. After the run is cancelled, a tool that does not
     * report within the grace period gets the cancelled marker instead.
     */
    private ToolResult collect(RunContext ctx, CompletableFuture<ToolResult> future) {
        long cancelSeenAt = -1;
        long graceNanos = settings.getCancelGrace().toNanos();
        while (true) {
            try {
                ToolResult result = future.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
                return result != null ? result
                        : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
            } catch (TimeoutException e) {
                if (ctx.token.isCancelled()) {
                    long now = System.nanoTime();
                    if (cancelSeenAt < 0) {
                        cancelSeenAt = now;
                    } else if (now - cancelSeenAt > graceNanos) {
                        return ToolResult.cancelled(ctx.token.getReason());
                    }
                }
            } catch (CancellationException e) {
                return ToolResult.cancelled(ctx.cancelReason());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Tool execution failed: " + cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.token.cancel("interrupted");
                return ToolResult.cancelled("interrupted");
            }
        }
    }

    // ==================== COMPLETION ====================

    private RunOutcome complete(RunContext ctx, RunOutcome outcome) {
        String reason = outcome.state() == RunState.CANCELLED
                ? outcome.message()
                : "run ended " + outcome.state().name().toLowerCase(Locale.ROOT);
        try {
            conversation.sealRun(ctx.runId, reason);
        } catch (RuntimeException e) { // NOSONAR - terminal event must still go out
            log.error("[AgentLoop] Failed to seal run {}: {}", ctx.runId, e.getMessage(), e);
        }

        if (!ctx.handle.finish(outcome, () -> streamBroker.publish(terminalEvent(outcome)))) {
            log.debug("[AgentLoop] Run {} was already terminated", ctx.runId);
        }
        log.info("[AgentLoop] Run {} {} after {} model call(s), {} cycle(s)", ctx.runId, outcome.state(),
                outcome.modelCalls(), outcome.cycles());
        return outcome;
    }

    private StreamEvent terminalEvent(RunOutcome outcome) {
        return switch (outcome.state()) {
        case DONE -> StreamEvent.runFinished(outcome.runId());
        case CANCELLED -> StreamEvent.runFailed(outcome.runId(), "run.cancelled", outcome.message());
        default -> StreamEvent.runFailed(outcome.runId(),
                outcome.failureKind() != null ? outcome.failureKind().code() : "run.failed", outcome.message());
        };
    }

    private void checkCancelled(RunContext ctx) {
        if (Thread.currentThread().isInterrupted()) {
            ctx.token.cancel("interrupted");
        }
        if (ctx.token.isCancelled()) {
            throw new RunCancelledException(ctx.cancelReason());
        }
    }

    private static final class RunContext {
        private final RunHandle handle;
        private final String runId;
        private final CancellationToken token;
        private final Set<String> usedCallIds = new HashSet<>();
        private int modelCalls;
        private int cycles;

        private RunContext(RunHandle handle) {
            this.handle = handle;
            this.runId = handle.getRunId();
            this.token = handle.getCancellationToken();
        }

        private String cancelReason() {
            return token.getReason() != null ? token.getReason() : "cancelled";
        }
    }

    private record ModelTurnResult(String assistantTurnId, List<ToolCallAccumulator.ParsedToolCall> calls) {
    }

    private record Signal(ModelChunk chunk, Throwable error) {
        private static final Signal COMPLETE = new Signal(null, null);
    }

    private static final class RunCancelledException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private RunCancelledException(String reason) {
            super(reason);
        }
    }
}
