package me.golemcore.codeshell.domain.service;

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
import me.golemcore.codeshell.domain.loop.AgentLoop;
import me.golemcore.codeshell.domain.model.RunFailureKind;
import me.golemcore.codeshell.domain.model.RunHandle;
import me.golemcore.codeshell.domain.model.RunOutcome;
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.Turn;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Top-level coordinator of the session: receives user input and owns the
 * single-active-run invariant.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>submit while a run is active: the active run is cancelled and awaited
 * before the new user turn is appended.</li>
 * <li>/stop: cooperative cancellation of the active run. If the run does not
 * stop in time its thread is interrupted, and as a last resort its pending
 * calls are marked cancelled and its turns sealed here.</li>
 * </ul>
 *
 * <p>
 * Cancellation never rolls back side effects already applied by tools.
 */
@Service
@Slf4j
public class SessionController {

    private final AgentLoop agentLoop;
    private final ConversationState conversation;
    private final StreamBroker streamBroker;
    private final ToolRegistry toolRegistry;
    private final ExecutorService sessionRunExecutor;
    private final Duration cancelTimeout;

    private final Object lock = new Object();
    private final AtomicLong runCounter = new AtomicLong();
    private RunHandle activeRun;
    private Future<?> runningTask;

    public SessionController(AgentLoop agentLoop, ConversationState conversation, StreamBroker streamBroker,
            ToolRegistry toolRegistry, @Qualifier("sessionRunExecutor") ExecutorService sessionRunExecutor,
            ShellProperties properties) {
        this.agentLoop = agentLoop;
        this.conversation = conversation;
        this.streamBroker = streamBroker;
        this.toolRegistry = toolRegistry;
        this.sessionRunExecutor = sessionRunExecutor;
        this.cancelTimeout = properties.getSession().getCancelTimeout();
    }

    /**
     * Cancels any active run, appends the user turn and starts a new run.
     *
     * @return the handle of the new run
     */
    public RunHandle submit(String userText) {
        Objects.requireNonNull(userText, "userText");
        synchronized (lock) {
            cancelActiveLocked("superseded by new input");

            RunHandle handle = new RunHandle("run-" + runCounter.incrementAndGet());
            conversation.appendUser(handle.getRunId(), userText);
            activeRun = handle;
            try {
                runningTask = sessionRunExecutor.submit(() -> runSafely(handle));
            } catch (RejectedExecutionException e) {
                log.error("[Session] Cannot start run {}: {}", handle.getRunId(), e.getMessage());
                forceTerminate(handle, RunOutcome.failed(handle.getRunId(), RunFailureKind.INTERNAL_ERROR,
                        "Run executor unavailable", 0, 0));
            }
            log.info("[Session] Submitted {} ({} chars)", handle.getRunId(), userText.length());
            return handle;
        }
    }

    /**
     * Best-effort cooperative cancellation. Returns once the active run is
     * terminal.
     *
     * @return true if a run was active
     */
    public boolean cancelCurrent() {
        synchronized (lock) {
            return cancelActiveLocked("cancelled by user");
        }
    }

    public Optional<RunHandle> activeRun() {
        synchronized (lock) {
            return Optional.ofNullable(activeRun).filter(run -> !run.isTerminal());
        }
    }

    public List<Turn> transcript() {
        return conversation.snapshot();
    }

    public List<String> tools() {
        return toolRegistry.names();
    }

    private boolean cancelActiveLocked(String reason) {
        RunHandle run = activeRun;
        if (run == null || run.isTerminal()) {
            return false;
        }

        log.info("[Stop] Cancelling {} ({})", run.getRunId(), reason);
        run.cancel(reason);
        try {
            if (run.awaitTerminal(cancelTimeout)) {
                return true;
            }

            log.warn("[Stop] {} did not stop within {}, interrupting", run.getRunId(), cancelTimeout);
            Future<?> task = runningTask;
            if (task != null) {
                task.cancel(true);
            }
            if (run.awaitTerminal(cancelTimeout)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Stop] Interrupted while waiting for {} to stop", run.getRunId());
        }

        log.warn("[Stop] Forcing {} to a terminal state", run.getRunId());
        forceTerminate(run, RunOutcome.cancelled(run.getRunId(), reason, 0, 0));
        return true;
    }

    private void forceTerminate(RunHandle run, RunOutcome outcome) {
        conversation.sealRun(run.getRunId(), outcome.message());
        String code = outcome.failureKind() != null ? outcome.failureKind().code() : "run.cancelled";
        run.finish(outcome, () -> streamBroker.publish(StreamEvent.runFailed(run.getRunId(), code, outcome.message())));
    }

    private void runSafely(RunHandle handle) {
        try {
            agentLoop.run(handle);
        } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
            log.error("[Session] Run {} crashed: {}", handle.getRunId(), e.getMessage(), e);
            forceTerminate(handle, RunOutcome.failed(handle.getRunId(), RunFailureKind.INTERNAL_ERROR,
                    "Internal error: " + e.getMessage(), 0, 0));
        }
    }
}
