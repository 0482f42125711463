package me.golemcore.codeshell.domain.model;

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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One agent run bound to one user input: its cancellation token, the tool
 * invocations it spawned, its current state and its eventual outcome.
 */
public final class RunHandle {

    private final String runId;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final List<ToolInvocation> invocations = new CopyOnWriteArrayList<>();
    private final CompletableFuture<RunOutcome> completion = new CompletableFuture<>();
    private volatile RunState state = RunState.IDLE;

    public RunHandle(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Moves to a non-terminal state. Ignored once the run is terminal.
     */
    public void transitionTo(RunState next) {
        synchronized (completion) {
            if (!completion.isDone()) {
                state = next;
            }
        }
    }

    /**
     * Records the terminal outcome. Only the first call wins.
     */
    public boolean finish(RunOutcome outcome) {
        return finish(outcome, () -> {
        });
    }

    /**
     * Records the terminal outcome and, for the winning call only, runs
     * {@code onTerminal} before waiters on {@link #getCompletion()} are
     * released.
     *
     * @return false if the run was already terminal
     */
    public boolean finish(RunOutcome outcome, Runnable onTerminal) {
        synchronized (completion) {
            if (completion.isDone()) {
                return false;
            }
            state = outcome.state();
            try {
                onTerminal.run();
            } finally {
                completion.complete(outcome);
            }
            return true;
        }
    }

    public void addInvocation(ToolInvocation invocation) {
        invocations.add(invocation);
    }

    public List<ToolInvocation> getInvocations() {
        return List.copyOf(invocations);
    }

    public boolean cancel(String reason) {
        return cancellationToken.cancel(reason);
    }

    public boolean isCancelRequested() {
        return cancellationToken.isCancelled();
    }

    public boolean isTerminal() {
        return completion.isDone();
    }

    public CompletableFuture<RunOutcome> getCompletion() {
        return completion;
    }

    /**
     * Waits for the run to reach a terminal state.
     *
     * @return true if terminal within the timeout
     */
    public boolean awaitTerminal(Duration timeout) throws InterruptedException {
        try {
            completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
