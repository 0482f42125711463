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

/**
 * Terminal outcome of a run.
 *
 * @param modelCalls
 *            model requests made, retries included
 * @param cycles
 *            completed dispatch cycles (model turn with tool calls followed by
 *            all of their results)
 */
public record RunOutcome(
        String runId,
        RunState state,
        RunFailureKind failureKind,
        String message,
        int modelCalls,
        int cycles) {

    public static RunOutcome done(String runId, int modelCalls, int cycles) {
        return new RunOutcome(runId, RunState.DONE, null, null, modelCalls, cycles);
    }

    public static RunOutcome failed(String runId, RunFailureKind kind, String message, int modelCalls, int cycles) {
        return new RunOutcome(runId, RunState.FAILED, kind, message, modelCalls, cycles);
    }

    public static RunOutcome cancelled(String runId, String reason, int modelCalls, int cycles) {
        return new RunOutcome(runId, RunState.CANCELLED, null, reason, modelCalls, cycles);
    }
}
