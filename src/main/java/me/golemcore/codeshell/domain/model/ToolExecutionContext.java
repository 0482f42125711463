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

import java.util.function.Consumer;

/**
 * Per-invocation context handed to a tool handler: the cancellation token to
 * watch and a sink for incremental output (terminal lines).
 */
public record ToolExecutionContext(
        String invocationId,
        String toolName,
        CancellationToken cancellationToken,
        Consumer<String> outputSink) {

    /**
     * Context for running a tool outside of an agent run.
     */
    public static ToolExecutionContext standalone(String toolName) {
        return new ToolExecutionContext("standalone", toolName, new CancellationToken(), chunk -> {
        });
    }

    public void emitOutput(String chunk) {
        if (outputSink != null && chunk != null && !chunk.isEmpty()) {
            outputSink.accept(chunk);
        }
    }

    public boolean isCancelled() {
        return cancellationToken != null && cancellationToken.isCancelled();
    }
}
