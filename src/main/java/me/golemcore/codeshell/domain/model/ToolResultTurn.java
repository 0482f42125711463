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

import java.time.Instant;

/**
 * The single result of a prior {@link ToolCallTurn} of the same run. A
 * cancelled call is resolved by a result whose failure kind is
 * {@link ToolFailureKind#CANCELLED}.
 */
public record ToolResultTurn(String id, String runId, Instant timestamp, String callId, String toolName,
        ToolResult result) implements Turn {

    public boolean isCancelledMarker() {
        return result != null && result.isCancelled();
    }
}
