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

import lombok.Builder;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Event published by the agent loop and delivered to every pane in publish
 * order. {@code sequence} is assigned by the broker.
 *
 * <p>
 * {@code turnId} identifies the stream a delta belongs to: the assistant turn
 * id for assistant text, the tool call id for tool events.
 */
@Builder(toBuilder = true)
public record StreamEvent(
        StreamEventType type,
        long sequence,
        String runId,
        Instant timestamp,
        String turnId,
        String toolName,
        String text,
        Boolean success,
        String code,
        Map<String, Object> data) {

    public boolean isCoalescable() {
        return type != null && type.isCoalescable();
    }

    /**
     * Whether {@code other} continues the same delta stream as this event.
     */
    public boolean sameStreamAs(StreamEvent other) {
        return other != null
                && type == other.type
                && isCoalescable()
                && Objects.equals(runId, other.runId)
                && Objects.equals(turnId, other.turnId);
    }

    /**
     * Folds a later delta of the same stream into this one, keeping this
     * event's position and sequence.
     */
    public StreamEvent mergedWith(StreamEvent later) {
        String left = text != null ? text : "";
        String right = later.text() != null ? later.text() : "";
        return toBuilder().text(left + right).build();
    }

    public static StreamEvent assistantDelta(String runId, String turnId, String text) {
        return StreamEvent.builder()
                .type(StreamEventType.ASSISTANT_DELTA)
                .runId(runId)
                .turnId(turnId)
                .text(text)
                .build();
    }

    public static StreamEvent toolCallStarted(String runId, String callId, String toolName,
            Map<String, Object> arguments) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_CALL_STARTED)
                .runId(runId)
                .turnId(callId)
                .toolName(toolName)
                .data(arguments)
                .build();
    }

    public static StreamEvent toolOutputDelta(String runId, String callId, String toolName, String chunk) {
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_OUTPUT_DELTA)
                .runId(runId)
                .turnId(callId)
                .toolName(toolName)
                .text(chunk)
                .build();
    }

    public static StreamEvent toolResultAppended(String runId, String callId, String toolName, ToolResult result) {
        String failureCode = result.getFailureKind() != null
                ? "tool." + result.getFailureKind().name().toLowerCase(Locale.ROOT)
                : null;
        return StreamEvent.builder()
                .type(StreamEventType.TOOL_RESULT_APPENDED)
                .runId(runId)
                .turnId(callId)
                .toolName(toolName)
                .text(result.isSuccess() ? result.getOutput() : result.getError())
                .success(result.isSuccess())
                .code(failureCode)
                .build();
    }

    public static StreamEvent runFinished(String runId) {
        return StreamEvent.builder()
                .type(StreamEventType.RUN_FINISHED)
                .runId(runId)
                .success(true)
                .build();
    }

    public static StreamEvent runFailed(String runId, String code, String message) {
        return StreamEvent.builder()
                .type(StreamEventType.RUN_FAILED)
                .runId(runId)
                .success(false)
                .code(code)
                .text(message)
                .build();
    }
}
