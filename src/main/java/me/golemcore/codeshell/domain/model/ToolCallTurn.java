package me.golemcore.codeshell.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * A tool call issued by the model. {@code callId} is unique within the run.
 */
public record ToolCallTurn(String id, String runId, Instant timestamp, String callId, String toolName,
        Map<String, Object> arguments) implements Turn {
}
