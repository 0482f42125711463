package me.golemcore.codeshell.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * Runtime instance of one tool call: created by the agent loop, owned by the
 * tool executor until its {@link ToolResult} exists.
 */
public record ToolInvocation(
        String id,
        String runId,
        String toolName,
        Map<String, Object> arguments,
        Instant startedAt,
        CancellationToken cancellationToken) {
}
