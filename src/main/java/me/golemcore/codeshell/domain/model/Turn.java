package me.golemcore.codeshell.domain.model;

import java.time.Instant;

/**
 * One atomic unit of the transcript: a user message, an assistant message, a
 * tool call, or a tool result. Every turn belongs to exactly one run.
 */
public interface Turn {

    /**
     * Session-unique turn id.
     */
    String id();

    String runId();

    Instant timestamp();
}
