package me.golemcore.codeshell.domain.model;

import java.time.Instant;

public record UserTurn(String id, String runId, Instant timestamp, String text) implements Turn {
}
