package me.golemcore.codeshell.domain.model;

/**
 * States of one agent run.
 */
public enum RunState {

    IDLE,
    MODEL_TURN,
    DISPATCHING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
