package me.golemcore.codeshell.domain.model;

/**
 * Kinds of events fanned out to panes.
 */
public enum StreamEventType {

    ASSISTANT_DELTA,
    TOOL_CALL_STARTED,
    TOOL_OUTPUT_DELTA,
    TOOL_RESULT_APPENDED,
    RUN_FINISHED,
    RUN_FAILED;

    /**
     * Coalescable events may be merged with a later event of the same stream
     * when a pane falls behind. Everything else is always delivered as is.
     */
    public boolean isCoalescable() {
        return this == ASSISTANT_DELTA || this == TOOL_OUTPUT_DELTA;
    }
}
