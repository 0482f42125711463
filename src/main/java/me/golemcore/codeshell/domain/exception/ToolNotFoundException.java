package me.golemcore.codeshell.domain.exception;

public class ToolNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolNotFoundException(String toolName) {
        super("Unknown tool: " + toolName);
    }
}
