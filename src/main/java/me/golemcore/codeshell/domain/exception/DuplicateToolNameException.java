package me.golemcore.codeshell.domain.exception;

/**
 * Thrown when a tool is registered under a name that is already taken.
 */
public class DuplicateToolNameException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public DuplicateToolNameException(String toolName) {
        super("Tool already registered: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
