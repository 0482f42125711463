package me.golemcore.codeshell.port.inbound;

/**
 * Inbound port for a user-facing channel that feeds input to the session and
 * renders the panes. Enabled channels are started once at startup.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "console").
     */
    String getChannelType();

    /**
     * Starts reading user input from the channel.
     */
    void start();

    /**
     * Stops reading input and releases the channel's pane subscriptions.
     */
    void stop();

    boolean isRunning();
}
