package me.golemcore.codeshell.infrastructure.config;

import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.port.inbound.ChannelPort;
import me.golemcore.codeshell.port.outbound.ModelPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private ToolRegistry toolRegistry;
    @Mock
    private ModelPort modelPort;
    @Mock
    private ChannelPort consoleChannel;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(toolRegistry.names()).thenReturn(List.of("terminal-exec", "file-edit"));
        when(modelPort.isAvailable()).thenReturn(false);
        when(consoleChannel.getChannelType()).thenReturn("console");
    }

    @Test
    void shouldStartConsoleChannelWhenEnabled() {
        ShellProperties properties = new ShellProperties();
        properties.getConsole().setEnabled(true);

        new AutoConfiguration(properties, toolRegistry, modelPort, List.of(consoleChannel)).init();

        verify(consoleChannel).start();
    }

    @Test
    void shouldNotStartConsoleChannelWhenDisabled() {
        ShellProperties properties = new ShellProperties();
        properties.getConsole().setEnabled(false);

        new AutoConfiguration(properties, toolRegistry, modelPort, List.of(consoleChannel)).init();

        verify(consoleChannel, never()).start();
    }

    @Test
    void shouldCreateNamedDaemonThreads() {
        ThreadFactory factory = AutoConfiguration.namedDaemonThreads("tool-exec-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("tool-exec-1", first.getName());
        assertEquals("tool-exec-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void shouldProvideIndependentExecutors() {
        ExecutorService runs = AutoConfiguration.sessionRunExecutor();
        ExecutorService tools = AutoConfiguration.toolExecutorService();
        try {
            assertFalse(runs == tools);
            assertFalse(runs.isShutdown());
        } finally {
            runs.shutdownNow();
            tools.shutdownNow();
        }
    }
}
