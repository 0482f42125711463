package me.golemcore.codeshell.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.component.ToolComponent;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.testsupport.FakeMcpServer;
import me.golemcore.codeshell.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class McpClientManagerTest {

    private static final String SERVER = "fake";

    @TempDir
    Path tempDir;

    private ToolRegistry toolRegistry;
    private ShellProperties properties;
    private McpClientManager manager;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ShellProperties();
        ShellProperties.McpServerProperties server = new ShellProperties.McpServerProperties();
        server.setCommand(FakeMcpServer.install(tempDir));
        server.setStartupTimeout(5);
        properties.getMcp().getServers().put(SERVER, server);

        toolRegistry = new ToolRegistry(List.of(StubTool.returning("ls", "a")));
        manager = new McpClientManager(properties, new ObjectMapper(), toolRegistry);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void shouldRegisterServerToolsOnConnect() {
        List<String> registered = manager.connect(SERVER);

        assertEquals(List.of("echo", "hang"), registered);
        assertEquals(List.of("ls", "echo", "hang"), toolRegistry.names());
        assertEquals(List.of(SERVER), manager.getConnectedServers());
        assertEquals(SERVER, toolRegistry.lookup("echo").orElseThrow().getDefinition().getServerName());
    }

    @Test
    void shouldCallRemoteToolThroughAdapter() throws Exception {
        manager.connect(SERVER);
        ToolComponent echo = toolRegistry.require("echo");

        ToolResult result = echo.execute(Map.of("text", "hi"), ToolExecutionContext.standalone("echo"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("echoed", result.getOutput());
    }

    @Test
    void shouldRemoveAllServerToolsOnDisconnect() throws Exception {
        manager.connect(SERVER);
        ToolComponent echo = toolRegistry.require("echo");

        List<String> removed = manager.disconnect(SERVER);

        assertEquals(List.of("echo", "hang"), removed);
        assertEquals(List.of("ls"), toolRegistry.names());
        assertTrue(manager.getConnectedServers().isEmpty());
        assertFalse(echo.isEnabled());
        ToolResult result = echo.execute(Map.of(), ToolExecutionContext.standalone("echo")).get(1, TimeUnit.SECONDS);
        assertEquals(ToolFailureKind.TOOL_UNAVAILABLE, result.getFailureKind());
    }

    @Test
    void shouldReturnExistingToolsWhenAlreadyConnected() {
        manager.connect(SERVER);

        assertEquals(List.of("echo", "hang"), manager.connect(SERVER));
        assertEquals(3, toolRegistry.names().size());
    }

    @Test
    void shouldRegisterNothingForUnknownServer() {
        assertTrue(manager.connect("other").isEmpty());
        assertEquals(List.of("ls"), toolRegistry.names());
    }

    @Test
    void shouldNotRegisterAnythingWhenServerToolClashesWithLocalTool() throws Exception {
        toolRegistry = new ToolRegistry(List.of(StubTool.returning("echo", "local")));
        manager.shutdown();
        manager = new McpClientManager(properties, new ObjectMapper(), toolRegistry);

        List<String> registered = manager.connect(SERVER);

        assertTrue(registered.isEmpty());
        assertEquals(List.of("echo"), toolRegistry.names());
        assertTrue(manager.getConnectedServers().isEmpty());
    }

    @Test
    void shouldDropToolsOfDeadServerOnHealthCheck() throws Exception {
        manager.connect(SERVER);
        manager.getClient(SERVER).orElseThrow().close();

        manager.checkHealth();

        assertEquals(List.of("ls"), toolRegistry.names());
    }
}
