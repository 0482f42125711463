package me.golemcore.codeshell.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.codeshell.domain.model.CancellationToken;
import me.golemcore.codeshell.domain.model.McpServerConfig;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.testsupport.FakeMcpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class McpClientTest {

    private static final String SERVER = "fake";

    @TempDir
    Path tempDir;

    private McpClient client;

    @BeforeEach
    void setUp() throws Exception {
        McpServerConfig config = McpServerConfig.builder()
                .command(FakeMcpServer.install(tempDir))
                .startupTimeoutSeconds(5)
                .build();
        client = new McpClient(SERVER, config, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Test
    void shouldHandshakeAndListTools() throws Exception {
        List<ToolDefinition> tools = client.start();

        assertEquals(List.of("echo", "hang"), tools.stream().map(ToolDefinition::getName).toList());
        assertEquals(SERVER, tools.get(0).getServerName());
        assertEquals("object", tools.get(0).getInputSchema().get("type"));
        assertEquals(Map.of("type", "object", "properties", Map.of()), tools.get(1).getInputSchema());
        assertTrue(client.isRunning());
        assertEquals(tools, client.getCachedTools());
    }

    @Test
    void shouldReturnTextContentOfToolCall() throws Exception {
        client.start();

        ToolResult result = client.callTool("echo", Map.of("text", "hi"), new CancellationToken())
                .get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("echoed", result.getOutput());
    }

    @Test
    void shouldMapToolErrorToFailure() throws Exception {
        client.start();

        ToolResult result = client.callTool("fail", Map.of(), null).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("bad input", result.getError());
    }

    @Test
    void shouldMapJsonRpcErrorToFailure() throws Exception {
        client.start();

        ToolResult result = client.callTool("missing", Map.of(), null).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("no such tool"));
    }

    @Test
    void shouldCompleteWithCancelledResultWhenTokenFires() throws Exception {
        client.start();
        CancellationToken token = new CancellationToken();

        CompletableFuture<ToolResult> pending = client.callTool("hang", Map.of(), token);
        Thread.sleep(100);
        assertFalse(pending.isDone());
        token.cancel("user stop");

        ToolResult result = pending.get(1, TimeUnit.SECONDS);
        assertTrue(result.isCancelled());
        assertTrue(client.isRunning());
    }

    @Test
    void shouldFailPendingCallsWhenClosed() throws Exception {
        client.start();
        CompletableFuture<ToolResult> pending = client.callTool("hang", Map.of(), null);

        client.close();

        ToolResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(ToolFailureKind.TOOL_UNAVAILABLE, result.getFailureKind());
        assertFalse(client.isRunning());
    }

    @Test
    void shouldReportUnavailableWhenNotRunning() throws Exception {
        ToolResult result = client.callTool("echo", Map.of(), null).get(1, TimeUnit.SECONDS);

        assertEquals(ToolFailureKind.TOOL_UNAVAILABLE, result.getFailureKind());
    }

    @Test
    void shouldFailStartWhenServerExitsImmediately() {
        McpClient broken = new McpClient("broken",
                McpServerConfig.builder().command("exit 3").startupTimeoutSeconds(2).build(), new ObjectMapper());

        assertThrows(Exception.class, broken::start);
        assertFalse(broken.isRunning());
    }
}
