package me.golemcore.codeshell.domain.system.toolloop;

import me.golemcore.codeshell.domain.exception.WorkspaceAccessDeniedException;
import me.golemcore.codeshell.domain.model.CancellationToken;
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.StreamEventType;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolInvocation;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.service.StreamBroker;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DefaultToolExecutorTest {

    private static final String RUN_ID = "run-1";
    private static final String TOOL_NAME = "echo";
    private static final Map<String, Object> ECHO_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("text", Map.of("type", "string")),
            "required", List.of("text"));

    private ToolRegistry registry;
    private StreamBroker streamBroker;
    private ShellProperties properties;
    private DefaultToolExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(List.of());
        streamBroker = mock(StreamBroker.class);
        properties = new ShellProperties();
        properties.getTools().setMaxResultChars(50);
        properties.getTools().setExecutionTimeout(Duration.ofSeconds(5));
        executor = new DefaultToolExecutor(registry, new ToolSchemaValidator(), streamBroker, properties);
    }

    private static ToolInvocation invocation(String toolName, Map<String, Object> args, CancellationToken token) {
        return new ToolInvocation("call-1", RUN_ID, toolName, args, Instant.now(), token);
    }

    private StubTool echoTool() {
        return new StubTool(ToolDefinition.builder().name(TOOL_NAME).description("echo").inputSchema(ECHO_SCHEMA)
                .build(), (args, ctx) -> CompletableFuture.completedFuture(ToolResult.success((String) args.get("text"))));
    }

    @Test
    void shouldExecuteRegisteredTool() {
        StubTool tool = echoTool();
        registry.register(tool);

        ToolResult result = executor.execute(invocation(TOOL_NAME, Map.of("text", "hi"), new CancellationToken()));

        assertTrue(result.isSuccess());
        assertEquals("hi", result.getOutput());
        assertEquals(1, tool.getCallCount());
    }

    @Test
    void shouldReturnNotFoundForUnknownTool() {
        ToolResult result = executor.execute(invocation("nope", Map.of(), new CancellationToken()));

        assertEquals(ToolFailureKind.NOT_FOUND, result.getFailureKind());
        assertEquals("Unknown tool: nope", result.getError());
    }

    @Test
    void shouldRejectInvalidArgumentsWithoutCallingHandler() {
        StubTool tool = echoTool();
        registry.register(tool);

        ToolResult result = executor.execute(invocation(TOOL_NAME, Map.of("text", 7), new CancellationToken()));

        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
        assertTrue(result.getError().startsWith("Invalid arguments for echo"));
        assertEquals(0, tool.getCallCount());
    }

    @Test
    void shouldNotStartWhenAlreadyCancelled() {
        StubTool tool = echoTool();
        registry.register(tool);
        CancellationToken token = new CancellationToken();
        token.cancel("user stop");

        ToolResult result = executor.execute(invocation(TOOL_NAME, Map.of("text", "hi"), token));

        assertTrue(result.isCancelled());
        assertEquals(0, tool.getCallCount());
    }

    @Test
    void shouldReportUnavailableWhenToolDisabled() {
        StubTool tool = echoTool();
        registry.register(tool);
        tool.setEnabled(false);

        ToolResult result = executor.execute(invocation(TOOL_NAME, Map.of("text", "hi"), new CancellationToken()));

        assertEquals(ToolFailureKind.TOOL_UNAVAILABLE, result.getFailureKind());
    }

    @Test
    void shouldMapAccessDeniedFailure() {
        registry.register(new StubTool(ToolDefinition.simple("fs", "fs"),
                (args, ctx) -> CompletableFuture.failedFuture(new WorkspaceAccessDeniedException("outside root"))));

        ToolResult result = executor.execute(invocation("fs", Map.of(), new CancellationToken()));

        assertEquals(ToolFailureKind.ACCESS_DENIED, result.getFailureKind());
        assertEquals("outside root", result.getError());
    }

    @Test
    void shouldMapHandlerExceptionToExecutionFailure() {
        registry.register(new StubTool(ToolDefinition.simple("boom", "boom"), (args, ctx) -> {
            throw new IllegalStateException("kaput");
        }));

        ToolResult result = executor.execute(invocation("boom", Map.of(), new CancellationToken()));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("kaput"));
    }

    @Test
    void shouldClassifyFailureWithoutKind() {
        registry.register(new StubTool(ToolDefinition.simple("legacy", "legacy"),
                (args, ctx) -> CompletableFuture.completedFuture(
                        ToolResult.builder().success(false).error("bad").build())));

        ToolResult result = executor.execute(invocation("legacy", Map.of(), new CancellationToken()));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldTimeOutSlowTool() {
        properties.getTools().setExecutionTimeout(Duration.ofMillis(200));
        executor = new DefaultToolExecutor(registry, new ToolSchemaValidator(), streamBroker, properties);
        registry.register(new StubTool(ToolDefinition.simple("slow", "slow"), (args, ctx) -> new CompletableFuture<>()));

        ToolResult result = executor.execute(invocation("slow", Map.of(), new CancellationToken()));

        assertEquals(ToolFailureKind.TIMED_OUT, result.getFailureKind());
    }

    @Test
    void shouldReturnCancelledPromptlyWhenTokenFiresDuringExecution() throws Exception {
        // GIVEN
        CompletableFuture<ToolResult> neverCompletes = new CompletableFuture<>();
        registry.register(new StubTool(ToolDefinition.simple("hang", "hang"), (args, ctx) -> neverCompletes));
        CancellationToken token = new CancellationToken();

        // WHEN
        CompletableFuture<ToolResult> pending = CompletableFuture.supplyAsync(
                () -> executor.execute(invocation("hang", Map.of(), token)));
        Thread.sleep(100);
        token.cancel("user stop");

        // THEN
        ToolResult result = pending.get(2, TimeUnit.SECONDS);
        assertTrue(result.isCancelled());
        assertTrue(neverCompletes.isCancelled());
    }

    @Test
    void shouldTruncateLongOutput() {
        registry.register(StubTool.returning("long", "x".repeat(120)));

        ToolResult result = executor.execute(invocation("long", Map.of(), new CancellationToken()));

        assertTrue(result.getOutput().startsWith("x".repeat(50)));
        assertTrue(result.getOutput().contains("[truncated, 120 chars total]"));
    }

    @Test
    void shouldPublishHandlerOutputAsDeltas() {
        registry.register(new StubTool(ToolDefinition.simple("talk", "talk"), (args, ctx) -> {
            ctx.emitOutput("line 1\n");
            return CompletableFuture.completedFuture(ToolResult.success("done"));
        }));

        executor.execute(invocation("talk", Map.of(), new CancellationToken()));

        ArgumentCaptor<StreamEvent> captor = ArgumentCaptor.forClass(StreamEvent.class);
        verify(streamBroker).publish(captor.capture());
        assertEquals(StreamEventType.TOOL_OUTPUT_DELTA, captor.getValue().type());
        assertEquals("call-1", captor.getValue().turnId());
        assertEquals("line 1\n", captor.getValue().text());
    }

    @Test
    void shouldDropOutputEmittedAfterInvocationReturned() {
        AtomicReference<ToolExecutionContext> captured = new AtomicReference<>();
        registry.register(new StubTool(ToolDefinition.simple("talk", "talk"), (args, ctx) -> {
            captured.set(ctx);
            ctx.emitOutput("before\n");
            return CompletableFuture.completedFuture(ToolResult.success("done"));
        }));

        executor.execute(invocation("talk", Map.of(), new CancellationToken()));
        captured.get().emitOutput("after\n");

        ArgumentCaptor<StreamEvent> captor = ArgumentCaptor.forClass(StreamEvent.class);
        verify(streamBroker).publish(captor.capture());
        assertEquals("before\n", captor.getValue().text());
    }

    @Test
    void shouldNotPublishAnythingForSilentTool() {
        registry.register(StubTool.returning("quiet", "ok"));

        executor.execute(invocation("quiet", Map.of(), new CancellationToken()));

        verify(streamBroker, never()).publish(any());
    }
}
