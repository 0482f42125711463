package me.golemcore.codeshell.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.codeshell.domain.exception.ModelException;
import me.golemcore.codeshell.domain.model.AssistantTurn;
import me.golemcore.codeshell.domain.model.ModelChunk;
import me.golemcore.codeshell.domain.model.ModelRequest;
import me.golemcore.codeshell.domain.model.RunFailureKind;
import me.golemcore.codeshell.domain.model.RunHandle;
import me.golemcore.codeshell.domain.model.RunOutcome;
import me.golemcore.codeshell.domain.model.RunState;
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.StreamEventType;
import me.golemcore.codeshell.domain.model.ToolCallTurn;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.model.ToolResultTurn;
import me.golemcore.codeshell.domain.model.Turn;
import me.golemcore.codeshell.domain.model.UserTurn;
import me.golemcore.codeshell.domain.service.ConversationState;
import me.golemcore.codeshell.domain.service.StreamBroker;
import me.golemcore.codeshell.domain.service.SystemPromptService;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.domain.system.toolloop.DefaultToolExecutor;
import me.golemcore.codeshell.domain.system.toolloop.ToolSchemaValidator;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.port.outbound.ModelPort;
import me.golemcore.codeshell.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentLoopTest {

    private static final String RUN_ID = "run-1";
    private static final String USER_TEXT = "list the project files";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final Map<String, Object> ECHO_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("text", Map.of("type", "string")),
            "required", List.of("text"));

    private ShellProperties properties;
    private ConversationState conversation;
    private ToolRegistry toolRegistry;
    private StreamBroker streamBroker;
    private ScriptedModel model;
    private ExecutorService toolPool;
    private List<StreamEvent> events;
    private AgentLoop agentLoop;

    @BeforeEach
    void setUp() {
        properties = new ShellProperties();
        properties.getLoop().setMaxIterations(5);
        properties.getLoop().setModelRetries(1);
        properties.getLoop().setCancelGrace(Duration.ofMillis(300));
        properties.getTools().setExecutionTimeout(Duration.ofSeconds(10));

        conversation = new ConversationState(CLOCK);
        toolRegistry = new ToolRegistry(List.of());
        streamBroker = new StreamBroker(Runnable::run, CLOCK, 1024);
        events = new CopyOnWriteArrayList<>();
        streamBroker.subscribe("recorder", events::add);
        model = new ScriptedModel();
        toolPool = Executors.newCachedThreadPool();

        SystemPromptService systemPromptService = mock(SystemPromptService.class);
        when(systemPromptService.render(any())).thenReturn("system");

        DefaultToolExecutor toolExecutor = new DefaultToolExecutor(toolRegistry, new ToolSchemaValidator(),
                streamBroker, properties);
        agentLoop = new AgentLoop(conversation, toolRegistry, toolExecutor, model, streamBroker,
                systemPromptService, toolPool, new ObjectMapper(), properties, CLOCK);
    }

    @AfterEach
    void tearDown() {
        toolPool.shutdownNow();
    }

    private RunHandle startRun() {
        conversation.appendUser(RUN_ID, USER_TEXT);
        return new RunHandle(RUN_ID);
    }

    private StubTool echoTool(String name) {
        return new StubTool(ToolDefinition.builder().name(name).description(name).inputSchema(ECHO_SCHEMA).build(),
                (args, ctx) -> CompletableFuture.completedFuture(ToolResult.success(name + ":" + args.get("text"))));
    }

    private List<StreamEventType> eventTypes() {
        return events.stream().map(StreamEvent::type).collect(Collectors.toList());
    }

    @Test
    void shouldFinishPlainTextAnswerWithoutTools() {
        model.then(ModelChunk.text("Hel"), ModelChunk.text("lo"), ModelChunk.endOfTurn());
        RunHandle handle = startRun();

        RunOutcome outcome = agentLoop.run(handle);

        assertEquals(RunState.DONE, outcome.state());
        assertEquals(1, outcome.modelCalls());
        assertEquals(0, outcome.cycles());
        List<Turn> transcript = conversation.snapshot();
        assertEquals(2, transcript.size());
        AssistantTurn answer = assertInstanceOf(AssistantTurn.class, transcript.get(1));
        assertEquals("Hello", answer.text());
        assertTrue(answer.finished());
        assertEquals(List.of(StreamEventType.ASSISTANT_DELTA, StreamEventType.ASSISTANT_DELTA,
                StreamEventType.RUN_FINISHED), eventTypes());
        assertEquals(RunState.DONE, handle.getState());
        assertTrue(handle.getCompletion().isDone());
    }

    @Test
    void shouldAppendEmptyAssistantTurnWhenModelSaysNothing() {
        model.then(ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        AssistantTurn answer = assertInstanceOf(AssistantTurn.class, conversation.snapshot().get(1));
        assertEquals("", answer.text());
    }

    @Test
    void shouldAppendResultsInEmissionOrderWhateverCompletionOrder() {
        // GIVEN: the first call finishes last
        toolRegistry.register(new StubTool(ToolDefinition.simple("slow", "slow"),
                (args, ctx) -> CompletableFuture.supplyAsync(() -> {
                    sleep(200);
                    return ToolResult.success("slow done");
                })));
        toolRegistry.register(StubTool.returning("fast", "fast done"));
        model.then(ModelChunk.text("Checking."),
                ModelChunk.toolCall("call-a", "slow", Map.of()),
                ModelChunk.toolCall("call-b", "fast", Map.of()),
                ModelChunk.endOfTurn())
                .then(ModelChunk.text("All done."), ModelChunk.endOfTurn());

        // WHEN
        RunOutcome outcome = agentLoop.run(startRun());

        // THEN
        assertEquals(RunState.DONE, outcome.state());
        assertEquals(2, outcome.modelCalls());
        assertEquals(1, outcome.cycles());

        List<Turn> transcript = conversation.snapshot();
        assertInstanceOf(UserTurn.class, transcript.get(0));
        assertInstanceOf(AssistantTurn.class, transcript.get(1));
        assertEquals("call-a", assertInstanceOf(ToolCallTurn.class, transcript.get(2)).callId());
        assertEquals("call-b", assertInstanceOf(ToolCallTurn.class, transcript.get(3)).callId());
        ToolResultTurn first = assertInstanceOf(ToolResultTurn.class, transcript.get(4));
        ToolResultTurn second = assertInstanceOf(ToolResultTurn.class, transcript.get(5));
        assertEquals("call-a", first.callId());
        assertEquals("slow done", first.result().getOutput());
        assertEquals("call-b", second.callId());
        assertEquals("All done.", assertInstanceOf(AssistantTurn.class, transcript.get(6)).text());

        List<Turn> secondRequest = model.requests.get(1).getTranscript();
        assertEquals(6, secondRequest.size());
        assertEquals(StreamEventType.RUN_FINISHED, events.get(events.size() - 1).type());
    }

    @Test
    void shouldPublishToolEventsBeforeRunFinished() {
        toolRegistry.register(echoTool("echo"));
        model.then(ModelChunk.toolCall("c1", "echo", Map.of("text", "hi")), ModelChunk.endOfTurn())
                .then(ModelChunk.text("ok"), ModelChunk.endOfTurn());

        agentLoop.run(startRun());

        assertEquals(List.of(StreamEventType.TOOL_CALL_STARTED, StreamEventType.TOOL_RESULT_APPENDED,
                StreamEventType.ASSISTANT_DELTA, StreamEventType.RUN_FINISHED), eventTypes());
        StreamEvent result = events.get(1);
        assertEquals("c1", result.turnId());
        assertEquals("echo:hi", result.text());
        assertTrue(result.success());
    }

    @Test
    void shouldRecordSingleToolRoundTripAsFourTurns() {
        // GIVEN
        toolRegistry.register(new StubTool(ToolDefinition.builder()
                .name("terminal-exec")
                .description("run a command")
                .inputSchema(Map.of("type", "object",
                        "properties", Map.of("command", Map.of("type", "string")),
                        "required", List.of("command")))
                .build(),
                (args, ctx) -> CompletableFuture.completedFuture(ToolResult.success("README.md\nsrc\n"))));
        model.then(ModelChunk.toolCall("call-1", "terminal-exec", Map.of("command", "ls")), ModelChunk.endOfTurn())
                .then(ModelChunk.text("The project has a README and a src directory."), ModelChunk.endOfTurn());

        // WHEN
        RunOutcome outcome = agentLoop.run(startRun());

        // THEN
        assertEquals(RunState.DONE, outcome.state());
        List<Turn> transcript = conversation.snapshot();
        assertEquals(4, transcript.size());
        assertEquals(USER_TEXT, assertInstanceOf(UserTurn.class, transcript.get(0)).text());
        ToolCallTurn call = assertInstanceOf(ToolCallTurn.class, transcript.get(1));
        assertEquals("terminal-exec", call.toolName());
        ToolResultTurn result = assertInstanceOf(ToolResultTurn.class, transcript.get(2));
        assertEquals("call-1", result.callId());
        assertEquals("README.md\nsrc\n", result.result().getOutput());
        AssistantTurn answer = assertInstanceOf(AssistantTurn.class, transcript.get(3));
        assertEquals("The project has a README and a src directory.", answer.text());
        assertTrue(answer.finished());

        assertEquals(2, model.requests.size());
        List<Turn> secondRequest = model.requests.get(1).getTranscript();
        assertTrue(secondRequest.contains(result));
    }

    @Test
    void shouldAssembleStreamedArgumentFragmentsBeforeDispatch() {
        StubTool echo = echoTool("echo");
        toolRegistry.register(echo);
        model.then(ModelChunk.toolCallDelta(0, "c1", "echo", "{\"te"),
                ModelChunk.toolCallDelta(0, null, null, "xt\": \"hel"),
                ModelChunk.toolCallDelta(0, null, null, "lo\"}"),
                ModelChunk.endOfTurn())
                .then(ModelChunk.text("done"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        assertEquals(1, echo.getCallCount());
        assertEquals(Map.of("text", "hello"), echo.getCalls().get(0));
    }

    @Test
    void shouldFeedMalformedArgumentsBackAsValidationFailure() {
        StubTool echo = echoTool("echo");
        toolRegistry.register(echo);
        model.then(ModelChunk.toolCallDelta(0, "c1", "echo", "{\"text\": "), ModelChunk.endOfTurn())
                .then(ModelChunk.text("sorry"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        assertEquals(0, echo.getCallCount());
        ToolResultTurn result = conversation.snapshot().stream()
                .filter(ToolResultTurn.class::isInstance)
                .map(ToolResultTurn.class::cast)
                .findFirst()
                .orElseThrow();
        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.result().getFailureKind());
    }

    @Test
    void shouldReportUnknownToolAndContinue() {
        model.then(ModelChunk.toolCall("c1", "nope", Map.of()), ModelChunk.endOfTurn())
                .then(ModelChunk.text("I cannot do that"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        ToolResultTurn result = assertInstanceOf(ToolResultTurn.class, conversation.snapshot().get(2));
        assertEquals(ToolFailureKind.NOT_FOUND, result.result().getFailureKind());
    }

    @Test
    void shouldGenerateIdsForCallsWithoutOne() {
        toolRegistry.register(echoTool("echo"));
        model.then(ModelChunk.toolCall(null, "echo", Map.of("text", "a")),
                ModelChunk.toolCall(null, "echo", Map.of("text", "b")),
                ModelChunk.endOfTurn())
                .then(ModelChunk.text("ok"), ModelChunk.endOfTurn());

        agentLoop.run(startRun());

        List<String> callIds = conversation.snapshot().stream()
                .filter(ToolCallTurn.class::isInstance)
                .map(turn -> ((ToolCallTurn) turn).callId())
                .collect(Collectors.toList());
        assertEquals(2, callIds.size());
        assertTrue(callIds.get(0).startsWith(RUN_ID + "-call-"));
        assertFalse(callIds.get(0).equals(callIds.get(1)));
    }

    @Test
    void shouldFailWhenModelKeepsRequestingToolsPastLimit() {
        // GIVEN
        properties.getLoop().setMaxIterations(2);
        toolRegistry.register(echoTool("echo"));
        model.otherwise(() -> Flux.just(ModelChunk.toolCall(null, "echo", Map.of("text", "again")),
                ModelChunk.endOfTurn()));

        // WHEN
        RunOutcome outcome = agentLoop.run(startRun());

        // THEN
        assertEquals(RunState.FAILED, outcome.state());
        assertEquals(RunFailureKind.ITERATION_LIMIT_EXCEEDED, outcome.failureKind());
        assertEquals(2, outcome.cycles());
        assertEquals(3, outcome.modelCalls());
        long callTurns = conversation.snapshot().stream().filter(ToolCallTurn.class::isInstance).count();
        assertEquals(2, callTurns);
        assertTrue(conversation.pendingToolCalls(RUN_ID).isEmpty());
        StreamEvent terminal = events.get(events.size() - 1);
        assertEquals(StreamEventType.RUN_FAILED, terminal.type());
        assertEquals("run.iteration_limit_exceeded", terminal.code());
    }

    @Test
    void shouldRetryTransientModelErrorOnce() {
        model.thenError(new ModelException(ModelErrorClassifier.SERVER_ERROR, "overloaded"))
                .then(ModelChunk.text("recovered"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        assertEquals(2, outcome.modelCalls());
    }

    @Test
    void shouldFailAfterSecondTransientError() {
        model.thenError(new ModelException(ModelErrorClassifier.SERVER_ERROR, "overloaded"))
                .thenError(new ModelException(ModelErrorClassifier.SERVER_ERROR, "still overloaded"));

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.FAILED, outcome.state());
        assertEquals(RunFailureKind.MODEL_ERROR, outcome.failureKind());
        assertEquals(2, outcome.modelCalls());
        assertTrue(outcome.message().startsWith("[model.server_error]"));
        assertEquals("run.model_error", events.get(events.size() - 1).code());
    }

    @Test
    void shouldNotRetryNonTransientError() {
        model.thenError(new ModelException(ModelErrorClassifier.AUTHENTICATION, "invalid api key"))
                .then(ModelChunk.text("never"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.FAILED, outcome.state());
        assertEquals(1, outcome.modelCalls());
        assertEquals(1, model.requests.size());
    }

    @Test
    void shouldKeepPartialTextWhenStreamBreaksAndRetry() {
        model.thenStream(() -> Flux.concat(Flux.just(ModelChunk.text("par")),
                Flux.error(new IOException("stream closed"))))
                .then(ModelChunk.text("full answer"), ModelChunk.endOfTurn());

        RunOutcome outcome = agentLoop.run(startRun());

        assertEquals(RunState.DONE, outcome.state());
        List<String> texts = conversation.snapshot().stream()
                .filter(AssistantTurn.class::isInstance)
                .map(turn -> ((AssistantTurn) turn).text())
                .collect(Collectors.toList());
        assertEquals(List.of("par", "full answer"), texts);
    }

    @Test
    void shouldNotCallModelWhenCancelledBeforeStart() {
        RunHandle handle = startRun();
        handle.cancel("user stop");

        RunOutcome outcome = agentLoop.run(handle);

        assertEquals(RunState.CANCELLED, outcome.state());
        assertEquals(0, outcome.modelCalls());
        assertTrue(model.requests.isEmpty());
        StreamEvent terminal = events.get(events.size() - 1);
        assertEquals("run.cancelled", terminal.code());
    }

    @Test
    void shouldCancelRunningToolsAndLeaveNoOrphanCalls() throws Exception {
        // GIVEN
        CountDownLatch started = new CountDownLatch(2);
        StubTool hanging = new StubTool(ToolDefinition.simple("hang", "hang"), (args, ctx) -> {
            started.countDown();
            CompletableFuture<ToolResult> future = new CompletableFuture<>();
            ctx.cancellationToken().onCancel(() -> future.complete(ToolResult.cancelled("stopped")));
            return future;
        });
        toolRegistry.register(hanging);
        model.then(ModelChunk.toolCall("c1", "hang", Map.of()),
                ModelChunk.toolCall("c2", "hang", Map.of()),
                ModelChunk.endOfTurn());
        RunHandle handle = startRun();

        // WHEN
        CompletableFuture<RunOutcome> running = CompletableFuture.supplyAsync(() -> agentLoop.run(handle));
        assertTrue(started.await(2, TimeUnit.SECONDS));
        handle.cancel("user stop");
        RunOutcome outcome = running.get(5, TimeUnit.SECONDS);

        // THEN
        assertEquals(RunState.CANCELLED, outcome.state());
        assertTrue(conversation.pendingToolCalls(RUN_ID).isEmpty());
        List<ToolResultTurn> results = conversation.snapshot().stream()
                .filter(ToolResultTurn.class::isInstance)
                .map(ToolResultTurn.class::cast)
                .collect(Collectors.toList());
        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(ToolResultTurn::isCancelledMarker));
        assertTrue(conversation.isSealed(RUN_ID));
        StreamEvent terminal = events.get(events.size() - 1);
        assertEquals(StreamEventType.RUN_FAILED, terminal.type());
        assertEquals("run.cancelled", terminal.code());
        assertEquals(2, handle.getInvocations().size());
    }

    @Test
    void shouldPublishNothingForRunAfterItsTerminalEvent() throws Exception {
        // GIVEN: a tool that keeps producing output after it has been cancelled
        AtomicBoolean stopEmitting = new AtomicBoolean();
        AtomicInteger emitted = new AtomicInteger();
        toolRegistry.register(new StubTool(ToolDefinition.simple("chatty", "chatty"), (args, ctx) -> {
            CompletableFuture<ToolResult> future = new CompletableFuture<>();
            toolPool.submit(() -> {
                while (!stopEmitting.get()) {
                    ctx.emitOutput("line\n");
                    emitted.incrementAndGet();
                    sleep(2);
                }
            });
            ctx.cancellationToken().onCancel(() -> future.complete(ToolResult.cancelled("stopped")));
            return future;
        }));
        model.then(ModelChunk.toolCall("c1", "chatty", Map.of()), ModelChunk.endOfTurn());
        RunHandle handle = startRun();

        // WHEN
        try {
            CompletableFuture<RunOutcome> running = CompletableFuture.supplyAsync(() -> agentLoop.run(handle));
            waitFor(() -> events.stream().anyMatch(event -> event.type() == StreamEventType.TOOL_OUTPUT_DELTA));
            handle.cancel("user stop");
            RunOutcome outcome = running.get(5, TimeUnit.SECONDS);
            int emittedAtEnd = emitted.get();
            waitFor(() -> emitted.get() > emittedAtEnd + 20);

            // THEN
            assertEquals(RunState.CANCELLED, outcome.state());
            StreamEvent last = events.get(events.size() - 1);
            assertEquals(StreamEventType.RUN_FAILED, last.type());
            assertEquals("run.cancelled", last.code());
        } finally {
            stopEmitting.set(true);
        }
    }

    @Test
    void shouldStopStreamingModelTurnOnCancel() throws Exception {
        model.thenStream(() -> Flux.concat(Flux.just(ModelChunk.text("thinking")), Flux.never()));
        RunHandle handle = startRun();

        CompletableFuture<RunOutcome> running = CompletableFuture.supplyAsync(() -> agentLoop.run(handle));
        waitFor(() -> !events.isEmpty());
        handle.cancel("user stop");
        RunOutcome outcome = running.get(5, TimeUnit.SECONDS);

        assertEquals(RunState.CANCELLED, outcome.state());
        AssistantTurn partial = assertInstanceOf(AssistantTurn.class, conversation.snapshot().get(1));
        assertEquals("thinking", partial.text());
        assertTrue(partial.finished());
    }

    @Test
    void shouldRecordOutcomeOnHandle() throws Exception {
        model.then(ModelChunk.text("hi"), ModelChunk.endOfTurn());
        RunHandle handle = startRun();

        agentLoop.run(handle);

        RunOutcome recorded = handle.getCompletion().get(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals(RunState.DONE, recorded.state());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void waitFor(Supplier<Boolean> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.get() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.get());
    }

    private static final class ScriptedModel implements ModelPort {

        private final Queue<Supplier<Flux<ModelChunk>>> script = new ConcurrentLinkedQueue<>();
        private final List<ModelRequest> requests = new CopyOnWriteArrayList<>();
        private volatile Supplier<Flux<ModelChunk>> fallback = () -> Flux.just(ModelChunk.endOfTurn());

        ScriptedModel then(ModelChunk... chunks) {
            script.add(() -> Flux.just(chunks));
            return this;
        }

        ScriptedModel thenError(Throwable error) {
            script.add(() -> Flux.error(error));
            return this;
        }

        ScriptedModel thenStream(Supplier<Flux<ModelChunk>> stream) {
            script.add(stream);
            return this;
        }

        void otherwise(Supplier<Flux<ModelChunk>> stream) {
            fallback = stream;
        }

        @Override
        public Flux<ModelChunk> completeStream(ModelRequest request) {
            requests.add(request);
            Supplier<Flux<ModelChunk>> next = script.poll();
            return next != null ? next.get() : fallback.get();
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }
}
