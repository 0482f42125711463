package me.golemcore.codeshell.domain.service;

import me.golemcore.codeshell.domain.exception.DuplicateToolNameException;
import me.golemcore.codeshell.domain.exception.ToolNotFoundException;
import me.golemcore.codeshell.domain.exception.ToolUnavailableException;
import me.golemcore.codeshell.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final String SERVER = "github";

    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry(List.of(StubTool.returning("terminal-exec", "ok"),
                StubTool.returning("file-edit", "ok")));
    }

    @Test
    void shouldRegisterLocalToolsInOrder() {
        assertEquals(List.of("terminal-exec", "file-edit"), registry.names());
        assertEquals("terminal-exec", registry.list().get(0).getName());
    }

    @Test
    void shouldSkipDisabledToolsAtStartup() {
        StubTool disabled = StubTool.returning("grep", "ok");
        disabled.setEnabled(false);

        ToolRegistry withDisabled = new ToolRegistry(List.of(disabled));

        assertTrue(withDisabled.names().isEmpty());
    }

    @Test
    void shouldRejectDuplicateNameAndKeepRegistryUnchanged() {
        DuplicateToolNameException error = assertThrows(DuplicateToolNameException.class,
                () -> registry.register(StubTool.returning("file-edit", "other")));

        assertEquals("file-edit", error.getToolName());
        assertEquals(List.of("terminal-exec", "file-edit"), registry.names());
    }

    @Test
    void shouldRegisterServerAllOrNothing() {
        List<StubTool> tools = List.of(StubTool.remote("create_issue", SERVER),
                StubTool.remote("terminal-exec", SERVER));

        assertThrows(DuplicateToolNameException.class, () -> registry.registerServer(SERVER, tools));

        assertTrue(registry.lookup("create_issue").isEmpty());
        assertTrue(registry.serverTools(SERVER).isEmpty());
    }

    @Test
    void shouldRegisterAndDeregisterServerTools() {
        registry.registerServer(SERVER, List.of(StubTool.remote("create_issue", SERVER),
                StubTool.remote("list_issues", SERVER)));

        assertEquals(List.of("create_issue", "list_issues"), registry.serverTools(SERVER));
        assertTrue(registry.lookup("create_issue").isPresent());

        List<String> removed = registry.deregisterServer(SERVER);

        assertEquals(List.of("create_issue", "list_issues"), removed);
        assertTrue(registry.lookup("create_issue").isEmpty());
        assertEquals(List.of("terminal-exec", "file-edit"), registry.names());
    }

    @Test
    void shouldReturnEmptyWhenDeregisteringUnknownServer() {
        assertTrue(registry.deregisterServer("unknown").isEmpty());
    }

    @Test
    void shouldThrowOnRequireOfMissingTool() {
        assertThrows(ToolNotFoundException.class, () -> registry.require("missing"));
        assertTrue(registry.acquire("missing").isEmpty());
    }

    @Test
    void shouldWaitForOpenLeaseBeforeRemovingServer() throws Exception {
        // GIVEN
        registry.registerServer(SERVER, List.of(StubTool.remote("create_issue", SERVER)));
        Optional<ToolLease> lease = registry.acquire("create_issue");
        assertTrue(lease.isPresent());

        // WHEN
        CompletableFuture<List<String>> removal = CompletableFuture.supplyAsync(
                () -> registry.deregisterServer(SERVER));

        // THEN
        assertThrows(TimeoutException.class, () -> removal.get(300, TimeUnit.MILLISECONDS));
        assertTrue(registry.lookup("create_issue").isPresent());
        assertThrows(ToolUnavailableException.class, () -> registry.acquire("create_issue"));

        lease.get().close();
        assertEquals(List.of("create_issue"), removal.get(5, TimeUnit.SECONDS));
        assertTrue(registry.lookup("create_issue").isEmpty());
    }

    @Test
    void shouldReleaseLeaseOnlyOnce() throws Exception {
        registry.registerServer(SERVER, List.of(StubTool.remote("create_issue", SERVER)));
        ToolLease first = registry.acquire("create_issue").orElseThrow();
        ToolLease second = registry.acquire("create_issue").orElseThrow();

        first.close();
        first.close();
        CompletableFuture<List<String>> removal = CompletableFuture.supplyAsync(
                () -> registry.deregisterServer(SERVER));

        assertThrows(TimeoutException.class, () -> removal.get(300, TimeUnit.MILLISECONDS));
        second.close();
        assertEquals(List.of("create_issue"), removal.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldAllowServerToReconnectAfterRemoval() {
        registry.registerServer(SERVER, List.of(StubTool.remote("create_issue", SERVER)));
        registry.deregisterServer(SERVER);

        assertDoesNotThrow(() -> registry.registerServer(SERVER, List.of(StubTool.remote("create_issue", SERVER))));
    }
}
