package me.golemcore.codeshell.tools;

import me.golemcore.codeshell.domain.exception.WorkspaceAccessDeniedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkspacePathResolverTest {

    @TempDir
    Path workspace;

    @TempDir
    Path outside;

    private WorkspacePathResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new WorkspacePathResolver(workspace);
    }

    @Test
    void shouldResolveRelativePathInsideRoot() {
        Path resolved = resolver.resolve("src/../src/App.java");

        assertEquals(workspace.toAbsolutePath().normalize().resolve("src/App.java"), resolved);
        assertEquals("src/App.java", resolver.relativize(resolved));
    }

    @Test
    void shouldResolveBlankToRoot() {
        assertEquals(resolver.getWorkspaceRoot(), resolver.resolve(null));
        assertEquals(".", resolver.relativize(resolver.resolve("")));
    }

    @Test
    void shouldDenyTraversalAndAbsolutePaths() {
        assertThrows(WorkspaceAccessDeniedException.class, () -> resolver.resolve("../secret"));
        assertThrows(WorkspaceAccessDeniedException.class, () -> resolver.resolve(outside.toString()));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldDenySymlinkEscape() throws Exception {
        Files.writeString(outside.resolve("secret.txt"), "secret");
        Files.createSymbolicLink(workspace.resolve("link.txt"), outside.resolve("secret.txt"));
        Files.createSymbolicLink(workspace.resolve("dir"), outside);

        assertThrows(WorkspaceAccessDeniedException.class, () -> resolver.resolve("link.txt"));
        assertThrows(WorkspaceAccessDeniedException.class, () -> resolver.resolve("dir/new/file.txt"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void shouldAllowSymlinkInsideRoot() throws Exception {
        Files.createDirectories(workspace.resolve("real"));
        Files.createSymbolicLink(workspace.resolve("alias"), workspace.resolve("real"));

        assertDoesNotThrow(() -> resolver.resolve("alias/file.txt"));
    }
}
