package me.golemcore.codeshell.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.exception.WorkspaceAccessDeniedException;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves tool-supplied paths against the working root.
 *
 * <p>
 * A path is accepted only if it stays inside the root both lexically and after
 * following symlinks. For paths that do not exist yet the nearest existing
 * ancestor is checked instead, so a write through a symlinked directory is
 * refused before anything is created.
 */
@Component
@Slf4j
public class WorkspacePathResolver {

    private final Path workspaceRoot;

    public WorkspacePathResolver(ShellProperties properties) {
        this(Paths.get(properties.getTools().getWorkspace()));
    }

    // Visible for testing
    public WorkspacePathResolver(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.workspaceRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create working root " + this.workspaceRoot, e);
        }
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    /**
     * Resolves a path relative to the working root.
     *
     * @throws WorkspaceAccessDeniedException
     *             if the path escapes the root
     */
    public Path resolve(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            return workspaceRoot;
        }
        Path resolved;
        try {
            resolved = workspaceRoot.resolve(pathStr).normalize();
        } catch (InvalidPathException e) {
            throw new WorkspaceAccessDeniedException("Invalid path: " + pathStr);
        }
        if (!resolved.startsWith(workspaceRoot)) {
            log.warn("[Workspace] Path outside working root blocked: {}", pathStr);
            throw new WorkspaceAccessDeniedException("Path is outside the working root: " + pathStr);
        }

        Path existing = resolved;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return resolved;
        }
        try {
            Path realExisting = existing.toRealPath();
            if (!realExisting.startsWith(workspaceRoot.toRealPath())) {
                log.warn("[Workspace] Symlink escape blocked: {} -> {}", existing, realExisting);
                throw new WorkspaceAccessDeniedException("Path is outside the working root: " + pathStr);
            }
        } catch (IOException e) {
            // dangling symlink or unreadable ancestor
            throw new WorkspaceAccessDeniedException("Cannot resolve path: " + pathStr);
        }
        return resolved;
    }

    /**
     * Path relative to the working root, with forward slashes.
     */
    public String relativize(Path path) {
        Path relative = workspaceRoot.relativize(path.toAbsolutePath().normalize());
        String text = relative.toString().replace('\\', '/');
        return text.isEmpty() ? "." : text;
    }
}
