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
import me.golemcore.codeshell.domain.component.ToolComponent;
import me.golemcore.codeshell.domain.exception.WorkspaceAccessDeniedException;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists the entries of one directory, directories first, each group sorted by
 * name. Supports match and ignore globs on top of the default ignore list.
 */
@Component
@Slf4j
public class ListDirectoryTool implements ToolComponent {

    public static final String TOOL_NAME = "ls";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_ARRAY = "array";

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final int maxResults;
    private final List<String> defaultIgnore;

    public ListDirectoryTool(ShellProperties properties, WorkspacePathResolver pathResolver) {
        ShellProperties.SearchToolProperties config = properties.getTools().getSearch();
        this.pathResolver = pathResolver;
        this.enabled = config.isEnabled();
        this.maxResults = config.getMaxResults();
        this.defaultIgnore = List.copyOf(config.getDefaultIgnore());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Lists files and directories in a directory of the project.
                        Optionally provide glob patterns to match and ignore entry names.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Directory relative to the project root (default: .)"),
                                "match", Map.of(
                                        PARAM_TYPE, TYPE_ARRAY,
                                        "items", Map.of(PARAM_TYPE, TYPE_STRING),
                                        PARAM_DESCRIPTION, "Globs to include, e.g. [\"*.java\"]"),
                                "ignore", Map.of(
                                        PARAM_TYPE, TYPE_ARRAY,
                                        "items", Map.of(PARAM_TYPE, TYPE_STRING),
                                        PARAM_DESCRIPTION, "Globs to exclude, e.g. [\"*.log\"]"))))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String pathStr = (String) parameters.get("path");
            Path dir;
            try {
                dir = pathResolver.resolve(pathStr);
            } catch (WorkspaceAccessDeniedException e) {
                return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, e.getMessage());
            }
            if (!Files.exists(dir)) {
                return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Directory not found: " + pathStr);
            }
            if (!Files.isDirectory(dir)) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Not a directory: " + pathStr);
            }

            NameFilter filter = NameFilter.of(NameFilter.stringList(parameters.get("match")),
                    NameFilter.stringList(parameters.get("ignore")), defaultIgnore);
            List<Path> entries;
            try (Stream<Path> stream = Files.list(dir)) {
                entries = stream
                        .filter(filter::accepts)
                        .sorted(directoriesFirst())
                        .toList();
            } catch (IOException e) {
                return ToolResult.failure("Failed to list directory: " + e.getMessage());
            }

            String relative = pathResolver.relativize(dir);
            if (entries.isEmpty()) {
                return ToolResult.success("No items found in " + relative, Map.of("path", relative, "count", 0));
            }
            StringBuilder sb = new StringBuilder();
            sb.append("Contents of ").append(relative).append(":\n");
            List<Path> shown = entries.size() > maxResults ? entries.subList(0, maxResults) : entries;
            for (Path entry : shown) {
                sb.append(entry.getFileName()).append(Files.isDirectory(entry) ? "/" : "").append('\n');
            }
            if (shown.size() < entries.size()) {
                sb.append("... (").append(entries.size() - shown.size()).append(" more)\n");
            }
            log.debug("[Ls] Listed {} entries in {}", entries.size(), relative);
            return ToolResult.success(sb.toString(), Map.of("path", relative, "count", entries.size()));
        });
    }

    static Comparator<Path> directoriesFirst() {
        return Comparator.<Path, Boolean>comparing(path -> !Files.isDirectory(path))
                .thenComparing(path -> path.getFileName().toString().toLowerCase(Locale.ROOT));
    }
}
