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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Literal text search over files of the project.
 *
 * <p>
 * Directories are searched one level deep unless {@code recursive} is set.
 * Ignored names (default ignore list) are skipped, including whole ignored
 * directories. Undecodable bytes are dropped rather than failing the file.
 */
@Component
@Slf4j
public class GrepTool implements ToolComponent {

    public static final String TOOL_NAME = "grep";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_BOOLEAN = "boolean";

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final int maxResults;
    private final long maxFileSize;
    private final List<String> defaultIgnore;

    public GrepTool(ShellProperties properties, WorkspacePathResolver pathResolver) {
        ShellProperties.SearchToolProperties config = properties.getTools().getSearch();
        this.pathResolver = pathResolver;
        this.enabled = config.isEnabled();
        this.maxResults = config.getMaxResults();
        this.maxFileSize = properties.getTools().getFileEdit().getMaxFileSize();
        this.defaultIgnore = List.copyOf(config.getDefaultIgnore());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Searches files for a literal text pattern (not a regex).
                        Returns matching lines as path:line: content.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                "pattern", Map.of(
                                        PARAM_TYPE, "string",
                                        PARAM_DESCRIPTION, "Text to search for"),
                                "paths", Map.of(
                                        PARAM_TYPE, "array",
                                        "items", Map.of(PARAM_TYPE, "string"),
                                        PARAM_DESCRIPTION, "Files or directories relative to the project root"),
                                "case_sensitive", Map.of(
                                        PARAM_TYPE, TYPE_BOOLEAN,
                                        PARAM_DESCRIPTION, "Case-sensitive search (default: true)"),
                                "recursive", Map.of(
                                        PARAM_TYPE, TYPE_BOOLEAN,
                                        PARAM_DESCRIPTION, "Descend into subdirectories (default: false)"),
                                "invert", Map.of(
                                        PARAM_TYPE, TYPE_BOOLEAN,
                                        PARAM_DESCRIPTION, "Return lines that do NOT contain the pattern")),
                        "required", List.of("pattern")))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String pattern = (String) parameters.get("pattern");
            if (pattern == null || pattern.isEmpty()) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Missing required parameter: pattern");
            }
            boolean caseSensitive = !Boolean.FALSE.equals(parameters.get("case_sensitive"));
            boolean recursive = Boolean.TRUE.equals(parameters.get("recursive"));
            boolean invert = Boolean.TRUE.equals(parameters.get("invert"));
            List<String> pathArgs = NameFilter.stringList(parameters.get("paths"));
            if (pathArgs.isEmpty()) {
                pathArgs = List.of(".");
            }

            NameFilter filter = NameFilter.of(List.of(), List.of(), defaultIgnore);
            List<Path> files = new ArrayList<>();
            for (String pathArg : pathArgs) {
                Path path;
                try {
                    path = pathResolver.resolve(pathArg);
                } catch (WorkspaceAccessDeniedException e) {
                    return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, e.getMessage());
                }
                if (!Files.exists(path)) {
                    return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Path not found: " + pathArg);
                }
                try {
                    collectFiles(path, recursive, filter, files);
                } catch (IOException e) {
                    return ToolResult.failure("Failed to read " + pathArg + ": " + e.getMessage());
                }
            }

            String needle = caseSensitive ? pattern : pattern.toLowerCase(Locale.ROOT);
            List<String> matches = new ArrayList<>();
            boolean truncated = false;
            for (Path file : files) {
                if (context.isCancelled()) {
                    return ToolResult.cancelled(context.cancellationToken().getReason());
                }
                truncated = searchFile(file, needle, caseSensitive, invert, matches);
                if (truncated) {
                    break;
                }
            }

            if (matches.isEmpty()) {
                return ToolResult.success("No matches found for '" + pattern + "'",
                        Map.of("matches", 0, "filesSearched", files.size()));
            }
            StringBuilder sb = new StringBuilder();
            sb.append("Matches for '").append(pattern).append("' (").append(matches.size())
                    .append(truncated ? "+" : "").append(" total):\n");
            matches.forEach(line -> sb.append(line).append('\n'));
            log.debug("[Grep] '{}' matched {} line(s) in {} file(s)", pattern, matches.size(), files.size());
            return ToolResult.success(sb.toString(), Map.of(
                    "matches", matches.size(),
                    "filesSearched", files.size(),
                    "truncated", truncated));
        });
    }

    private void collectFiles(Path path, boolean recursive, NameFilter filter, List<Path> files) throws IOException {
        if (Files.isRegularFile(path)) {
            files.add(path);
            return;
        }
        if (!Files.isDirectory(path)) {
            return;
        }
        List<Path> children;
        try (Stream<Path> stream = Files.list(path)) {
            children = stream
                    .filter(child -> !filter.isIgnored(child))
                    .sorted()
                    .toList();
        }
        for (Path child : children) {
            if (Files.isRegularFile(child)) {
                files.add(child);
            } else if (recursive && Files.isDirectory(child) && !Files.isSymbolicLink(child)) {
                collectFiles(child, true, filter, files);
            }
        }
    }

    /**
     * @return true if the result limit was reached
     */
    private boolean searchFile(Path file, String needle, boolean caseSensitive, boolean invert,
            List<String> matches) {
        try {
            if (Files.size(file) > maxFileSize) {
                return false;
            }
        } catch (IOException e) {
            log.debug("[Grep] Skipping {}: {}", file, e.getMessage());
            return false;
        }

        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        String relative = pathResolver.relativize(file);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line = reader.readLine();
            int lineNumber = 1;
            while (line != null) {
                String content = line.strip();
                String candidate = caseSensitive ? content : content.toLowerCase(Locale.ROOT);
                if (candidate.contains(needle) != invert) {
                    if (matches.size() >= maxResults) {
                        return true;
                    }
                    matches.add(relative + ":" + lineNumber + ": " + content);
                }
                line = reader.readLine();
                lineNumber++;
            }
        } catch (IOException e) {
            log.debug("[Grep] Skipping unreadable file {}: {}", file, e.getMessage());
        }
        return false;
    }
}
