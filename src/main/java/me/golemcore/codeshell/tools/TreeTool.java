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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Renders a directory as an indented tree. Ignored entries are skipped
 * together with their subtrees; match globs filter files only, so matching
 * files deep in the tree stay reachable.
 */
@Component
@Slf4j
public class TreeTool implements ToolComponent {

    public static final String TOOL_NAME = "tree";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_ARRAY = "array";

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final int maxResults;
    private final List<String> defaultIgnore;

    public TreeTool(ShellProperties properties, WorkspacePathResolver pathResolver) {
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
                        Displays a directory of the project as a tree, subdirectories indented.
                        Use max_depth to limit recursion.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                "root", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Directory relative to the project root (default: .)"),
                                "max_depth", Map.of(
                                        PARAM_TYPE, "integer",
                                        PARAM_DESCRIPTION, "Maximum depth (default: unlimited)"),
                                "match", Map.of(
                                        PARAM_TYPE, TYPE_ARRAY,
                                        "items", Map.of(PARAM_TYPE, TYPE_STRING),
                                        PARAM_DESCRIPTION, "Globs for files to include"),
                                "ignore", Map.of(
                                        PARAM_TYPE, TYPE_ARRAY,
                                        "items", Map.of(PARAM_TYPE, TYPE_STRING),
                                        PARAM_DESCRIPTION, "Globs for entries to exclude"))))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String rootStr = (String) parameters.get("root");
            Path root;
            try {
                root = pathResolver.resolve(rootStr);
            } catch (WorkspaceAccessDeniedException e) {
                return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, e.getMessage());
            }
            if (!Files.isDirectory(root)) {
                return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Directory not found: " + rootStr);
            }
            Object depthValue = parameters.get("max_depth");
            int maxDepth = depthValue instanceof Number number ? number.intValue() : Integer.MAX_VALUE;
            if (maxDepth < 1) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "max_depth must be at least 1");
            }

            NameFilter filter = NameFilter.of(NameFilter.stringList(parameters.get("match")),
                    NameFilter.stringList(parameters.get("ignore")), defaultIgnore);
            List<String> lines = new ArrayList<>();
            String relative = pathResolver.relativize(root);
            lines.add(relative.equals(".") ? "./" : root.getFileName() + "/");
            boolean complete = walk(root, "", 1, maxDepth, filter, lines, context);

            StringBuilder sb = new StringBuilder();
            sb.append("Directory tree for ").append(relative).append(":\n");
            lines.forEach(line -> sb.append(line).append('\n'));
            if (!complete) {
                sb.append("... (truncated at ").append(maxResults).append(" entries)\n");
            }
            if (context.isCancelled()) {
                return ToolResult.cancelled(context.cancellationToken().getReason());
            }
            return ToolResult.success(sb.toString(), Map.of(
                    "root", relative,
                    "entries", lines.size() - 1,
                    "truncated", !complete));
        });
    }

    private boolean walk(Path dir, String prefix, int depth, int maxDepth, NameFilter filter, List<String> lines,
            ToolExecutionContext context) {
        if (depth > maxDepth || context.isCancelled()) {
            return true;
        }
        List<Path> children;
        try (Stream<Path> stream = Files.list(dir)) {
            children = stream
                    .filter(child -> !filter.isIgnored(child))
                    .filter(child -> Files.isDirectory(child) || filter.isMatched(child))
                    .sorted(ListDirectoryTool.directoriesFirst())
                    .toList();
        } catch (IOException e) {
            log.debug("[Tree] Cannot read {}: {}", dir, e.getMessage());
            lines.add(prefix + "└── [unreadable]");
            return true;
        }

        for (int i = 0; i < children.size(); i++) {
            if (lines.size() > maxResults) {
                return false;
            }
            Path child = children.get(i);
            boolean last = i == children.size() - 1;
            boolean directory = Files.isDirectory(child);
            lines.add(prefix + (last ? "└── " : "├── ") + child.getFileName() + (directory ? "/" : ""));
            // symlinked directories are listed but not followed
            if (directory && !Files.isSymbolicLink(child)
                    && !walk(child, prefix + (last ? "    " : "│   "), depth + 1, maxDepth, filter, lines,
                            context)) {
                return false;
            }
        }
        return true;
    }
}
