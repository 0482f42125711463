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

import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.github.difflib.patch.PatchFailedException;
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
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tool for reading and editing text files under the working root.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>read - full file content
 * <li>write - replace or create a file (temp file + atomic move)
 * <li>patch - apply a unified diff
 * <li>view - content with line numbers, optionally a {@code view_range}
 * <li>str_replace - replace every occurrence of {@code old_str}
 * <li>insert - insert {@code new_str} after line {@code insert_line} (0 is
 * the top of the file)
 * </ul>
 *
 * <p>
 * Every path is resolved by {@link WorkspacePathResolver}; a path escaping the
 * working root is refused before the filesystem is touched. Edits of one file
 * are serialized, and a write is never observed half-done by a read.
 *
 * <p>
 * Configuration: {@code codeshell.tools.file-edit.*}
 */
@Component
@Slf4j
public class FileEditTool implements ToolComponent {

    public static final String TOOL_NAME = "file-edit";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_PATH = "path";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_OBJECT = "object";

    private static final String OP_READ = "read";
    private static final String OP_WRITE = "write";
    private static final String OP_PATCH = "patch";
    private static final String OP_VIEW = "view";
    private static final String OP_STR_REPLACE = "str_replace";
    private static final String OP_INSERT = "insert";

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final long maxFileSize;
    private final ConcurrentMap<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public FileEditTool(ShellProperties properties, WorkspacePathResolver pathResolver) {
        ShellProperties.FileEditToolProperties config = properties.getTools().getFileEdit();
        this.pathResolver = pathResolver;
        this.enabled = config.isEnabled();
        this.maxFileSize = config.getMaxFileSize();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Read and edit text files in the project.
                        Operations: read, write, patch, view, str_replace, insert.
                        patch applies a unified diff. view prints line numbers; view_range is [start, end], end -1 means end of file.
                        str_replace replaces every occurrence of old_str with new_str.
                        insert adds new_str after insert_line (0 inserts at the top).
                        All paths are relative to the project root.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_OPERATION, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        "enum", List.of(OP_READ, OP_WRITE, OP_PATCH, OP_VIEW, OP_STR_REPLACE,
                                                OP_INSERT),
                                        PARAM_DESCRIPTION, "Operation to perform"),
                                PARAM_PATH, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "File path relative to the project root"),
                                "content", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "New file content (write)"),
                                "diff", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Unified diff to apply (patch)"),
                                "view_range", Map.of(
                                        PARAM_TYPE, "array",
                                        "items", Map.of(PARAM_TYPE, TYPE_INTEGER),
                                        PARAM_DESCRIPTION, "[start, end] line range, 1-based (view)"),
                                "old_str", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Text to replace (str_replace)"),
                                "new_str", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Replacement or inserted text (str_replace, insert)"),
                                "insert_line", Map.of(
                                        PARAM_TYPE, TYPE_INTEGER,
                                        PARAM_DESCRIPTION, "Line after which to insert (insert)")),
                        "required", List.of(PARAM_OPERATION, PARAM_PATH)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String operation = (String) parameters.get(PARAM_OPERATION);
            String pathStr = (String) parameters.get(PARAM_PATH);
            if (operation == null || pathStr == null) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "Missing required parameters: operation and path");
            }
            log.info("[FileEdit] Operation: {}, Path: {}", operation, pathStr);

            Path path;
            try {
                path = pathResolver.resolve(pathStr);
            } catch (WorkspaceAccessDeniedException e) {
                log.warn("[FileEdit] Access denied for {}: {}", operation, pathStr);
                return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, e.getMessage());
            }

            if (context.isCancelled()) {
                return ToolResult.cancelled(context.cancellationToken().getReason());
            }

            Object fileLock = fileLocks.computeIfAbsent(path, p -> new Object());
            synchronized (fileLock) {
                ToolResult result = switch (operation) {
                case OP_READ -> read(path);
                case OP_WRITE -> write(path, parameters);
                case OP_PATCH -> patch(path, parameters);
                case OP_VIEW -> view(path, parameters);
                case OP_STR_REPLACE -> strReplace(path, parameters);
                case OP_INSERT -> insert(path, parameters);
                default -> ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Unknown operation: " + operation);
                };
                log.debug("[FileEdit] Operation '{}' result: success={}", operation, result.isSuccess());
                return result;
            }
        });
    }

    // ==================== READ ====================

    private ToolResult read(Path path) {
        ToolResult missing = checkRegularFile(path);
        if (missing != null) {
            return missing;
        }
        try {
            String content = readText(path);
            return ToolResult.success(content, Map.of(
                    PARAM_PATH, pathResolver.relativize(path),
                    "size", Files.size(path),
                    "lines", content.lines().count()));
        } catch (FileTooLargeException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    private ToolResult view(Path path, Map<String, Object> params) {
        ToolResult missing = checkRegularFile(path);
        if (missing != null) {
            return missing;
        }
        String content;
        try {
            content = readText(path);
        } catch (FileTooLargeException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }

        List<String> lines = content.lines().toList();
        int start = 1;
        int end = lines.size();
        Object range = params.get("view_range");
        if (range != null) {
            if (!(range instanceof List<?> bounds) || bounds.size() != 2
                    || !(bounds.get(0) instanceof Number) || !(bounds.get(1) instanceof Number)) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "Invalid view_range: expected a list of two integers");
            }
            start = ((Number) bounds.get(0)).intValue();
            int requestedEnd = ((Number) bounds.get(1)).intValue();
            if (start < 1 || start > Math.max(lines.size(), 1)) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid view_range: start line "
                        + start + " should be within [1, " + lines.size() + "]");
            }
            if (requestedEnd != -1 && requestedEnd < start) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid view_range: end line "
                        + requestedEnd + " should be -1 or >= " + start);
            }
            end = requestedEnd == -1 ? lines.size() : Math.min(requestedEnd, lines.size());
        }

        StringBuilder sb = new StringBuilder();
        for (int i = start; i <= end; i++) {
            sb.append(String.format("%4d | %s%n", i, lines.get(i - 1)));
        }
        return ToolResult.success(sb.toString(), Map.of(
                PARAM_PATH, pathResolver.relativize(path),
                "startLine", start,
                "endLine", end,
                "totalLines", lines.size()));
    }

    // ==================== EDIT ====================

    private ToolResult write(Path path, Map<String, Object> params) {
        String content = (String) params.get("content");
        if (content == null) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Missing content for write operation");
        }
        if (Files.isDirectory(path)) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                    "Path is a directory: " + pathResolver.relativize(path));
        }
        boolean existed = Files.exists(path);
        try {
            writeAtomically(path, content);
            return ToolResult.success((existed ? "File written: " : "File created: ") + pathResolver.relativize(path),
                    Map.of(PARAM_PATH, pathResolver.relativize(path),
                            "size", Files.size(path),
                            PARAM_OPERATION, OP_WRITE));
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }

    private ToolResult patch(Path path, Map<String, Object> params) {
        String diff = (String) params.get("diff");
        if (diff == null || diff.isBlank()) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Missing diff for patch operation");
        }
        ToolResult missing = checkRegularFile(path);
        if (missing != null) {
            return missing;
        }
        try {
            String original = readText(path);
            Patch<String> parsed = UnifiedDiffUtils.parseUnifiedDiff(diff.lines().toList());
            if (parsed.getDeltas().isEmpty()) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Diff contains no hunks");
            }
            List<String> patched = parsed.applyTo(new ArrayList<>(Arrays.asList(original.split("\n", -1))));
            String updated = String.join("\n", patched);
            writeAtomically(path, updated);
            return ToolResult.success("Applied " + parsed.getDeltas().size() + " hunk(s) to "
                    + pathResolver.relativize(path), Map.of(
                            PARAM_PATH, pathResolver.relativize(path),
                            "hunks", parsed.getDeltas().size(),
                            PARAM_OPERATION, OP_PATCH));
        } catch (PatchFailedException e) {
            log.info("[FileEdit] Patch rejected for {}: {}", path, e.getMessage());
            return ToolResult.failure("Patch does not apply: " + e.getMessage());
        } catch (FileTooLargeException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (IOException e) {
            return ToolResult.failure("Failed to patch file: " + e.getMessage());
        }
    }

    private ToolResult strReplace(Path path, Map<String, Object> params) {
        String oldStr = (String) params.get("old_str");
        String newStr = params.get("new_str") != null ? (String) params.get("new_str") : "";
        if (oldStr == null || oldStr.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Missing old_str for str_replace operation");
        }
        ToolResult missing = checkRegularFile(path);
        if (missing != null) {
            return missing;
        }
        try {
            String content = readText(path);
            int occurrences = countOccurrences(content, oldStr);
            if (occurrences == 0) {
                return ToolResult.failure("String not found in file: " + pathResolver.relativize(path));
            }
            writeAtomically(path, content.replace(oldStr, newStr));
            return ToolResult.success("Replaced " + occurrences + " occurrence(s) in " + pathResolver.relativize(path),
                    Map.of(PARAM_PATH, pathResolver.relativize(path),
                            "occurrences", occurrences,
                            PARAM_OPERATION, OP_STR_REPLACE));
        } catch (FileTooLargeException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (IOException e) {
            return ToolResult.failure("Failed to edit file: " + e.getMessage());
        }
    }

    private ToolResult insert(Path path, Map<String, Object> params) {
        String newStr = (String) params.get("new_str");
        Object lineValue = params.get("insert_line");
        if (newStr == null || !(lineValue instanceof Number)) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                    "insert requires new_str and insert_line");
        }
        int insertLine = ((Number) lineValue).intValue();
        ToolResult missing = checkRegularFile(path);
        if (missing != null) {
            return missing;
        }
        try {
            String content = readText(path);
            List<String> lines = splitKeepingSeparators(content);
            if (insertLine < 0 || insertLine > lines.size()) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Invalid insert_line: " + insertLine
                        + ". Expected a value within [0, " + lines.size() + "]");
            }

            String block = newStr.endsWith("\n") ? newStr : newStr + "\n";
            StringBuilder updated = new StringBuilder(content.length() + block.length() + 1);
            for (int i = 0; i < insertLine; i++) {
                updated.append(lines.get(i));
            }
            if (insertLine > 0 && !lines.get(insertLine - 1).endsWith("\n")) {
                updated.append('\n');
            }
            updated.append(block);
            for (int i = insertLine; i < lines.size(); i++) {
                updated.append(lines.get(i));
            }

            writeAtomically(path, updated.toString());
            return ToolResult.success("Inserted text after line " + insertLine + " in " + pathResolver.relativize(path),
                    Map.of(PARAM_PATH, pathResolver.relativize(path),
                            "insertLine", insertLine,
                            PARAM_OPERATION, OP_INSERT));
        } catch (FileTooLargeException e) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
        } catch (IOException e) {
            return ToolResult.failure("Failed to edit file: " + e.getMessage());
        }
    }

    // ==================== IO ====================

    private ToolResult checkRegularFile(Path path) {
        if (!Files.exists(path)) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "File not found: " + pathResolver.relativize(path));
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                    "Not a file: " + pathResolver.relativize(path));
        }
        return null;
    }

    private String readText(Path path) throws IOException {
        long size = Files.size(path);
        if (size > maxFileSize) {
            throw new FileTooLargeException("File too large (" + size + " bytes, max " + maxFileSize + ")");
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private void writeAtomically(Path path, String content) throws IOException {
        Path parent = path.getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("[FileEdit] Atomic move not supported, falling back to replace: {}", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static int countOccurrences(String content, String needle) {
        int count = 0;
        int index = content.indexOf(needle);
        while (index >= 0) {
            count++;
            index = content.indexOf(needle, index + needle.length());
        }
        return count;
    }

    private static List<String> splitKeepingSeparators(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length()) {
            lines.add(content.substring(start));
        }
        return lines;
    }

    private static final class FileTooLargeException extends IOException {
        private static final long serialVersionUID = 1L;

        FileTooLargeException(String message) {
            super(message);
        }
    }
}
