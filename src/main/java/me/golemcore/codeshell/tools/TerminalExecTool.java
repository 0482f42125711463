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

import jakarta.annotation.PreDestroy;
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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Tool for running commands in the working root.
 *
 * <p>
 * Commands execute via {@code /bin/sh -c}. Standard output and standard error
 * are captured separately and every line is streamed to the invocation's
 * output sink while the process runs.
 *
 * <p>
 * Behavior:
 * <ul>
 * <li>exit code 0 is a success; any other exit code fails with the captured
 * output attached
 * <li>timeout (default 30s, max 300s) kills the process tree
 * <li>cancellation kills the process tree and reports CANCELLED
 * <li>a short blocklist of destructive commands is refused with ACCESS_DENIED
 * </ul>
 *
 * <p>
 * Configuration: {@code codeshell.tools.terminal.*}
 */
@Component
@Slf4j
public class TerminalExecTool implements ToolComponent {

    public static final String TOOL_NAME = "terminal-exec";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_OBJECT = "object";

    private static final int MAX_CAPTURE_LENGTH = 100_000;
    private static final long READER_DRAIN_SECONDS = 1;

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*", "rm -rf ~",
            "mkfs", "dd if=/dev",
            ":(){ :|:& };:", // Fork bomb
            "shutdown", "reboot", "halt", "poweroff",
            "su -",
            "chmod -r 777 /", "> /dev/sda");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("(^|[;&|\\s])sudo\\s"),
            Pattern.compile("rm\\s+-[a-z]*[rf][a-z]*\\s+/(\\s|$|\\*)"),
            Pattern.compile(">\\s*/dev/(sd|hd|nvme|disk)"),
            Pattern.compile("(curl|wget)[^|]*\\|\\s*(sudo\\s+)?(ba|z)?sh\\b"));

    private static final Set<String> PROTECTED_ENV_VARS = Set.of(
            "LD_PRELOAD", "LD_LIBRARY_PATH", "DYLD_INSERT_LIBRARIES");

    private final WorkspacePathResolver pathResolver;
    private final boolean enabled;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final ExecutorService executor;

    public TerminalExecTool(ShellProperties properties, WorkspacePathResolver pathResolver) {
        ShellProperties.TerminalToolProperties config = properties.getTools().getTerminal();
        this.pathResolver = pathResolver;
        this.enabled = config.isEnabled();
        this.defaultTimeout = config.getDefaultTimeout();
        this.maxTimeout = config.getMaxTimeout();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "terminal-exec");
            thread.setDaemon(true);
            return thread;
        });
        log.info("[Terminal] Working root: {}, enabled: {}", pathResolver.getWorkspaceRoot(), enabled);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Terminal] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Execute a command in the project directory via /bin/sh -c.
                        Use for builds, tests, git and other command line work.
                        Returns stdout, stderr and the exit code. Output is streamed live to the terminal pane.
                        Timeout defaults to 30 seconds, max 300.
                        """)
                .inputSchema(Map.of(
                        PARAM_TYPE, TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Command to execute"),
                                "workdir", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Working directory relative to the project root"),
                                "env", Map.of(
                                        PARAM_TYPE, TYPE_OBJECT,
                                        PARAM_DESCRIPTION, "Extra environment variables"),
                                "timeout", Map.of(
                                        PARAM_TYPE, TYPE_INTEGER,
                                        PARAM_DESCRIPTION, "Timeout in seconds (default: 30, max: 300)")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return CompletableFuture.supplyAsync(() -> {
            String command = (String) parameters.get(PARAM_COMMAND);
            if (command == null || command.isBlank()) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Missing required parameter: command");
            }
            log.info("[Terminal] Command: '{}'", abbreviate(command, 200));

            if (isBlocked(command)) {
                log.warn("[Terminal] Blocked command: {}", command);
                return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, "Command blocked for safety reasons");
            }

            Path workDir;
            try {
                workDir = pathResolver.resolve((String) parameters.get("workdir"));
            } catch (WorkspaceAccessDeniedException e) {
                return ToolResult.failure(ToolFailureKind.ACCESS_DENIED, e.getMessage());
            }
            if (!Files.isDirectory(workDir)) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "Working directory does not exist: " + parameters.get("workdir"));
            }

            Map<String, String> envOverrides;
            try {
                envOverrides = parseEnv(parameters.get("env"));
            } catch (IllegalArgumentException e) {
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, e.getMessage());
            }

            int timeout = resolveTimeout(parameters.get("timeout"));
            return run(command, workDir, envOverrides, timeout, context);
        }, executor);
    }

    private ToolResult run(String command, Path workDir, Map<String, String> envOverrides, int timeoutSeconds,
            ToolExecutionContext context) {
        if (context.isCancelled()) {
            return ToolResult.cancelled(context.cancellationToken().getReason());
        }

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.directory(workDir.toFile());
        pb.environment().putAll(envOverrides);
        pb.environment().put("PWD", workDir.toString());

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Failed to start command: " + e.getMessage());
        }

        Runnable unregister = context.cancellationToken().onCancel(() -> destroyTree(process));
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Future<?> stdoutReader = executor.submit(() -> pump(process.getInputStream(), stdout, context));
        Future<?> stderrReader = executor.submit(() -> pump(process.getErrorStream(), stderr, context));

        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!completed) {
                destroyTree(process);
            }
            awaitReader(stdoutReader);
            awaitReader(stderrReader);
            long duration = System.currentTimeMillis() - startTime;

            if (context.isCancelled()) {
                log.info("[Terminal] Command cancelled after {} ms", duration);
                return ToolResult.cancelled(context.cancellationToken().getReason());
            }

            String output = combine(stdout.toString(), stderr.toString());
            if (!completed) {
                log.warn("[Terminal] Command timed out after {}s", timeoutSeconds);
                return ToolResult.failure(ToolFailureKind.TIMED_OUT,
                        "Command timed out after " + timeoutSeconds + " seconds", output,
                        resultData(command, workDir, -1, duration, stdout, stderr));
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = resultData(command, workDir, exitCode, duration, stdout, stderr);
            log.info("[Terminal] Command finished: exitCode={}, duration={}ms", exitCode, duration);
            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Command failed with exit code " + exitCode,
                    "Exit code: " + exitCode + "\n" + output, data);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            return ToolResult.cancelled("interrupted");
        } finally {
            unregister.run();
        }
    }

    private void pump(InputStream stream, StringBuilder sink, ToolExecutionContext context) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                synchronized (sink) {
                    if (sink.length() < MAX_CAPTURE_LENGTH) {
                        sink.append(line).append('\n');
                    }
                }
                if (!context.isCancelled()) {
                    context.emitOutput(line + "\n");
                }
                line = reader.readLine();
            }
        } catch (IOException e) {
            // stream closed by a killed process
            log.debug("[Terminal] Output stream closed: {}", e.getMessage());
        }
    }

    private void awaitReader(Future<?> reader) throws InterruptedException {
        try {
            reader.get(READER_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.debug("[Terminal] Output reader still busy, continuing with captured output");
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.warn("[Terminal] Output reader failed: {}", e.getCause().getMessage());
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static Map<String, Object> resultData(String command, Path workDir, int exitCode, long duration,
            StringBuilder stdout, StringBuilder stderr) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("exitCode", exitCode);
        data.put("duration", duration);
        data.put(PARAM_COMMAND, command);
        data.put("workdir", workDir.toString());
        synchronized (stdout) {
            data.put("stdout", stdout.toString());
        }
        synchronized (stderr) {
            data.put("stderr", stderr.toString());
        }
        return data;
    }

    private static String combine(String stdout, String stderr) {
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return "[stderr]\n" + stderr;
        }
        return stdout + "[stderr]\n" + stderr;
    }

    private int resolveTimeout(Object value) {
        if (!(value instanceof Number number)) {
            return defaultTimeout;
        }
        return Math.max(1, Math.min(number.intValue(), maxTimeout));
    }

    private static Map<String, String> parseEnv(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("env must be an object of strings");
        }
        Map<String, String> env = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (PROTECTED_ENV_VARS.contains(key)) {
                throw new IllegalArgumentException("Environment variable not allowed: " + key);
            }
            env.put(key, entry.getValue() != null ? String.valueOf(entry.getValue()) : "");
        }
        return env;
    }

    static boolean isBlocked(String command) {
        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                return true;
            }
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String text, int maxLen) {
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
