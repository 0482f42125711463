package me.golemcore.codeshell.adapter.outbound.mcp;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.codeshell.domain.model.CancellationToken;
import me.golemcore.codeshell.domain.model.McpServerConfig;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server over
 * stdio.
 *
 * <p>
 * This client manages the lifecycle of an MCP server process:
 * <ol>
 * <li>Start the server process (via shell command)
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call), announcing cancellations
 * (notifications/cancelled)
 * <li>Close the process
 * </ol>
 *
 * <p>
 * Responses are read on a reader thread and matched to requests by id;
 * stderr is drained to the DEBUG log. When the process goes away every pending
 * request fails, and tool calls report {@link ToolFailureKind#TOOL_UNAVAILABLE}.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per configured server by
 * {@link McpClientManager}.
 *
 * @see McpClientManager
 * @see McpToolAdapter
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final long REQUEST_TIMEOUT_SECONDS = 60;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverName;
    private final McpServerConfig config;
    private final ObjectMapper objectMapper;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private List<ToolDefinition> cachedTools;

    public McpClient(String serverName, McpServerConfig config, ObjectMapper objectMapper) {
        this.serverName = serverName;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Start the MCP server process, send initialize, and fetch available tools.
     */
    public List<ToolDefinition> start() throws IOException, InterruptedException, ExecutionException,
            TimeoutException {
        log.info("[MCP:{}] Starting server: {}", serverName, config.getCommand());

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + serverName);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + serverName);
        stderrThread.setDaemon(true);
        stderrThread.start();

        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();

            JsonNode initResult = sendRequest(nextId.getAndIncrement(), "initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-codeshell",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MCP:{}] Initialized: {}", serverName, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest(nextId.getAndIncrement(), "tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", serverName,
                    cachedTools.stream().map(ToolDefinition::getName).toList());
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization interrupted, cleaning up", serverName);
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", serverName, e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Call an MCP tool. Firing the token sends {@code notifications/cancelled}
     * for the request and completes the future with a cancelled result.
     */
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments,
            CancellationToken cancellationToken) {
        if (!isRunning()) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE,
                    "MCP server '" + serverName + "' is not running"));
        }
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> response = sendRequest(id, "tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()));

        CompletableFuture<ToolResult> result = response
                .thenApply(node -> parseToolCallResult(name, node))
                .exceptionally(ex -> mapCallFailure(name, ex));

        if (cancellationToken != null) {
            Runnable unregister = cancellationToken.onCancel(() -> {
                if (!response.isDone()) {
                    sendNotification("notifications/cancelled", Map.of(
                            "requestId", id,
                            "reason", String.valueOf(cancellationToken.getReason())));
                    result.complete(ToolResult.cancelled(cancellationToken.getReason()));
                    response.cancel(false);
                }
            });
            result.whenComplete((r, ex) -> unregister.run());
        }
        return result;
    }

    CompletableFuture<JsonNode> sendRequest(int id, String method, Map<String, Object> params) {
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(REQUEST_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        future.whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            write(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            write(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", serverName, method, e.getMessage());
        }
    }

    private void write(String json) throws IOException {
        BufferedWriter out = writer;
        if (out == null) {
            throw new IOException("MCP process not started");
        }
        log.debug("[MCP:{}] → {}", serverName, json);
        synchronized (out) {
            out.write(json);
            out.newLine();
            out.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    handleMessage(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            running = false;
            for (CompletableFuture<JsonNode> pending : pendingRequests.values()) {
                pending.completeExceptionally(new IOException("MCP process closed"));
            }
            pendingRequests.clear();
        }
    }

    private void handleMessage(String line) {
        log.debug("[MCP:{}] ← {}", serverName, line);
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode == null || !idNode.isInt()) {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", serverName, method);
                return;
            }
            CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
            if (pending == null) {
                log.debug("[MCP:{}] Response for unknown or cancelled id: {}", serverName, idNode.asInt());
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", serverName, e.getMessage());
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", serverName, e.getMessage());
            }
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", serverName, name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .serverName(serverName)
                    .build());
        }
        return tools;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    private ToolResult mapCallFailure(String toolName, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof IOException) {
            return ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE,
                    "MCP server '" + serverName + "' unavailable: " + cause.getMessage());
        }
        if (cause instanceof TimeoutException) {
            return ToolResult.failure(ToolFailureKind.TIMED_OUT,
                    "MCP tool '" + toolName + "' timed out after " + REQUEST_TIMEOUT_SECONDS + "s");
        }
        return ToolResult.failure("MCP tool call failed: " + cause.getMessage());
    }

    public List<ToolDefinition> getCachedTools() {
        return cachedTools != null ? cachedTools : List.of();
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", serverName);
        running = false;

        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException("MCP client closing"));
        }
        pendingRequests.clear();

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", serverName, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
