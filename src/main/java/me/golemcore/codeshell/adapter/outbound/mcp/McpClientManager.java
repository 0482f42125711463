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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.exception.DuplicateToolNameException;
import me.golemcore.codeshell.domain.model.McpServerConfig;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import me.golemcore.codeshell.port.outbound.McpPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Manages MCP client lifecycles: a pool of McpClient instances keyed by server
 * name.
 *
 * <p>
 * This manager provides:
 * <ul>
 * <li>Startup: every server under {@code codeshell.mcp.servers} is connected
 * in the background once the application starts
 * <li>Atomic tool registration: a server's tools enter and leave the
 * {@link ToolRegistry} as one unit
 * <li>Health check: a server whose process died is deregistered, after its
 * running invocations have finished
 * <li>@PreDestroy shutdown: Stops all clients on application shutdown
 * </ul>
 *
 * @see McpClient
 * @see McpToolAdapter
 */
@Component
@Slf4j
public class McpClientManager implements McpPort {

    private final ShellProperties properties;
    private final ObjectMapper objectMapper;
    private final ToolRegistry toolRegistry;

    private final Map<String, McpClient> clients = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mcp-health-check");
        t.setDaemon(true);
        return t;
    });

    public McpClientManager(ShellProperties properties, ObjectMapper objectMapper, ToolRegistry toolRegistry) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.toolRegistry = toolRegistry;
    }

    @PostConstruct
    public void init() {
        ShellProperties.McpProperties mcp = properties.getMcp();
        if (!mcp.isEnabled()) {
            log.info("[McpManager] MCP disabled");
            return;
        }
        if (!mcp.getServers().isEmpty()) {
            scheduler.execute(() -> mcp.getServers().keySet().forEach(this::connect));
        }
        long intervalMs = mcp.getHealthCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::checkHealth, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public synchronized List<String> connect(String serverName) {
        McpClient existing = clients.get(serverName);
        if (existing != null && existing.isRunning()) {
            return toolRegistry.serverTools(serverName);
        }
        if (existing != null) {
            disconnect(serverName);
        }

        ShellProperties.McpServerProperties serverProps = properties.getMcp().getServers().get(serverName);
        if (serverProps == null || serverProps.getCommand() == null || serverProps.getCommand().isBlank()) {
            log.warn("[McpManager] No command configured for server '{}'", serverName);
            return List.of();
        }

        McpClient client = new McpClient(serverName, toConfig(serverProps), objectMapper);
        try {
            List<ToolDefinition> definitions = client.start();
            List<McpToolAdapter> adapters = definitions.stream()
                    .map(definition -> new McpToolAdapter(serverName, definition, this))
                    .toList();
            clients.put(serverName, client);
            toolRegistry.registerServer(serverName, adapters);
            log.info("[McpManager] Connected server '{}', {} tools", serverName, adapters.size());
            return adapters.stream().map(McpToolAdapter::getToolName).toList();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clients.remove(serverName);
            client.close();
            return List.of();
        } catch (IOException | ExecutionException | TimeoutException | DuplicateToolNameException
                | IllegalStateException e) {
            log.error("[McpManager] Failed to connect server '{}': {}", serverName, e.getMessage(), e);
            clients.remove(serverName);
            client.close();
            return List.of();
        }
    }

    /**
     * Get a running client by server name.
     */
    public Optional<McpClient> getClient(String serverName) {
        McpClient client = clients.get(serverName);
        if (client != null && client.isRunning()) {
            return Optional.of(client);
        }
        return Optional.empty();
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public List<String> disconnect(String serverName) {
        List<String> removed = toolRegistry.deregisterServer(serverName);
        McpClient client = clients.remove(serverName);
        if (client != null) {
            client.close();
            log.info("[McpManager] Disconnected server '{}'", serverName);
        }
        return removed;
    }

    @Override
    public List<String> getConnectedServers() {
        return clients.entrySet().stream()
                .filter(entry -> entry.getValue().isRunning())
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        log.info("[McpManager] Shutting down all MCP clients");
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (Map.Entry<String, McpClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[McpManager] Error closing client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }

    @SuppressWarnings("PMD.CloseResource")
    void checkHealth() {
        for (Map.Entry<String, McpClient> entry : clients.entrySet()) {
            if (!entry.getValue().isRunning()) {
                log.warn("[McpManager] Lost connection to server '{}', removing its tools", entry.getKey());
                disconnect(entry.getKey());
            }
        }
    }

    private McpServerConfig toConfig(ShellProperties.McpServerProperties serverProps) {
        int startupTimeout = serverProps.getStartupTimeout() > 0
                ? serverProps.getStartupTimeout()
                : properties.getMcp().getDefaultStartupTimeout();
        return McpServerConfig.builder()
                .command(serverProps.getCommand())
                .env(serverProps.getEnv() != null ? serverProps.getEnv() : Map.of())
                .startupTimeoutSeconds(startupTimeout)
                .build();
    }
}
