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

import me.golemcore.codeshell.domain.component.ToolComponent;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolFailureKind;
import me.golemcore.codeshell.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps a single MCP tool as a ToolComponent. Created by
 * {@link McpClientManager} when a server connects and registered together
 * with the rest of that server's tools. Not a Spring bean.
 */
public class McpToolAdapter implements ToolComponent {

    private final String serverName;
    private final ToolDefinition definition;
    private final McpClientManager clientManager;

    public McpToolAdapter(String serverName, ToolDefinition definition, McpClientManager clientManager) {
        this.serverName = serverName;
        this.definition = definition;
        this.clientManager = clientManager;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context) {
        return clientManager.getClient(serverName)
                .map(client -> client.callTool(definition.getName(), parameters, context.cancellationToken()))
                .orElse(CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.TOOL_UNAVAILABLE,
                        "MCP server not running: " + serverName)));
    }

    @Override
    public boolean isEnabled() {
        return clientManager.getClient(serverName).isPresent();
    }

    public String getServerName() {
        return serverName;
    }
}
