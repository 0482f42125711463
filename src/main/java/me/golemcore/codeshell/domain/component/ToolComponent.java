package me.golemcore.codeshell.domain.component;

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

import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.model.ToolExecutionContext;
import me.golemcore.codeshell.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the model.
 * Tools expose their JSON Schema definition to the model and implement the
 * execution logic. Examples include TerminalExecTool, FileEditTool and
 * dynamically registered MCP tools.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with already validated parameters. Long-running tools
     * must watch the context's cancellation token and stop promptly when it
     * fires.
     *
     * @param parameters
     *            the execution parameters as a map
     * @param context
     *            invocation id, cancellation token and output sink
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolExecutionContext context);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    default boolean isEnabled() {
        return true;
    }
}
