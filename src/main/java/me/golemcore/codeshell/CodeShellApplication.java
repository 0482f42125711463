package me.golemcore.codeshell;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore CodeShell.
 *
 * <p>
 * CodeShell is an interactive coding agent shell: the user types a request,
 * the model answers and calls tools that inspect and change the project, and
 * the user watches the chat, terminal and editor panes update live.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Agent Loop</b> - explicit state machine (model turn, dispatch) with
 * an iteration bound and a single transient retry of model calls</li>
 * <li><b>Concurrent Tools</b> - the calls of one model turn run in parallel,
 * results enter the transcript in call order</li>
 * <li><b>Local Tools</b> - terminal-exec, file-edit, ls, tree, grep, confined
 * to the working root</li>
 * <li><b>MCP Client</b> - Model Context Protocol servers register and
 * release their tools at runtime</li>
 * <li><b>Live Panes</b> - ordered publish/subscribe broker with per-pane
 * buffering and delta coalescing</li>
 * <li><b>Cancellation</b> - /stop cancels the run and every in-flight tool,
 * leaving a replayable transcript</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChannelAdapter, ConsoleCommandRouter
 * Domain Layer       → SessionController, AgentLoop, ToolExecutor, ToolRegistry, StreamBroker
 * Infrastructure     → Model and MCP adapters, local tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code codeshell.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeShellApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeShellApplication.class, args);
    }

}
