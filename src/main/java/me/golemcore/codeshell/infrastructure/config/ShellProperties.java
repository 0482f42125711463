package me.golemcore.codeshell.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the shell, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code codeshell.*} prefix:
 * <ul>
 * <li>{@link LoopProperties} - agent loop bounds and model retry policy</li>
 * <li>{@link SessionProperties} - run cancellation timing</li>
 * <li>{@link BrokerProperties} - pane delivery buffers</li>
 * <li>{@link ToolsProperties} - working root and per-tool settings</li>
 * <li>{@link McpProperties} - remote tool servers</li>
 * <li>{@link ConsoleProperties} - the stdin/stdout channel</li>
 * <li>{@link PromptsProperties} - system prompt source</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "codeshell")
@Data
public class ShellProperties {

    private LoopProperties loop = new LoopProperties();
    private SessionProperties session = new SessionProperties();
    private BrokerProperties broker = new BrokerProperties();
    private ToolsProperties tools = new ToolsProperties();
    private McpProperties mcp = new McpProperties();
    private ConsoleProperties console = new ConsoleProperties();
    private PromptsProperties prompts = new PromptsProperties();

    // ==================== AGENT LOOP ====================

    @Data
    public static class LoopProperties {
        /** Max number of model-turn/dispatch cycles within a single run. */
        private int maxIterations = 25;

        /** Automatic retries of a model call that failed with a transient error. */
        private int modelRetries = 1;

        /** Max silence between two chunks of a model stream. */
        private Duration modelIdleTimeout = Duration.ofMinutes(5);

        /**
         * How long collection waits for a cancelled tool to report before
         * writing the cancelled marker itself.
         */
        private Duration cancelGrace = Duration.ofSeconds(2);
    }

    @Data
    public static class SessionProperties {
        /** How long submit/cancel wait for the active run to become terminal. */
        private Duration cancelTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class BrokerProperties {
        /** Per-pane buffer capacity before deltas get coalesced. */
        private int subscriberBuffer = 1024;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /** Working root that every file and terminal path is confined to. */
        private String workspace = ".";

        /** Results longer than this are truncated before entering the transcript. */
        private int maxResultChars = 100_000;

        /** Upper bound on a single invocation, whatever the tool. */
        private Duration executionTimeout = Duration.ofMinutes(10);

        private TerminalToolProperties terminal = new TerminalToolProperties();
        private FileEditToolProperties fileEdit = new FileEditToolProperties();
        private SearchToolProperties search = new SearchToolProperties();
    }

    @Data
    public static class TerminalToolProperties {
        private boolean enabled = true;
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
    }

    @Data
    public static class FileEditToolProperties {
        private boolean enabled = true;
        private long maxFileSize = 10L * 1024 * 1024;
    }

    @Data
    public static class SearchToolProperties {
        private boolean enabled = true;
        private int maxResults = 500;
        private List<String> defaultIgnore = new ArrayList<>(List.of(
                ".git", "node_modules", "target", "build", "__pycache__", ".idea", ".venv", "venv", "dist"));
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = true;
        private int defaultStartupTimeout = 30;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Map<String, McpServerProperties> servers = new LinkedHashMap<>();
    }

    @Data
    public static class McpServerProperties {
        private String command;
        private Map<String, String> env = new HashMap<>();
        private int startupTimeout = 0;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
        private String prompt = "> ";
    }

    @Data
    public static class PromptsProperties {
        /** Classpath location of the system prompt template. */
        private String systemPrompt = "prompts/agent-prompt.md";

        /** Optional file overriding the classpath template. */
        private String systemPromptFile;
    }
}
