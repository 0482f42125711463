package me.golemcore.codeshell.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Launch settings of one MCP (Model Context Protocol) server declared under
 * {@code codeshell.mcp.servers.<name>}: the command to start it, environment
 * variables and the handshake timeout.
 */
@Data
@Builder
public class McpServerConfig {

    private String command;

    @Builder.Default
    private Map<String, String> env = new HashMap<>();

    @Builder.Default
    private int startupTimeoutSeconds = 30;
}
