package me.golemcore.codeshell.port.outbound;

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

import java.util.List;

/**
 * Port for remote tool servers speaking the Model Context Protocol.
 */
public interface McpPort {

    /**
     * Starts the server, lists its tools and registers them as one unit.
     *
     * @return names of the registered tools, empty on failure
     */
    List<String> connect(String serverName);

    /**
     * Deregisters the server's tools and closes the connection.
     *
     * @return names of the removed tools
     */
    List<String> disconnect(String serverName);

    List<String> getConnectedServers();
}
