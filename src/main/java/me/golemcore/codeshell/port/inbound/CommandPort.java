package me.golemcore.codeshell.port.inbound;

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
import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for slash commands typed into a channel (/stop, /tools, ...).
 */
public interface CommandPort {

    CompletableFuture<CommandResult> execute(String command, List<String> args);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    record CommandResult(boolean success, String output, boolean exitRequested) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, false);
        }

        public static CommandResult failure(String output) {
            return new CommandResult(false, output, false);
        }

        public static CommandResult exit(String output) {
            return new CommandResult(true, output, true);
        }
    }

    record CommandDefinition(String name, String description, String usage) {
    }
}
