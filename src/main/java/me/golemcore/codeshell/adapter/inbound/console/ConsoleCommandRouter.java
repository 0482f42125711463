package me.golemcore.codeshell.adapter.inbound.console;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import me.golemcore.codeshell.domain.service.SessionController;
import me.golemcore.codeshell.domain.service.ToolRegistry;
import me.golemcore.codeshell.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Routes console slash commands.
 *
 * <ul>
 * <li>/stop - cancel the active run</li>
 * <li>/tools - list registered tools</li>
 * <li>/help - list commands</li>
 * <li>/exit - cancel the active run and leave the shell</li>
 * </ul>
 */
@Component
@Slf4j
public class ConsoleCommandRouter implements CommandPort {

    private static final String CMD_STOP = "stop";
    private static final String CMD_TOOLS = "tools";
    private static final String CMD_HELP = "help";
    private static final String CMD_EXIT = "exit";
    private static final int MAX_TOOL_DESC_LENGTH = 80;

    private static final List<CommandDefinition> COMMANDS = List.of(
            new CommandDefinition(CMD_STOP, "Stop the current run", "/stop"),
            new CommandDefinition(CMD_TOOLS, "List available tools", "/tools"),
            new CommandDefinition(CMD_HELP, "Show available commands", "/help"),
            new CommandDefinition(CMD_EXIT, "Exit the shell", "/exit"));

    private final SessionController sessionController;
    private final ToolRegistry toolRegistry;

    public ConsoleCommandRouter(SessionController sessionController, ToolRegistry toolRegistry) {
        this.sessionController = sessionController;
        this.toolRegistry = toolRegistry;
    }

    /**
     * Whether a raw input line is a slash command rather than a prompt.
     */
    public static boolean isCommand(String line) {
        return line != null && line.startsWith("/") && line.length() > 1;
    }

    /**
     * Parses and runs a raw "/command arg ..." line.
     */
    public CompletableFuture<CommandResult> executeLine(String line) {
        List<String> parts = List.of(line.substring(1).trim().split("\\s+"));
        String command = parts.get(0).toLowerCase(Locale.ROOT);
        return execute(command, parts.subList(1, parts.size()));
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: /{}", command);
            return switch (command) {
            case CMD_STOP -> handleStop();
            case CMD_TOOLS -> handleTools();
            case CMD_HELP -> handleHelp();
            case CMD_EXIT -> handleExit();
            default -> CommandResult.failure("Unknown command: /" + command + ". Type /help for the list.");
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return COMMANDS.stream().anyMatch(definition -> definition.name().equals(command));
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return COMMANDS;
    }

    private CommandResult handleStop() {
        boolean stopped = sessionController.cancelCurrent();
        log.info("[Stop] /stop requested, active run: {}", stopped);
        return CommandResult.success(stopped ? "Stopped." : "Nothing to stop.");
    }

    private CommandResult handleTools() {
        List<ToolDefinition> tools = toolRegistry.list();
        StringBuilder sb = new StringBuilder();
        sb.append("Tools (").append(tools.size()).append("):\n");
        for (ToolDefinition tool : tools) {
            sb.append("  ").append(tool.getName());
            if (tool.isRemote()) {
                sb.append(" [").append(tool.getServerName()).append("]");
            }
            String desc = tool.getDescription() != null ? tool.getDescription().trim().replace('\n', ' ') : "";
            int dotIdx = desc.indexOf(". ");
            if (dotIdx > 0 && dotIdx < MAX_TOOL_DESC_LENGTH) {
                desc = desc.substring(0, dotIdx + 1);
            } else if (desc.length() > MAX_TOOL_DESC_LENGTH) {
                desc = desc.substring(0, MAX_TOOL_DESC_LENGTH) + "...";
            }
            if (!desc.isEmpty()) {
                sb.append(" - ").append(desc);
            }
            sb.append('\n');
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Commands:\n");
        for (CommandDefinition definition : COMMANDS) {
            sb.append("  ").append(definition.usage()).append(" - ").append(definition.description()).append('\n');
        }
        sb.append("Anything else is sent to the agent.\n");
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleExit() {
        sessionController.cancelCurrent();
        return CommandResult.exit("Bye.");
    }
}
