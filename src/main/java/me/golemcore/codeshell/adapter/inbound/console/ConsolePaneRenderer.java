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
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.service.PaneSubscription;
import me.golemcore.codeshell.domain.service.StreamBroker;
import me.golemcore.codeshell.tools.FileEditTool;
import me.golemcore.codeshell.tools.TerminalExecTool;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders the three panes (chat, terminal, editor) as plain text on one
 * output stream. Each pane is its own broker subscription, so a pane that
 * falls behind never holds up the others.
 */
@Component
@Slf4j
public class ConsolePaneRenderer {

    public static final String PANE_CHAT = "chat";
    public static final String PANE_TERMINAL = "terminal";
    public static final String PANE_EDITOR = "editor";

    private static final int MAX_SUMMARY_LENGTH = 200;

    private final StreamBroker streamBroker;

    public ConsolePaneRenderer(StreamBroker streamBroker) {
        this.streamBroker = streamBroker;
    }

    /**
     * Subscribes all three panes, printing to {@code out}.
     */
    public List<PaneSubscription> attach(PrintStream out) {
        return List.of(
                subscribe(PANE_CHAT, out, this::renderChat),
                subscribe(PANE_TERMINAL, out, this::renderTerminal),
                subscribe(PANE_EDITOR, out, this::renderEditor));
    }

    private PaneSubscription subscribe(String pane, PrintStream out, Function<StreamEvent, String> renderer) {
        return streamBroker.subscribe(pane, event -> {
            String rendered = renderer.apply(event);
            if (rendered != null) {
                out.print(rendered);
                out.flush();
            }
        });
    }

    // ==================== CHAT ====================

    String renderChat(StreamEvent event) {
        return switch (event.type()) {
        case ASSISTANT_DELTA -> event.text();
        case TOOL_CALL_STARTED -> "\n[tool] " + event.toolName() + "\n";
        case TOOL_RESULT_APPENDED -> Boolean.TRUE.equals(event.success())
                ? null
                : "[tool] " + event.toolName() + " failed (" + event.code() + "): " + summarize(event.text()) + "\n";
        case RUN_FINISHED -> "\n";
        case RUN_FAILED -> "\n[error " + event.code() + "] " + event.text() + "\n";
        default -> null;
        };
    }

    // ==================== TERMINAL ====================

    String renderTerminal(StreamEvent event) {
        if (!TerminalExecTool.TOOL_NAME.equals(event.toolName())) {
            return null;
        }
        return switch (event.type()) {
        case TOOL_CALL_STARTED -> "$ " + argument(event.data(), "command") + "\n";
        case TOOL_OUTPUT_DELTA -> indent(event.text());
        default -> null;
        };
    }

    // ==================== EDITOR ====================

    String renderEditor(StreamEvent event) {
        if (!FileEditTool.TOOL_NAME.equals(event.toolName())) {
            return null;
        }
        return switch (event.type()) {
        case TOOL_CALL_STARTED -> "[editor] " + argument(event.data(), "operation") + " "
                + argument(event.data(), "path") + "\n";
        case TOOL_RESULT_APPENDED -> Boolean.TRUE.equals(event.success())
                ? "[editor] " + summarize(firstLine(event.text())) + "\n"
                : null;
        default -> null;
        };
    }

    private static String argument(Map<String, Object> data, String key) {
        Object value = data != null ? data.get(key) : null;
        return value != null ? value.toString() : "";
    }

    private static String indent(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return "  | " + body.replace("\n", "\n  | ") + "\n";
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline) : text;
    }

    private static String summarize(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_SUMMARY_LENGTH ? text : text.substring(0, MAX_SUMMARY_LENGTH) + "...";
    }
}
