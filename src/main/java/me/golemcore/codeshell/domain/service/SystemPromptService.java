package me.golemcore.codeshell.domain.service;

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
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the system prompt sent with every model turn. The template comes
 * from an optional override file or the classpath, with variable substitution
 * ({{PROJECT_ROOT}}, {{DATE}}, {{TOOLS}}).
 */
@Service
@Slf4j
public class SystemPromptService {

    private static final String DEFAULT_PROMPT = """
            You are a coding agent working inside the project at {{PROJECT_ROOT}}.
            Use the available tools to inspect and change files and to run commands.
            Current date: {{DATE}}
            """;

    private final ShellProperties properties;
    private final Clock clock;
    private volatile String template;

    public SystemPromptService(ShellProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public String render(List<ToolDefinition> tools) {
        String tpl = getTemplate();
        String toolList = tools.stream()
                .map(tool -> "- " + tool.getName() + ": " + firstLine(tool.getDescription()))
                .collect(Collectors.joining("\n"));
        Map<String, String> variables = Map.of(
                "PROJECT_ROOT", workspaceRoot().toString(),
                "DATE", LocalDate.now(clock).toString(),
                "TOOLS", toolList);
        String rendered = tpl;
        for (Map.Entry<String, String> variable : variables.entrySet()) {
            rendered = rendered.replace("{{" + variable.getKey() + "}}", variable.getValue());
        }
        return rendered;
    }

    public Path workspaceRoot() {
        return Path.of(properties.getTools().getWorkspace()).toAbsolutePath().normalize();
    }

    /**
     * Drops the cached template so the next render reads it again.
     */
    public void reload() {
        template = null;
    }

    private String getTemplate() {
        String current = template;
        if (current == null) {
            current = loadTemplate();
            template = current;
        }
        return current;
    }

    private String loadTemplate() {
        ShellProperties.PromptsProperties prompts = properties.getPrompts();
        if (prompts.getSystemPromptFile() != null && !prompts.getSystemPromptFile().isBlank()) {
            Path file = Path.of(prompts.getSystemPromptFile());
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                log.info("[Prompt] Loaded system prompt from {}", file);
                return content;
            } catch (IOException e) {
                log.warn("[Prompt] Failed to read {}: {}", file, e.getMessage());
            }
        }

        ClassPathResource resource = new ClassPathResource(prompts.getSystemPrompt());
        if (resource.exists()) {
            try (InputStream is = resource.getInputStream()) {
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("[Prompt] Failed to load {} from classpath: {}", prompts.getSystemPrompt(), e.getMessage());
            }
        }
        log.warn("[Prompt] No system prompt template found, using built-in default");
        return DEFAULT_PROMPT;
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline >= 0 ? trimmed.substring(0, newline) : trimmed;
    }
}
