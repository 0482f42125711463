package me.golemcore.codeshell.domain.loop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.codeshell.domain.model.ModelChunk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects the tool calls of one model turn in emission order.
 *
 * <p>
 * Argument fragments are only concatenated and parsed when the turn ends;
 * nothing is executed on partial arguments. Calls without an id, or with an
 * id already used in the run, get a generated one.
 */
final class ToolCallAccumulator {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final String runId;
    private final Set<String> usedIds;
    private final List<PendingCall> calls = new ArrayList<>();
    private final Map<Integer, PendingCall> byIndex = new HashMap<>();

    ToolCallAccumulator(ObjectMapper objectMapper, String runId, Set<String> usedIds) {
        this.objectMapper = objectMapper;
        this.runId = runId;
        this.usedIds = usedIds;
    }

    void accept(ModelChunk chunk) {
        if (chunk.getType() == ModelChunk.Type.TOOL_CALL) {
            PendingCall call = new PendingCall(chunk.getToolCallId(), chunk.getToolName());
            call.complete = chunk.getArguments() != null ? new LinkedHashMap<>(chunk.getArguments())
                    : new LinkedHashMap<>();
            calls.add(call);
            return;
        }
        if (chunk.getType() != ModelChunk.Type.TOOL_CALL_DELTA) {
            return;
        }
        int index = chunk.getIndex() != null ? chunk.getIndex() : calls.size();
        PendingCall call = byIndex.get(index);
        if (call == null) {
            call = new PendingCall(chunk.getToolCallId(), chunk.getToolName());
            byIndex.put(index, call);
            calls.add(call);
        } else {
            if (call.id == null) {
                call.id = chunk.getToolCallId();
            }
            if (call.name == null) {
                call.name = chunk.getToolName();
            }
        }
        if (chunk.getArgumentsFragment() != null) {
            call.fragments.append(chunk.getArgumentsFragment());
        }
    }

    boolean isEmpty() {
        return calls.isEmpty();
    }

    /**
     * Finalizes the turn's calls in emission order.
     */
    List<ParsedToolCall> drain() {
        List<ParsedToolCall> parsed = new ArrayList<>(calls.size());
        Set<String> turnIds = new HashSet<>();
        for (PendingCall call : calls) {
            String id = call.id;
            if (id == null || id.isBlank() || usedIds.contains(id) || !turnIds.add(id)) {
                id = generateId();
                turnIds.add(id);
            }
            usedIds.add(id);
            String name = call.name != null ? call.name : "";

            if (call.complete != null) {
                parsed.add(new ParsedToolCall(id, name, call.complete, null));
                continue;
            }
            String raw = call.fragments.toString().strip();
            if (raw.isEmpty()) {
                parsed.add(new ParsedToolCall(id, name, new LinkedHashMap<>(), null));
                continue;
            }
            try {
                LinkedHashMap<String, Object> arguments = objectMapper.readValue(raw, MAP_TYPE_REF);
                parsed.add(new ParsedToolCall(id, name, arguments != null ? arguments : new LinkedHashMap<>(),
                        null));
            } catch (JsonProcessingException e) {
                parsed.add(new ParsedToolCall(id, name, Map.of("raw", raw),
                        "Malformed tool call arguments: " + e.getOriginalMessage()));
            }
        }
        calls.clear();
        byIndex.clear();
        return parsed;
    }

    private String generateId() {
        String candidate;
        int n = usedIds.size() + 1;
        do {
            candidate = runId + "-call-" + n++;
        } while (usedIds.contains(candidate));
        return candidate;
    }

    /**
     * A tool call ready for dispatch. {@code parseError} is set when the
     * streamed arguments were not a JSON object.
     */
    record ParsedToolCall(String id, String name, Map<String, Object> arguments, String parseError) {

        boolean isMalformed() {
            return parseError != null;
        }
    }

    private static final class PendingCall {
        private String id;
        private String name;
        private Map<String, Object> complete;
        private final StringBuilder fragments = new StringBuilder();

        private PendingCall(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
