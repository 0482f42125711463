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

import java.util.Map;

/**
 * One element of a streamed model response.
 *
 * <p>
 * A tool call arrives either whole ({@link Type#TOOL_CALL}) or as argument
 * fragments ({@link Type#TOOL_CALL_DELTA}) correlated by {@code index}; the
 * fragments are only parsed once the turn ends.
 */
@Data
@Builder
public class ModelChunk {

    public enum Type {
        TEXT_DELTA, TOOL_CALL_DELTA, TOOL_CALL, END_OF_TURN
    }

    private Type type;
    private String text;
    private Integer index;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private String argumentsFragment;

    public static ModelChunk text(String text) {
        return ModelChunk.builder().type(Type.TEXT_DELTA).text(text).build();
    }

    public static ModelChunk toolCall(String id, String name, Map<String, Object> arguments) {
        return ModelChunk.builder()
                .type(Type.TOOL_CALL)
                .toolCallId(id)
                .toolName(name)
                .arguments(arguments)
                .build();
    }

    public static ModelChunk toolCallDelta(int index, String id, String name, String argumentsFragment) {
        return ModelChunk.builder()
                .type(Type.TOOL_CALL_DELTA)
                .index(index)
                .toolCallId(id)
                .toolName(name)
                .argumentsFragment(argumentsFragment)
                .build();
    }

    public static ModelChunk endOfTurn() {
        return ModelChunk.builder().type(Type.END_OF_TURN).build();
    }
}
