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

import java.time.Instant;

/**
 * Assistant message. While {@code finished} is false the conversation keeps
 * replacing this turn with a copy holding longer text; once finished it is
 * frozen.
 */
public record AssistantTurn(String id, String runId, Instant timestamp, String text, boolean finished)
        implements Turn {

    public AssistantTurn withAppendedText(String delta) {
        return new AssistantTurn(id, runId, timestamp, text + delta, false);
    }

    public AssistantTurn asFinished() {
        return new AssistantTurn(id, runId, timestamp, text, true);
    }
}
