package me.golemcore.codeshell.adapter.outbound.model;

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
import me.golemcore.codeshell.domain.model.ModelChunk;
import me.golemcore.codeshell.domain.model.ModelRequest;
import me.golemcore.codeshell.port.outbound.ModelPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * No-op model adapter used when no model provider is configured.
 *
 * <p>
 * Always answers with a placeholder message and no tool calls, so a run ends
 * after one model turn.
 */
@Component
@Slf4j
public class NoOpModelAdapter implements ModelPort {

    static final String PLACEHOLDER = "[No model configured]";

    @Override
    public Flux<ModelChunk> completeStream(ModelRequest request) {
        log.warn("NoOpModelAdapter: completeStream() called - no model configured");
        return Flux.just(ModelChunk.text(PLACEHOLDER), ModelChunk.endOfTurn());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
