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

import me.golemcore.codeshell.domain.model.ModelChunk;
import me.golemcore.codeshell.domain.model.ModelRequest;
import reactor.core.publisher.Flux;

/**
 * Port for the model collaborator. The provider's wire protocol lives behind
 * this interface.
 */
public interface ModelPort {

    /**
     * Streams one model turn. The stream ends with an
     * {@link ModelChunk.Type#END_OF_TURN} chunk and cannot be resumed once
     * interrupted; a new call re-sends the whole transcript.
     */
    Flux<ModelChunk> completeStream(ModelRequest request);

    /**
     * Checks if the model provider is configured and reachable.
     */
    boolean isAvailable();
}
