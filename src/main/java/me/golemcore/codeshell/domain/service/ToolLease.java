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

import me.golemcore.codeshell.domain.component.ToolComponent;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pins a tool for the duration of one invocation. While any lease on a remote
 * server's tool is open, that server cannot be deregistered.
 */
public final class ToolLease implements AutoCloseable {

    private final ToolComponent tool;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    ToolLease(ToolComponent tool, Runnable onRelease) {
        this.tool = tool;
        this.onRelease = onRelease;
    }

    public ToolComponent tool() {
        return tool;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }
}
