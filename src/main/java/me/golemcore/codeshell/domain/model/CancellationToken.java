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

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between a run and the work it spawns.
 *
 * <p>
 * Cancelling a token runs its registered callbacks once, on the cancelling
 * thread, and cancels every child token. A callback registered after
 * cancellation runs immediately.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean cancel(String cancelReason) {
        String effective = cancelReason != null ? cancelReason : "cancelled";
        if (!reason.compareAndSet(null, effective)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * Registers a callback to run on cancellation and returns a handle that
     * unregisters it.
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Creates a token that is cancelled together with this one but can also be
     * cancelled on its own.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Runnable unregister = onCancel(() -> child.cancel(getReason()));
        child.onCancel(unregister);
        return child;
    }

    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new CancellationException(current);
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("[Cancel] Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
