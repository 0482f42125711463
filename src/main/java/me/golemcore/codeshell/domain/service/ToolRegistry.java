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
import me.golemcore.codeshell.domain.component.ToolComponent;
import me.golemcore.codeshell.domain.exception.DuplicateToolNameException;
import me.golemcore.codeshell.domain.exception.ToolNotFoundException;
import me.golemcore.codeshell.domain.exception.ToolUnavailableException;
import me.golemcore.codeshell.domain.model.ToolDefinition;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Name to tool mapping, read-mostly.
 *
 * <p>
 * Lookups take the read lock; registration and server removal take the write
 * lock, so a lookup never sees half of a server's tool set. Remote tools are
 * additionally leased per invocation: {@link #deregisterServer(String)} first
 * refuses new leases on the server, then waits for the open ones to close,
 * and only then removes the entries.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, ServerSlot> servers = new HashMap<>();

    public ToolRegistry(List<ToolComponent> localTools) {
        for (ToolComponent tool : localTools) {
            if (tool.isEnabled()) {
                register(tool);
            } else {
                log.info("[ToolRegistry] Tool '{}' is disabled, not registering", tool.getToolName());
            }
        }
    }

    /**
     * Registers a local tool.
     *
     * @throws DuplicateToolNameException
     *             if the name is taken
     */
    public void register(ToolComponent tool) {
        lock.writeLock().lock();
        try {
            String name = tool.getToolName();
            if (entries.containsKey(name)) {
                throw new DuplicateToolNameException(name);
            }
            entries.put(name, new Entry(tool, null));
            log.debug("[ToolRegistry] Registered tool '{}'", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Registers all tools of a remote server as one unit. Nothing is registered
     * if any name collides.
     */
    public void registerServer(String serverName, List<? extends ToolComponent> tools) {
        lock.writeLock().lock();
        try {
            if (servers.containsKey(serverName)) {
                throw new IllegalStateException("Server already registered: " + serverName);
            }
            Set<String> names = new LinkedHashSet<>();
            for (ToolComponent tool : tools) {
                String name = tool.getToolName();
                if (entries.containsKey(name) || !names.add(name)) {
                    throw new DuplicateToolNameException(name);
                }
            }
            for (ToolComponent tool : tools) {
                entries.put(tool.getToolName(), new Entry(tool, serverName));
            }
            servers.put(serverName, new ServerSlot(List.copyOf(names)));
            log.info("[ToolRegistry] Registered server '{}' with tools {}", serverName, names);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a server's tools once no invocation of them is running.
     *
     * @return the removed tool names, empty if the server is unknown
     */
    public List<String> deregisterServer(String serverName) {
        ServerSlot slot;
        lock.readLock().lock();
        try {
            slot = servers.get(serverName);
        } finally {
            lock.readLock().unlock();
        }
        if (slot == null) {
            return List.of();
        }

        slot.drain(serverName);

        lock.writeLock().lock();
        try {
            if (servers.get(serverName) != slot) {
                return List.of();
            }
            servers.remove(serverName);
            for (String name : slot.toolNames) {
                entries.remove(name);
            }
            log.info("[ToolRegistry] Deregistered server '{}' ({} tools)", serverName, slot.toolNames.size());
            return slot.toolNames;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ToolComponent> lookup(String name) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(name);
            return entry != null ? Optional.of(entry.tool) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public ToolComponent require(String name) {
        return lookup(name).orElseThrow(() -> new ToolNotFoundException(name));
    }

    /**
     * Pins a tool for one invocation.
     *
     * @return empty if no such tool is registered
     * @throws ToolUnavailableException
     *             if the tool's server is being removed
     */
    public Optional<ToolLease> acquire(String name) {
        Entry entry;
        ServerSlot slot = null;
        lock.readLock().lock();
        try {
            entry = entries.get(name);
            if (entry != null && entry.serverName != null) {
                slot = servers.get(entry.serverName);
            }
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.serverName == null) {
            return Optional.of(new ToolLease(entry.tool, () -> {
            }));
        }
        if (slot == null || !slot.tryLease()) {
            throw new ToolUnavailableException("Server '" + entry.serverName + "' is disconnecting");
        }
        return Optional.of(new ToolLease(entry.tool, slot::release));
    }

    /**
     * Definitions in registration order, as advertised to the model.
     */
    public List<ToolDefinition> list() {
        lock.readLock().lock();
        try {
            List<ToolDefinition> definitions = new ArrayList<>(entries.size());
            for (Entry entry : entries.values()) {
                definitions.add(entry.tool.getDefinition());
            }
            return definitions;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> serverTools(String serverName) {
        lock.readLock().lock();
        try {
            ServerSlot slot = servers.get(serverName);
            return slot != null ? slot.toolNames : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record Entry(ToolComponent tool, String serverName) {
    }

    private static final class ServerSlot {

        private final List<String> toolNames;
        private int activeLeases;
        private boolean removing;

        private ServerSlot(List<String> toolNames) {
            this.toolNames = toolNames;
        }

        synchronized boolean tryLease() {
            if (removing) {
                return false;
            }
            activeLeases++;
            return true;
        }

        synchronized void release() {
            activeLeases--;
            if (activeLeases == 0) {
                notifyAll();
            }
        }

        synchronized void drain(String serverName) {
            removing = true;
            if (activeLeases > 0) {
                log.info("[ToolRegistry] Waiting for {} running invocation(s) on server '{}'", activeLeases,
                        serverName);
            }
            while (activeLeases > 0) {
                try {
                    wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[ToolRegistry] Interrupted while draining server '{}', removing with {} active",
                            serverName, activeLeases);
                    return;
                }
            }
        }
    }
}
