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
import me.golemcore.codeshell.domain.model.AssistantTurn;
import me.golemcore.codeshell.domain.model.ToolCallTurn;
import me.golemcore.codeshell.domain.model.ToolResult;
import me.golemcore.codeshell.domain.model.ToolResultTurn;
import me.golemcore.codeshell.domain.model.Turn;
import me.golemcore.codeshell.domain.model.UserTurn;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only transcript of the session. Single point of mutation for turns.
 *
 * <p>
 * All mutations are serialized behind one lock, so readers never observe an
 * interleaved or half-written turn. The only turn that changes after being
 * appended is a streaming {@link AssistantTurn}: its slot is replaced with a
 * longer copy on every delta until it is finished. Snapshots are immutable.
 *
 * <p>
 * Invariants enforced here:
 * <ul>
 * <li>a tool result references a tool call of the same run</li>
 * <li>a call id has at most one result</li>
 * <li>a sealed run accepts no further turns</li>
 * </ul>
 */
@Service
@Slf4j
public class ConversationState {

    private final Clock clock;
    private final Object lock = new Object();

    private final List<Turn> turns = new ArrayList<>();
    private final Map<String, Integer> openAssistantSlots = new HashMap<>();
    private final Map<String, ToolCallTurn> callsByKey = new LinkedHashMap<>();
    private final Set<String> resolvedCallKeys = new HashSet<>();
    private final Set<String> sealedRuns = new HashSet<>();
    private long nextTurnId = 1;

    public ConversationState(Clock clock) {
        this.clock = clock;
    }

    public UserTurn appendUser(String runId, String text) {
        synchronized (lock) {
            ensureOpen(runId);
            UserTurn turn = new UserTurn(newTurnId(), runId, clock.instant(), text);
            turns.add(turn);
            return turn;
        }
    }

    /**
     * Opens a streaming assistant turn with empty text.
     *
     * @return the new turn id
     */
    public String beginAssistant(String runId) {
        synchronized (lock) {
            ensureOpen(runId);
            AssistantTurn turn = new AssistantTurn(newTurnId(), runId, clock.instant(), "", false);
            openAssistantSlots.put(turn.id(), turns.size());
            turns.add(turn);
            return turn.id();
        }
    }

    public AssistantTurn appendAssistantDelta(String turnId, String delta) {
        synchronized (lock) {
            int slot = requireOpenAssistant(turnId);
            AssistantTurn current = (AssistantTurn) turns.get(slot);
            ensureOpen(current.runId());
            AssistantTurn grown = current.withAppendedText(delta != null ? delta : "");
            turns.set(slot, grown);
            return grown;
        }
    }

    public AssistantTurn finishAssistant(String turnId) {
        synchronized (lock) {
            int slot = requireOpenAssistant(turnId);
            AssistantTurn finished = ((AssistantTurn) turns.get(slot)).asFinished();
            turns.set(slot, finished);
            openAssistantSlots.remove(turnId);
            return finished;
        }
    }

    /**
     * Appends a complete, already finished assistant message.
     */
    public AssistantTurn appendAssistant(String runId, String text) {
        synchronized (lock) {
            ensureOpen(runId);
            AssistantTurn turn = new AssistantTurn(newTurnId(), runId, clock.instant(), text, true);
            turns.add(turn);
            return turn;
        }
    }

    public ToolCallTurn appendToolCall(String runId, String callId, String toolName, Map<String, Object> arguments) {
        synchronized (lock) {
            ensureOpen(runId);
            String key = callKey(runId, callId);
            if (callsByKey.containsKey(key)) {
                throw new IllegalStateException("Duplicate tool call id in run " + runId + ": " + callId);
            }
            Map<String, Object> argsCopy = arguments != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                    : Map.of();
            ToolCallTurn turn = new ToolCallTurn(newTurnId(), runId, clock.instant(), callId, toolName, argsCopy);
            callsByKey.put(key, turn);
            turns.add(turn);
            return turn;
        }
    }

    public ToolResultTurn appendToolResult(String runId, String callId, ToolResult result) {
        synchronized (lock) {
            ensureOpen(runId);
            return appendResultLocked(runId, callId, result);
        }
    }

    /**
     * Calls of the run that have no result yet, in call order.
     */
    public List<ToolCallTurn> pendingToolCalls(String runId) {
        synchronized (lock) {
            List<ToolCallTurn> pending = new ArrayList<>();
            for (Map.Entry<String, ToolCallTurn> entry : callsByKey.entrySet()) {
                if (entry.getValue().runId().equals(runId) && !resolvedCallKeys.contains(entry.getKey())) {
                    pending.add(entry.getValue());
                }
            }
            return pending;
        }
    }

    /**
     * Resolves every pending call of the run with a cancelled marker and
     * finishes its streaming assistant turn, if any. Works on sealed runs too.
     *
     * @return the markers that were appended
     */
    public List<ToolResultTurn> markPendingCancelled(String runId, String reason) {
        synchronized (lock) {
            finishOpenAssistantLocked(runId);
            List<ToolResultTurn> markers = new ArrayList<>();
            for (ToolCallTurn call : pendingToolCalls(runId)) {
                markers.add(appendResultLocked(runId, call.callId(), ToolResult.cancelled(reason)));
            }
            if (!markers.isEmpty()) {
                log.info("[Conversation] Marked {} pending call(s) of run {} as cancelled", markers.size(), runId);
            }
            return markers;
        }
    }

    /**
     * Finishes the run's streaming assistant turn, if one is open.
     */
    public void finishOpenAssistant(String runId) {
        synchronized (lock) {
            finishOpenAssistantLocked(runId);
        }
    }

    /**
     * Closes the run for further appends. A run that still has an open
     * assistant turn or pending calls is resolved first.
     */
    public void sealRun(String runId, String reason) {
        synchronized (lock) {
            markPendingCancelled(runId, reason);
            sealedRuns.add(runId);
        }
    }

    public boolean isSealed(String runId) {
        synchronized (lock) {
            return sealedRuns.contains(runId);
        }
    }

    public List<Turn> snapshot() {
        synchronized (lock) {
            return List.copyOf(turns);
        }
    }

    public List<Turn> snapshot(String runId) {
        synchronized (lock) {
            return turns.stream().filter(turn -> turn.runId().equals(runId)).toList();
        }
    }

    public int size() {
        synchronized (lock) {
            return turns.size();
        }
    }

    private ToolResultTurn appendResultLocked(String runId, String callId, ToolResult result) {
        String key = callKey(runId, callId);
        ToolCallTurn call = callsByKey.get(key);
        if (call == null) {
            throw new IllegalStateException("Tool result for unknown call in run " + runId + ": " + callId);
        }
        if (!resolvedCallKeys.add(key)) {
            throw new IllegalStateException("Tool call already has a result in run " + runId + ": " + callId);
        }
        ToolResultTurn turn = new ToolResultTurn(newTurnId(), runId, clock.instant(), callId, call.toolName(),
                result);
        turns.add(turn);
        return turn;
    }

    private void finishOpenAssistantLocked(String runId) {
        List<String> toFinish = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : openAssistantSlots.entrySet()) {
            if (turns.get(entry.getValue()).runId().equals(runId)) {
                toFinish.add(entry.getKey());
            }
        }
        for (String turnId : toFinish) {
            int slot = openAssistantSlots.remove(turnId);
            turns.set(slot, ((AssistantTurn) turns.get(slot)).asFinished());
        }
    }

    private int requireOpenAssistant(String turnId) {
        Integer slot = openAssistantSlots.get(turnId);
        if (slot == null) {
            throw new IllegalStateException("No streaming assistant turn: " + turnId);
        }
        return slot;
    }

    private void ensureOpen(String runId) {
        if (sealedRuns.contains(runId)) {
            throw new IllegalStateException("Run is sealed: " + runId);
        }
    }

    private String newTurnId() {
        return "t" + nextTurnId++;
    }

    private static String callKey(String runId, String callId) {
        return runId + "/" + callId;
    }
}
