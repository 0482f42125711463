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
import me.golemcore.codeshell.domain.model.StreamEvent;
import me.golemcore.codeshell.domain.model.StreamEventType;
import me.golemcore.codeshell.infrastructure.config.ShellProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered fan-out of stream events to panes (chat, editor, terminal).
 *
 * <p>
 * Publishing assigns a global sequence number and enqueues the event on every
 * subscriber's buffer under one lock, so all panes see one order. Delivery
 * happens on a per-subscriber drain task; publishing never waits on a pane.
 *
 * <p>
 * When a buffer is full, the oldest coalescable delta that has a later delta
 * of the same stream is merged with it, so text is never lost. Other events
 * are never dropped: with nothing left to merge the buffer grows past its
 * capacity and a warning is logged.
 */
@Service
@Slf4j
public class StreamBroker {

    private final Executor deliveryExecutor;
    private final Clock clock;
    private final int capacity;

    private static final int MAX_ENDED_RUNS = 1024;

    private final Object publishLock = new Object();
    private final Set<String> endedRuns = new LinkedHashSet<>();
    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private long nextSequence = 1;

    public StreamBroker(ShellProperties properties, @Qualifier("paneDeliveryExecutor") ExecutorService executor,
            Clock clock) {
        this(executor, clock, properties.getBroker().getSubscriberBuffer());
    }

    // Visible for testing
    public StreamBroker(Executor deliveryExecutor, Clock clock, int capacity) {
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
        this.capacity = Math.max(1, capacity);
    }

    /**
     * Stamps the event with its sequence number and queues it for every current
     * subscriber. Events of a run that already published its terminal event
     * are dropped.
     *
     * @return the sequenced event, or {@code null} if it was dropped
     */
    public StreamEvent publish(StreamEvent event) {
        List<Subscriber> toDrain;
        StreamEvent sequenced;
        synchronized (publishLock) {
            if (event.runId() != null && endedRuns.contains(event.runId())) {
                log.debug("[StreamBroker] Dropping {} for ended run {}", event.type(), event.runId());
                return null;
            }
            if (event.runId() != null && isTerminal(event.type())) {
                markEnded(event.runId());
            }
            sequenced = event.toBuilder()
                    .sequence(nextSequence++)
                    .timestamp(event.timestamp() != null ? event.timestamp() : clock.instant())
                    .build();
            for (Subscriber subscriber : subscribers) {
                subscriber.offer(sequenced);
            }
            toDrain = List.copyOf(subscribers);
        }
        for (Subscriber subscriber : toDrain) {
            subscriber.scheduleDrain();
        }
        return sequenced;
    }

    private static boolean isTerminal(StreamEventType type) {
        return type == StreamEventType.RUN_FINISHED || type == StreamEventType.RUN_FAILED;
    }

    private void markEnded(String runId) {
        endedRuns.add(runId);
        if (endedRuns.size() > MAX_ENDED_RUNS) {
            Iterator<String> oldest = endedRuns.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    public PaneSubscription subscribe(String paneName, PaneListener listener) {
        Subscriber subscriber = new Subscriber(paneName, listener);
        synchronized (publishLock) {
            subscribers.add(subscriber);
        }
        log.debug("[StreamBroker] Pane '{}' subscribed", paneName);
        return subscriber;
    }

    /**
     * Reactive view of a pane feed. Cancelling the subscription unsubscribes
     * the pane.
     */
    public Flux<StreamEvent> feed(String paneName) {
        return Flux.create(sink -> {
            PaneSubscription subscription = subscribe(paneName, sink::next);
            sink.onDispose(subscription::close);
        });
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    private final class Subscriber implements PaneSubscription {

        private final String paneName;
        private final PaneListener listener;
        private final Deque<StreamEvent> buffer = new ArrayDeque<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        private volatile boolean active = true;

        private Subscriber(String paneName, PaneListener listener) {
            this.paneName = paneName;
            this.listener = listener;
        }

        void offer(StreamEvent event) {
            synchronized (buffer) {
                if (!active) {
                    return;
                }
                if (buffer.size() >= capacity && coalesce(event)) {
                    return;
                }
                buffer.addLast(event);
                if (buffer.size() > capacity) {
                    log.warn("[StreamBroker] Pane '{}' is {} events behind (capacity {}), nothing to coalesce",
                            paneName, buffer.size(), capacity);
                }
            }
        }

        /**
         * Frees one slot by merging the oldest coalescable delta with the next
         * delta of the same stream, or absorbs the incoming event into the
         * oldest queued delta of its stream.
         *
         * @return true if the incoming event was absorbed
         */
        private boolean coalesce(StreamEvent incoming) {
            for (StreamEvent oldest : buffer) {
                if (!oldest.isCoalescable()) {
                    continue;
                }
                Iterator<StreamEvent> later = buffer.iterator();
                boolean passedOldest = false;
                while (later.hasNext()) {
                    StreamEvent candidate = later.next();
                    if (candidate == oldest) {
                        passedOldest = true;
                        continue;
                    }
                    if (passedOldest && oldest.sameStreamAs(candidate)) {
                        later.remove();
                        replace(oldest, oldest.mergedWith(candidate));
                        return false;
                    }
                }
                if (oldest.sameStreamAs(incoming)) {
                    replace(oldest, oldest.mergedWith(incoming));
                    return true;
                }
            }
            return false;
        }

        private void replace(StreamEvent existing, StreamEvent merged) {
            Deque<StreamEvent> rebuilt = new ArrayDeque<>(buffer.size());
            for (StreamEvent event : buffer) {
                rebuilt.addLast(event == existing ? merged : event);
            }
            buffer.clear();
            buffer.addAll(rebuilt);
        }

        void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("[StreamBroker] Delivery to pane '{}' rejected: {}", paneName, e.getMessage());
            }
        }

        private void drain() {
            while (true) {
                StreamEvent next;
                synchronized (buffer) {
                    next = active ? buffer.pollFirst() : null;
                    if (next == null) {
                        draining.set(false);
                        return;
                    }
                }
                deliver(next);
            }
        }

        private void deliver(StreamEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[StreamBroker] Pane '{}' failed on event #{} ({}): {}", paneName, event.sequence(),
                        event.type(), e.getMessage(), e);
            }
        }

        @Override
        public String getPaneName() {
            return paneName;
        }

        @Override
        public int getBacklog() {
            synchronized (buffer) {
                return buffer.size();
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            synchronized (publishLock) {
                subscribers.remove(this);
            }
            synchronized (buffer) {
                active = false;
                buffer.clear();
            }
            log.debug("[StreamBroker] Pane '{}' unsubscribed", paneName);
        }
    }
}
