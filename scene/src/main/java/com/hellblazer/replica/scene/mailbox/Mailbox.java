/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Replica.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.replica.scene.mailbox;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffer of pending messages for one topic, between any number of producer threads and the single reconciling
 * consumer.
 * <p>
 * Producers append under a lock held only for the append. The consumer {@link #drain() drains} by swapping the
 * buffer out under the same lock, so the lock is never held while drained messages are being applied. Messages are
 * drained in arrival order.
 *
 * @param <M> message type
 * @author hal.hildebrand
 */
public class Mailbox<M> {

    private final String        topic;
    private final ReentrantLock lock     = new ReentrantLock();
    private final AtomicLong    enqueued = new AtomicLong();
    private final AtomicLong    drained  = new AtomicLong();
    private       List<M>       pending  = new ArrayList<>();

    public Mailbox(String topic) {
        this.topic = Objects.requireNonNull(topic, "topic cannot be null");
    }

    public String topic() {
        return topic;
    }

    /**
     * Append a message. Safe to call from any thread.
     *
     * @param message message to buffer
     */
    public void enqueue(M message) {
        Objects.requireNonNull(message, "message cannot be null");
        lock.lock();
        try {
            pending.add(message);
        } finally {
            lock.unlock();
        }
        enqueued.incrementAndGet();
    }

    /**
     * Append several messages, keeping their order and keeping them contiguous.
     *
     * @param messages messages to buffer
     */
    public void enqueueAll(Collection<? extends M> messages) {
        if (messages.isEmpty()) {
            return;
        }
        for (var message : messages) {
            Objects.requireNonNull(message, "message cannot be null");
        }
        lock.lock();
        try {
            pending.addAll(messages);
        } finally {
            lock.unlock();
        }
        enqueued.addAndGet(messages.size());
    }

    /**
     * Detach everything enqueued since the previous drain. Intended for the single consumer.
     *
     * @return the drained messages in arrival order, possibly empty
     */
    public List<M> drain() {
        List<M> batch;
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return List.of();
            }
            batch = pending;
            pending = new ArrayList<>();
        } finally {
            lock.unlock();
        }
        drained.addAndGet(batch.size());
        return Collections.unmodifiableList(batch);
    }

    /**
     * Discard every pending message.
     */
    public void clear() {
        lock.lock();
        try {
            pending = new ArrayList<>();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return total messages ever enqueued
     */
    public long enqueuedCount() {
        return enqueued.get();
    }

    /**
     * @return total messages ever drained
     */
    public long drainedCount() {
        return drained.get();
    }

    @Override
    public String toString() {
        return String.format("Mailbox{topic=%s, pending=%d, enqueued=%d, drained=%d}", topic, size(),
                             enqueued.get(), drained.get());
    }
}
