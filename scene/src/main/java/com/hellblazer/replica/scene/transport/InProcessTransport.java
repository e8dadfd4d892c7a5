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
package com.hellblazer.replica.scene.transport;

import com.hellblazer.replica.scene.msg.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Transport that delivers every published message synchronously, on the publishing thread, to every subscriber of
 * the topic. Topic names are resolved against a namespace, so {@code ~/visual} in namespace {@code world} becomes
 * {@code /world/visual}.
 * <p>
 * Thread-safe. A failing handler is logged and does not prevent delivery to the others.
 *
 * @author hal.hildebrand
 */
public class InProcessTransport implements SceneTransport {
    private static final Logger log = LoggerFactory.getLogger(InProcessTransport.class);

    private final String                                     namespace;
    private final Map<String, List<Consumer<Object>>>        handlers = new ConcurrentHashMap<>();

    public InProcessTransport() {
        this("default");
    }

    public InProcessTransport(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace cannot be null");
    }

    @Override
    public <M> Subscription subscribe(Topic<M> topic, Consumer<? super M> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");
        var name = resolve(topic);
        Consumer<Object> typed = message -> handler.accept(topic.type().cast(message));
        handlers.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(typed);
        log.debug("Subscribed to {}", name);

        var closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                var list = handlers.get(name);
                if (list != null) {
                    list.remove(typed);
                }
            }
        };
    }

    @Override
    public <M> void publish(Topic<M> topic, M message) {
        Objects.requireNonNull(message, "message cannot be null");
        var list = handlers.get(resolve(topic));
        if (list == null) {
            return;
        }
        for (var handler : list) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                log.warn("Handler on {} failed", resolve(topic), e);
            }
        }
    }

    /**
     * @return number of live subscriptions on the topic
     */
    public int subscriberCount(Topic<?> topic) {
        var list = handlers.get(resolve(topic));
        return list == null ? 0 : list.size();
    }

    public String resolve(Topic<?> topic) {
        var name = topic.name();
        return name.startsWith("~/") ? "/" + namespace + name.substring(1) : name;
    }
}
