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

import java.util.function.Consumer;

/**
 * Publish/subscribe transport the scene replica is attached to. Delivery is at most once and may be out of order;
 * handlers may be invoked concurrently from any thread.
 *
 * @author hal.hildebrand
 */
public interface SceneTransport {

    /**
     * Register a handler for a topic.
     *
     * @param topic   topic to listen on
     * @param handler receives each decoded message
     * @return handle that cancels the subscription
     */
    <M> Subscription subscribe(Topic<M> topic, Consumer<? super M> handler);

    /**
     * Publish a message on a topic.
     */
    <M> void publish(Topic<M> topic, M message);
}
