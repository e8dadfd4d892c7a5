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

import com.hellblazer.replica.scene.entity.Pose;
import com.hellblazer.replica.scene.msg.PoseMessage;
import com.hellblazer.replica.scene.msg.SelectionMessage;
import com.hellblazer.replica.scene.msg.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InProcessTransport.
 *
 * @author hal.hildebrand
 */
public class InProcessTransportTest {

    private InProcessTransport transport;

    @BeforeEach
    public void setup() {
        transport = new InProcessTransport("world");
    }

    @Test
    public void testNamespaceResolution() {
        assertEquals("/world/visual", transport.resolve(Topic.VISUAL));
        assertEquals("/absolute", transport.resolve(new Topic<>("/absolute", String.class)));
    }

    @Test
    public void testDeliveryToSubscribersOfTopicOnly() {
        var poses = new ArrayList<PoseMessage>();
        var selections = new ArrayList<SelectionMessage>();
        transport.subscribe(Topic.POSE, poses::add);
        transport.subscribe(Topic.SELECTION, selections::add);

        var message = new PoseMessage("v", Pose.at(1, 2, 3));
        transport.publish(Topic.POSE, message);

        assertEquals(1, poses.size());
        assertSame(message, poses.get(0));
        assertTrue(selections.isEmpty());
    }

    @Test
    public void testCloseStopsDelivery() {
        var received = new ArrayList<SelectionMessage>();
        var subscription = transport.subscribe(Topic.SELECTION, received::add);
        assertEquals(1, transport.subscriberCount(Topic.SELECTION));

        subscription.close();
        subscription.close();
        transport.publish(Topic.SELECTION, SelectionMessage.of("v"));

        assertTrue(received.isEmpty());
        assertEquals(0, transport.subscriberCount(Topic.SELECTION));
    }

    @Test
    public void testFailingHandlerIsolated() {
        var received = new ArrayList<SelectionMessage>();
        transport.subscribe(Topic.SELECTION, message -> {
            throw new IllegalStateException("boom");
        });
        transport.subscribe(Topic.SELECTION, received::add);

        transport.publish(Topic.SELECTION, SelectionMessage.none());

        assertEquals(1, received.size());
    }

    @Test
    public void testPublishWithoutSubscribers() {
        assertDoesNotThrow(() -> transport.publish(Topic.POSE, new PoseMessage("v", Pose.IDENTITY)));
    }
}
