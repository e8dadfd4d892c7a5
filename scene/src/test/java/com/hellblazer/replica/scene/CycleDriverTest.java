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
package com.hellblazer.replica.scene;

import com.hellblazer.replica.scene.entity.Pose;
import com.hellblazer.replica.scene.msg.PoseMessage;
import com.hellblazer.replica.scene.msg.Topic;
import com.hellblazer.replica.scene.msg.VisualMessage;
import com.hellblazer.replica.scene.transport.InProcessTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CycleDriver - cycles run on the driver thread at the configured cadence.
 *
 * @author hal.hildebrand
 */
public class CycleDriverTest {

    private InProcessTransport transport;
    private SceneReplica replica;

    @BeforeEach
    public void setup() {
        transport = new InProcessTransport("driven");
        replica = new SceneReplica(SceneConfig.builder().withCyclePeriodMs(5).build(), transport);
        replica.initialize("driven");
    }

    @AfterEach
    public void teardown() {
        replica.shutdown();
    }

    @Test
    public void testDriverAppliesMessages() throws Exception {
        var applied = new CountDownLatch(1);
        try (var driver = new CycleDriver(replica, report -> {
            if (report.visualsCreated() > 0) {
                applied.countDown();
            }
        })) {
            driver.start();
            driver.start();
            assertTrue(driver.isRunning());

            transport.publish(Topic.POSE, new PoseMessage("v", Pose.at(4, 5, 6)));
            transport.publish(Topic.VISUAL, VisualMessage.update("v"));

            assertTrue(applied.await(5, TimeUnit.SECONDS), "Driver should apply the visual");
            assertEquals(Pose.at(4, 5, 6), replica.lookupVisual("v").orElseThrow().pose());
        }
    }

    @Test
    public void testDriverStopsWhenSceneShutsDown() throws Exception {
        var ticks = new AtomicInteger();
        var ticked = new CountDownLatch(3);
        try (var driver = new CycleDriver(replica, report -> {
            ticks.incrementAndGet();
            ticked.countDown();
        })) {
            driver.start();
            assertTrue(ticked.await(5, TimeUnit.SECONDS));

            replica.shutdown();
            var deadline = System.currentTimeMillis() + 5_000;
            while (driver.isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }

            assertFalse(driver.isRunning(), "Driver should stop once the scene is shut down");
            var settled = ticks.get();
            Thread.sleep(50);
            assertEquals(settled, ticks.get());
        }
    }

    @Test
    public void testFailingSinkDoesNotStopDriver() throws Exception {
        var calls = new CountDownLatch(3);
        try (var driver = new CycleDriver(replica, report -> {
            calls.countDown();
            throw new IllegalArgumentException("sink failure");
        })) {
            driver.start();

            assertTrue(calls.await(5, TimeUnit.SECONDS), "Driver keeps ticking after sink failures");
            assertTrue(driver.failureCount() >= 2);
        }
    }

    @Test
    public void testSinkIllegalStateCountedAsFailure() throws Exception {
        var calls = new CountDownLatch(3);
        try (var driver = new CycleDriver(replica, report -> {
            calls.countDown();
            throw new IllegalStateException("sink not ready");
        })) {
            driver.start();

            assertTrue(calls.await(5, TimeUnit.SECONDS), "Sink failures must not stop a running scene's driver");
            assertTrue(driver.isRunning());
            assertTrue(driver.failureCount() >= 2);
        }
    }
}
