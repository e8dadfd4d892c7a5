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

import com.hellblazer.replica.scene.entity.EntityRegistry;
import com.hellblazer.replica.scene.entity.Light;
import com.hellblazer.replica.scene.entity.PoseReconciler;
import com.hellblazer.replica.scene.entity.SceneChangeListener;
import com.hellblazer.replica.scene.entity.Visual;
import com.hellblazer.replica.scene.mailbox.Mailbox;
import com.hellblazer.replica.scene.msg.InboundMessage;
import com.hellblazer.replica.scene.msg.LightMessage;
import com.hellblazer.replica.scene.msg.MalformedMessageException;
import com.hellblazer.replica.scene.msg.PoseMessage;
import com.hellblazer.replica.scene.msg.PublishRequest;
import com.hellblazer.replica.scene.msg.SceneMessage;
import com.hellblazer.replica.scene.msg.SelectionMessage;
import com.hellblazer.replica.scene.msg.Topic;
import com.hellblazer.replica.scene.msg.VisualMessage;
import com.hellblazer.replica.scene.transport.SceneTransport;
import com.hellblazer.replica.scene.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Color4f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Client-side replica of a remotely authoritative scene.
 * <p>
 * Transport threads deliver visual, light, pose, selection and whole-scene messages concurrently; each is appended
 * to the mailbox of its topic and nothing else happens on the delivering thread. Once per tick the consumer calls
 * {@link #runCycle()}, which drains and applies the mailboxes in a fixed order:
 * <ol>
 *   <li>visuals: delete, or create/merge</li>
 *   <li>lights: create, then merge or ignore per {@link SceneConfig#isMergeLightUpdates()}</li>
 *   <li>poses: apply, or stage when the visual is unknown</li>
 *   <li>one resolve pass over the staged poses</li>
 *   <li>selection: select the target if registered, otherwise select nothing</li>
 *   <li>ambient color</li>
 * </ol>
 * The apply phase runs under the write half of a read/write lock; every read ({@link #lookupVisual(String)},
 * {@link #read(Function)}, ...) runs under the read half, so readers never observe a half-applied cycle and
 * producers never wait for one. Malformed messages are reported to the {@link ApplyDiagnostics} and skipped.
 *
 * @author hal.hildebrand
 */
public class SceneReplica implements SceneView {
    private static final Logger log = LoggerFactory.getLogger(SceneReplica.class);

    private enum State {
        NEW, RUNNING, SHUTDOWN
    }

    private final SceneConfig                    config;
    private final SceneTransport                 transport;
    private final ApplyDiagnostics               diagnostics;
    private final Mailbox<VisualMessage>         visualMailbox = new Mailbox<>(Topic.VISUAL.name());
    private final Mailbox<LightMessage>          lightMailbox  = new Mailbox<>(Topic.LIGHT.name());
    private final Mailbox<PoseMessage>           poseMailbox   = new Mailbox<>(Topic.POSE.name());
    private final SelectionState                 selection     = new SelectionState();
    private final AtomicReference<SceneMessage>  pendingAmbient = new AtomicReference<>();
    private final PoseReconciler                 reconciler;
    private final EntityRegistry                 registry;
    private final SceneView                      view;
    private final ReentrantReadWriteLock         lock          = new ReentrantReadWriteLock();
    private final List<Subscription>             subscriptions = new ArrayList<>();
    private final List<SelectionListener>        selectionListeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<State>         state         = new AtomicReference<>(State.NEW);
    private volatile String                      name;
    private          Color4f                     ambient;
    private          long                        cycles;

    public SceneReplica(SceneConfig config, SceneTransport transport) {
        this(config, transport, new LoggingApplyDiagnostics());
    }

    public SceneReplica(SceneConfig config, SceneTransport transport, ApplyDiagnostics diagnostics) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics cannot be null");
        this.reconciler = new PoseReconciler(config.getStagedPoseTtlCycles());
        this.registry = new EntityRegistry(reconciler);
        this.view = new RegistryView();
    }

    /**
     * Subscribe to the scene topics and, unless disabled, ask the authority to publish its current state.
     *
     * @param name scene name
     * @throws IllegalStateException if already initialized or shut down
     */
    public void initialize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scene name cannot be blank");
        }
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Scene cannot be initialized in state " + state.get());
        }
        this.name = name;

        synchronized (subscriptions) {
            subscriptions.add(transport.subscribe(Topic.SCENE, this::receiveScene));
            subscriptions.add(transport.subscribe(Topic.VISUAL, this::receiveVisual));
            subscriptions.add(transport.subscribe(Topic.LIGHT, this::receiveLight));
            subscriptions.add(transport.subscribe(Topic.POSE, this::receivePose));
            subscriptions.add(transport.subscribe(Topic.SELECTION, this::receiveSelection));
        }

        if (config.isRequestStateOnInitialize()) {
            log.info("Scene {} requesting current state", name);
            transport.publish(Topic.PUBLISH_SCENE, PublishRequest.PUBLISH);
        }
        log.info("Scene {} initialized: {}", name, config);
    }

    /**
     * Fan a whole-scene message out to the visual, pose and light mailboxes and latch its ambient color.
     */
    public void receiveScene(SceneMessage message) {
        if (isShutdown()) {
            return;
        }
        visualMailbox.enqueueAll(message.visuals());
        poseMailbox.enqueueAll(message.poses());
        lightMailbox.enqueueAll(message.lights());
        if (message.ambient() != null) {
            pendingAmbient.set(message);
        }
    }

    public void receiveVisual(VisualMessage message) {
        if (!isShutdown()) {
            visualMailbox.enqueue(message);
        }
    }

    public void receiveLight(LightMessage message) {
        if (!isShutdown()) {
            lightMailbox.enqueue(message);
        }
    }

    public void receivePose(PoseMessage message) {
        if (!isShutdown()) {
            poseMailbox.enqueue(message);
        }
    }

    public void receiveSelection(SelectionMessage message) {
        if (!isShutdown()) {
            selection.offer(message);
        }
    }

    /**
     * Drain every mailbox and apply its contents. Called once per tick by the single consumer.
     *
     * @return what the cycle did
     * @throws IllegalStateException if the scene is not initialized or already shut down
     */
    public CycleReport runCycle() {
        var tally = new CycleReport.Tally();
        String previousSelection;
        String currentSelection;
        CycleReport report;

        lock.writeLock().lock();
        try {
            var current = state.get();
            if (current != State.RUNNING) {
                throw new IllegalStateException("Cannot run a cycle in state " + current);
            }
            var cycle = ++cycles;
            previousSelection = selection.current().orElse(null);

            applyVisuals(visualMailbox.drain(), tally);
            applyLights(lightMailbox.drain(), tally);
            applyPoses(poseMailbox.drain(), tally);

            var resolution = reconciler.tryResolve(registry);
            tally.posesResolved = resolution.resolved();
            tally.posesEvicted = resolution.evicted();

            tally.selectionChanged = selection.resolve(registry);
            currentSelection = selection.current().orElse(null);

            applyAmbient(tally);
            report = tally.toReport(cycle, reconciler.size());
        } finally {
            lock.writeLock().unlock();
        }

        if (report.selectionChanged()) {
            for (var listener : selectionListeners) {
                try {
                    listener.onSelectionChanged(previousSelection, currentSelection);
                } catch (RuntimeException e) {
                    log.warn("Selection listener {} failed", listener, e);
                }
            }
        }
        if (report.hasActivity()) {
            log.debug("Scene {} {}", name, report);
        }
        return report;
    }

    /**
     * Unsubscribe and release every entity, pending message and staged pose. Idempotent.
     */
    public void shutdown() {
        if (state.getAndSet(State.SHUTDOWN) == State.SHUTDOWN) {
            return;
        }
        synchronized (subscriptions) {
            for (var subscription : subscriptions) {
                subscription.close();
            }
            subscriptions.clear();
        }
        lock.writeLock().lock();
        try {
            visualMailbox.clear();
            lightMailbox.clear();
            poseMailbox.clear();
            pendingAmbient.set(null);
            selection.clear();
            registry.clear();
            ambient = null;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Scene {} shut down after {} cycles", name, cycles);
    }

    /**
     * Run a traversal of the scene under the read lock. The view passed to the reader must not escape it.
     *
     * @param reader traversal to run
     * @return the reader's result
     */
    public <T> T read(Function<SceneView, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Visual> lookupVisual(String visualId) {
        return read(v -> v.lookupVisual(visualId));
    }

    @Override
    public Optional<Light> lookupLight(String lightId) {
        return read(v -> v.lookupLight(lightId));
    }

    @Override
    public Optional<String> currentSelection() {
        return read(SceneView::currentSelection);
    }

    @Override
    public List<Visual> enumerateRoots() {
        return read(SceneView::enumerateRoots);
    }

    @Override
    public List<Visual> children(String visualId) {
        return read(v -> v.children(visualId));
    }

    @Override
    public Optional<Color4f> ambientColor() {
        return read(SceneView::ambientColor);
    }

    @Override
    public int visualCount() {
        return read(SceneView::visualCount);
    }

    @Override
    public int lightCount() {
        return read(SceneView::lightCount);
    }

    /**
     * @return number of poses waiting for their visual
     */
    public int pendingPoseCount() {
        lock.readLock().lock();
        try {
            return reconciler.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void addSceneChangeListener(SceneChangeListener listener) {
        registry.addListener(listener);
    }

    public void removeSceneChangeListener(SceneChangeListener listener) {
        registry.removeListener(listener);
    }

    public void addSelectionListener(SelectionListener listener) {
        selectionListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeSelectionListener(SelectionListener listener) {
        selectionListeners.remove(listener);
    }

    public String name() {
        return name;
    }

    public SceneConfig config() {
        return config;
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    private boolean isShutdown() {
        return state.get() == State.SHUTDOWN;
    }

    private void applyVisuals(List<VisualMessage> batch, CycleReport.Tally tally) {
        for (var message : batch) {
            if (!validate(Topic.VISUAL, message, tally)) {
                continue;
            }
            if (message.isDelete()) {
                if (registry.removeVisual(message.id())) {
                    tally.visualsRemoved++;
                }
                continue;
            }
            switch (registry.upsertVisual(message.id(), message.parentId(), message.attributes())) {
                case CREATED -> tally.visualsCreated++;
                case UPDATED -> tally.visualsUpdated++;
                case IGNORED -> {
                }
            }
        }
    }

    private void applyLights(List<LightMessage> batch, CycleReport.Tally tally) {
        for (var message : batch) {
            if (!validate(Topic.LIGHT, message, tally)) {
                continue;
            }
            switch (registry.upsertLight(message.id(), message.parameters(), config.isMergeLightUpdates())) {
                case CREATED -> tally.lightsCreated++;
                case UPDATED -> tally.lightsUpdated++;
                case IGNORED -> tally.lightsIgnored++;
            }
        }
    }

    private void applyPoses(List<PoseMessage> batch, CycleReport.Tally tally) {
        for (var message : batch) {
            if (!validate(Topic.POSE, message, tally)) {
                continue;
            }
            if (registry.applyPose(message.id(), message.pose())) {
                tally.posesApplied++;
            } else {
                tally.posesStaged++;
            }
        }
    }

    private void applyAmbient(CycleReport.Tally tally) {
        var message = pendingAmbient.getAndSet(null);
        if (message != null && validate(Topic.SCENE, message, tally)) {
            ambient = message.ambient();
        }
    }

    private boolean validate(Topic<?> topic, InboundMessage message, CycleReport.Tally tally) {
        try {
            message.validate();
            return true;
        } catch (MalformedMessageException e) {
            tally.rejected++;
            try {
                diagnostics.onRejected(topic, message, e);
            } catch (RuntimeException diagnosticsFailure) {
                log.warn("Diagnostics failed while reporting {}", message, diagnosticsFailure);
            }
            return false;
        }
    }

    /**
     * Unlocked view over the registry, handed to readers that already hold the read lock.
     */
    private final class RegistryView implements SceneView {

        @Override
        public Optional<Visual> lookupVisual(String visualId) {
            return registry.lookupVisual(visualId);
        }

        @Override
        public Optional<Light> lookupLight(String lightId) {
            return registry.lookupLight(lightId);
        }

        @Override
        public Optional<String> currentSelection() {
            return selection.current();
        }

        @Override
        public List<Visual> enumerateRoots() {
            return registry.enumerateRoots();
        }

        @Override
        public List<Visual> children(String visualId) {
            return registry.children(visualId);
        }

        @Override
        public Optional<Color4f> ambientColor() {
            return ambient == null ? Optional.empty() : Optional.of(new Color4f(ambient));
        }

        @Override
        public int visualCount() {
            return registry.visualCount();
        }

        @Override
        public int lightCount() {
            return registry.lightCount();
        }
    }
}
