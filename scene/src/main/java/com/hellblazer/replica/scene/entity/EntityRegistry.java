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
package com.hellblazer.replica.scene.entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns every live visual and light of a scene, keyed by identifier.
 * <p>
 * Visuals and lights live in separate namespaces, so a visual and a light may share an identifier. The visual
 * hierarchy is recorded by identifier: each visual remembers the parent it was attached to and the identifiers of
 * its children. Removing a visual detaches it from its parent but leaves its own children in place; those children
 * keep their parent identifier and surface in {@link #enumerateRoots()} until they are removed themselves.
 * <p>
 * Poses for visuals that do not exist yet are handed to the {@link PoseReconciler} instead of failing.
 * <p>
 * Not thread-safe. The scene mutates the registry only from the reconciling thread while it holds its write lock,
 * and readers go through the scene's read lock.
 *
 * @author hal.hildebrand
 */
public class EntityRegistry {
    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    /**
     * Effect of an insert-or-merge.
     */
    public enum Upsert {
        CREATED, UPDATED, IGNORED
    }

    private final Map<String, VisualEntity>     visuals   = new LinkedHashMap<>();
    private final Map<String, LightEntity>      lights    = new LinkedHashMap<>();
    private final List<SceneChangeListener>     listeners = new CopyOnWriteArrayList<>();
    private final PoseReconciler                reconciler;

    public EntityRegistry(PoseReconciler reconciler) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler cannot be null");
    }

    public void addListener(SceneChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(SceneChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Create a visual, or merge attributes into the existing one.
     * <p>
     * A new visual is attached to {@code parentId} when that visual is registered, otherwise to the scene root. An
     * existing visual keeps its parent and pose; only its attributes are merged.
     *
     * @param visualId   visual identifier
     * @param parentId   requested parent, may be null
     * @param attributes attributes to store or merge, may be null
     * @return whether the visual was created or updated
     */
    public Upsert upsertVisual(String visualId, String parentId, VisualAttributes attributes) {
        var existing = visuals.get(visualId);
        if (existing != null) {
            existing.merge(attributes);
            return Upsert.UPDATED;
        }

        var parent = parentId == null ? null : visuals.get(parentId);
        var visual = new VisualEntity(visualId, parent == null ? null : parentId, attributes);
        if (parent != null) {
            parent.children().add(visualId);
        } else if (parentId != null) {
            log.debug("Parent {} of visual {} is not registered, attaching to root", parentId, visualId);
        }
        visuals.put(visualId, visual);
        log.debug("New visual [{}]", visualId);

        if (!listeners.isEmpty()) {
            var snapshot = visual.snapshot();
            notifyListeners(listener -> listener.onVisualAdded(snapshot));
        }
        return Upsert.CREATED;
    }

    /**
     * Remove a visual. Children are not removed. Removing an unknown visual does nothing.
     *
     * @param visualId visual identifier
     * @return true if a visual was removed
     */
    public boolean removeVisual(String visualId) {
        var removed = visuals.remove(visualId);
        if (removed == null) {
            return false;
        }
        if (removed.parentId() != null) {
            var parent = visuals.get(removed.parentId());
            if (parent != null) {
                parent.children().remove(visualId);
            }
        }
        log.debug("Removed visual [{}], {} children left in place", visualId, removed.children().size());
        notifyListeners(listener -> listener.onVisualRemoved(visualId));
        return true;
    }

    /**
     * Create a light, or handle a light message for an existing identifier.
     *
     * @param lightId    light identifier
     * @param parameters light parameters
     * @param merge      true to merge parameters into an existing light, false to leave it untouched
     * @return whether the light was created, updated or ignored
     */
    public Upsert upsertLight(String lightId, LightParameters parameters, boolean merge) {
        var existing = lights.get(lightId);
        if (existing == null) {
            lights.put(lightId, new LightEntity(lightId, parameters));
            return Upsert.CREATED;
        }
        if (!merge) {
            return Upsert.IGNORED;
        }
        existing.merge(parameters);
        return Upsert.UPDATED;
    }

    /**
     * Set the pose of a visual, staging it in the reconciler when the visual is not registered. A pose applied
     * directly supersedes any older pose still staged for the same visual.
     *
     * @param visualId visual identifier
     * @param pose     new pose
     * @return true if applied now, false if staged
     */
    public boolean applyPose(String visualId, Pose pose) {
        if (setPoseIfPresent(visualId, pose)) {
            reconciler.unstage(visualId);
            return true;
        }
        reconciler.stage(visualId, pose);
        return false;
    }

    boolean setPoseIfPresent(String visualId, Pose pose) {
        var visual = visuals.get(visualId);
        if (visual == null) {
            return false;
        }
        var old = visual.pose();
        visual.setPose(pose);
        notifyListeners(listener -> listener.onVisualMoved(visualId, old, pose));
        return true;
    }

    public boolean containsVisual(String visualId) {
        return visualId != null && visuals.containsKey(visualId);
    }

    public Optional<Visual> lookupVisual(String visualId) {
        var visual = visuals.get(visualId);
        return visual == null ? Optional.empty() : Optional.of(visual.snapshot());
    }

    public Optional<Light> lookupLight(String lightId) {
        var light = lights.get(lightId);
        return light == null ? Optional.empty() : Optional.of(light.snapshot());
    }

    /**
     * Visuals without a registered parent: those attached to the scene root, and orphans whose parent has been
     * removed. Returned in creation order.
     */
    public List<Visual> enumerateRoots() {
        var roots = new ArrayList<Visual>();
        for (var visual : visuals.values()) {
            if (visual.parentId() == null || !visuals.containsKey(visual.parentId())) {
                roots.add(visual.snapshot());
            }
        }
        return roots;
    }

    /**
     * Registered children of a visual in attachment order; empty when the visual is unknown.
     */
    public List<Visual> children(String visualId) {
        var visual = visuals.get(visualId);
        if (visual == null) {
            return List.of();
        }
        var result = new ArrayList<Visual>(visual.children().size());
        for (var childId : visual.children()) {
            var child = visuals.get(childId);
            if (child != null) {
                result.add(child.snapshot());
            }
        }
        return result;
    }

    public int visualCount() {
        return visuals.size();
    }

    public int lightCount() {
        return lights.size();
    }

    /**
     * Release every entity and every staged pose.
     */
    public void clear() {
        visuals.clear();
        lights.clear();
        reconciler.clear();
    }

    private void notifyListeners(Consumer<SceneChangeListener> event) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Scene change listener {} failed", listener, e);
            }
        }
    }
}
