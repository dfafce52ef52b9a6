package org.runekit.overlay.window;

import java.awt.Point;
import java.awt.Rectangle;
import java.awt.geom.Point2D;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.runekit.overlay.group.GroupRegistry;
import org.runekit.overlay.render.GroupHandle;
import org.runekit.overlay.render.RenderSurface;
import org.runekit.overlay.scheduling.DeferredExecutor;
import org.runekit.overlay.template.ModelValue.Num;
import org.runekit.overlay.template.TemplateBindings;
import org.runekit.overlay.template.TextModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes frozen groups follow the pointer.
 * <p>
 * On every pointer movement a followed group is moved so that its origin sits at
 * {@code pointer - windowOffset - windowSize / 2}. The pointer position relative to the
 * window ({@code mouse_x}, {@code mouse_y}) is written into the group's text model and
 * the group's texts are re-evaluated. Pointer events arrive on arbitrary threads and are
 * handed to the engine thread before touching any state.
 * <p>
 * A group that is no longer frozen when an event arrives stops being followed, and so
 * does a group that was rebuilt (refreshed) since following started.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe except for the registered pointer
 * listeners. Engine thread only.
 */
public class MoveTracker {

    private static final Logger log = LoggerFactory.getLogger(MoveTracker.class);

    /** Model field holding the pointer's x position relative to the target window. */
    public static final String MOUSE_X = "mouse_x";
    /** Model field holding the pointer's y position relative to the target window. */
    public static final String MOUSE_Y = "mouse_y";

    private final WindowTracker window;
    private final DeferredExecutor executor;
    private final GroupRegistry registry;
    private final TemplateBindings bindings;
    private final RenderSurface surface;
    private final Map<String, Follower> listeners = new LinkedHashMap<>();

    /**
     * A registered pointer listener and the group instance it moves.
     */
    private record Follower(PointerListener listener, GroupHandle group) {}

    public MoveTracker(WindowTracker window, DeferredExecutor executor, GroupRegistry registry,
                       TemplateBindings bindings, RenderSurface surface) {
        this.window = Objects.requireNonNull(window, "window");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.surface = Objects.requireNonNull(surface, "surface");
    }

    /**
     * Starts following the pointer with a frozen group. Re-enabling replaces the previous
     * listener.
     *
     * @return false, with nothing changed, if the group is not frozen.
     */
    public boolean enable(String name) {
        if (!registry.isFrozen(name)) {
            return false;
        }
        disable(name);
        PointerListener listener = () -> executor.post(() -> follow(name));
        listeners.put(name, new Follower(listener, registry.handle(name).orElseThrow()));
        window.addPointerListener(listener);
        log.debug("Group '{}' follows the pointer", name);
        return true;
    }

    /**
     * Stops following the pointer with a group, whatever its state.
     */
    public void disable(String name) {
        Follower follower = listeners.remove(name);
        if (follower != null) {
            window.removePointerListener(follower.listener());
        }
    }

    public boolean isTracking(String name) {
        return listeners.containsKey(name);
    }

    public List<String> trackedNames() {
        return List.copyOf(listeners.keySet());
    }

    /**
     * Detaches every listener.
     */
    public void reset() {
        for (Follower follower : listeners.values()) {
            window.removePointerListener(follower.listener());
        }
        listeners.clear();
    }

    void follow(String name) {
        Follower follower = listeners.get(name);
        if (follower == null) {
            return;
        }
        Optional<GroupHandle> group = registry.isFrozen(name) ? registry.handle(name) : Optional.empty();
        if (group.isEmpty()) {
            log.debug("Group '{}' is no longer frozen, detaching pointer listener", name);
            disable(name);
            return;
        }
        if (group.get() != follower.group()) {
            log.debug("Group '{}' was rebuilt, detaching pointer listener", name);
            disable(name);
            return;
        }

        Rectangle bounds = window.gameBounds();
        Point pointer = window.pointerPosition();
        int halfWidth = bounds.width / 2;
        int halfHeight = bounds.height / 2;
        int nx = pointer.x - bounds.x - halfWidth;
        int ny = pointer.y - bounds.y - halfHeight;

        Point2D current = surface.position(group.get());
        if (current.getX() == nx && current.getY() == ny) {
            return;
        }
        try {
            surface.setPosition(group.get(), nx, ny);
            TextModel model = bindings.modelOrCreate(name);
            model.put(MOUSE_X, Num.of((long) nx + halfWidth));
            model.put(MOUSE_Y, Num.of((long) ny + halfHeight));
            bindings.refresh(name);
        } catch (RuntimeException e) {
            log.warn("Pointer follow of group '{}' failed, detaching: {}", name, e.getMessage());
            disable(name);
        }
    }
}
