package org.runekit.overlay.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.render.GroupHandle;
import org.runekit.overlay.render.PrimitiveHandle;
import org.runekit.overlay.render.RenderSurface;
import org.runekit.overlay.scheduling.DeferredExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the named groups of overlay primitives and their lifecycle.
 * <p>
 * Every group lives in exactly one of two registries:
 * <ul>
 *   <li><b>active</b>: carries a timeout clamped into the configured range and is hidden
 *       when it expires;</li>
 *   <li><b>frozen</b>: timeout {@code 0}, survives until explicitly continued or cleared.</li>
 * </ul>
 * Moving a group between the registries always goes through a full disband and rebuild,
 * so the primitives survive while the single timeout mechanism never has to special-case
 * frozen membership.
 * <p>
 * Expiry is a one-shot deferred callback armed on every registration. It is never
 * cancelled; when it fires it re-checks registry membership, so a group that was hidden,
 * frozen or reset in the meantime is left alone.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Engine thread only.
 */
public class GroupRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    /**
     * Where a group name currently lives.
     */
    public enum GroupState {
        ABSENT,
        ACTIVE,
        FROZEN
    }

    /**
     * Result of {@link #ungroup(String)}.
     *
     * @param primitives the former members, or {@code null} if the group did not exist.
     * @param timeoutMillis the former timeout, {@code 0} for frozen, {@code -1} if absent.
     */
    public record Ungrouped(List<PrimitiveHandle> primitives, int timeoutMillis) {

        public static final Ungrouped ABSENT = new Ungrouped(null, -1);

        public boolean isAbsent() {
            return primitives == null;
        }
    }

    private record Entry(GroupHandle handle, int timeoutMillis) {}

    private final RenderSurface surface;
    private final DeferredExecutor executor;
    private final OverlaySettings settings;
    private final OverlayEventListener listener;

    private final Map<String, Entry> active = new LinkedHashMap<>();
    private final Map<String, Entry> frozen = new LinkedHashMap<>();
    private long epoch;

    public GroupRegistry(RenderSurface surface, DeferredExecutor executor, OverlaySettings settings,
                         OverlayEventListener listener) {
        this.surface = Objects.requireNonNull(surface, "surface");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Files primitives under a group name.
     * <p>
     * If the name already exists in either registry the primitives are merged into it and
     * its state is unchanged. Otherwise a new group is created: frozen when
     * {@code timeoutMillis <= 0}, active with the clamped timeout otherwise.
     *
     * @return the group's handle.
     */
    public GroupHandle group(String name, int timeoutMillis, List<PrimitiveHandle> primitives) {
        Entry existing = entry(name);
        if (existing != null) {
            for (PrimitiveHandle primitive : primitives) {
                surface.addToGroup(existing.handle(), primitive);
            }
            return existing.handle();
        }

        GroupHandle handle = surface.group(primitives);
        if (timeoutMillis <= 0) {
            frozen.put(name, new Entry(handle, 0));
        } else {
            active.put(name, new Entry(handle, settings.clampTimeout(timeoutMillis)));
        }
        return handle;
    }

    /**
     * Files primitives under a group name and arms the expiry callback for positive
     * timeouts.
     *
     * @return the group's handle.
     */
    public GroupHandle register(String name, int timeoutMillis, List<PrimitiveHandle> primitives) {
        GroupHandle handle = group(name, timeoutMillis, primitives);
        if (timeoutMillis > 0) {
            long armedEpoch = epoch;
            executor.schedule(() -> expire(name, armedEpoch), settings.clampTimeout(timeoutMillis));
        }
        return handle;
    }

    private void expire(String name, long armedEpoch) {
        if (armedEpoch != epoch) {
            return;
        }
        if (active.containsKey(name)) {
            log.debug("Group '{}' expired", name);
        }
        hide(name);
    }

    /**
     * Hides an active group: removes it from the registry and the scene and emits a hide
     * notification. Frozen and absent names are left untouched.
     *
     * @return true if a group was hidden.
     */
    public boolean hide(String name) {
        Entry entry = active.remove(name);
        if (entry == null) {
            return false;
        }
        surface.removeFromScene(entry.handle());
        listener.onGroupHidden(name);
        return true;
    }

    /**
     * Removes a group from whichever registry holds it and disbands it. The primitives
     * stay in the scene individually.
     */
    public Ungrouped ungroup(String name) {
        Entry entry = active.remove(name);
        if (entry == null) {
            entry = frozen.remove(name);
        }
        if (entry == null) {
            return Ungrouped.ABSENT;
        }
        List<PrimitiveHandle> primitives = surface.disbandGroup(entry.handle());
        return new Ungrouped(primitives, entry.timeoutMillis());
    }

    /**
     * Rebuilds an active group as a frozen group with the same primitives.
     *
     * @return false, with nothing changed, if the group is not active.
     */
    public boolean freeze(String name) {
        if (!active.containsKey(name)) {
            return false;
        }
        Ungrouped former = ungroup(name);
        register(name, 0, former.primitives());
        return true;
    }

    /**
     * Rebuilds a frozen group as an active group with the default timeout.
     *
     * @return false, with nothing changed, if the group is not frozen.
     */
    public boolean continueGroup(String name) {
        if (!frozen.containsKey(name)) {
            return false;
        }
        Ungrouped former = ungroup(name);
        register(name, settings.defaultTimeoutMillis(), former.primitives());
        return true;
    }

    /**
     * Rebuilds a frozen group in place by continuing and re-freezing it.
     *
     * @return false if the group is not frozen.
     */
    public boolean refresh(String name) {
        if (!frozen.containsKey(name)) {
            return false;
        }
        continueGroup(name);
        freeze(name);
        return true;
    }

    /**
     * Removes a group regardless of its state. A frozen group is continued first and then
     * hidden, so it emits the same hide notification as an active one.
     */
    public void clear(String name) {
        if (frozen.containsKey(name)) {
            continueGroup(name);
        }
        hide(name);
    }

    /**
     * Sets the stacking order of an active group.
     *
     * @return false if the group is not active.
     */
    public boolean setZ(String name, double z) {
        Entry entry = active.get(name);
        if (entry == null) {
            return false;
        }
        surface.setZ(entry.handle(), z);
        return true;
    }

    /**
     * Removes every group from the scene and empties both registries. Expiry callbacks
     * armed before the reset become no-ops.
     */
    public void reset() {
        for (Entry entry : active.values()) {
            surface.removeFromScene(entry.handle());
        }
        for (Entry entry : frozen.values()) {
            surface.removeFromScene(entry.handle());
        }
        active.clear();
        frozen.clear();
        epoch++;
    }

    public GroupState state(String name) {
        if (active.containsKey(name)) {
            return GroupState.ACTIVE;
        }
        if (frozen.containsKey(name)) {
            return GroupState.FROZEN;
        }
        return GroupState.ABSENT;
    }

    public boolean isActive(String name) {
        return active.containsKey(name);
    }

    public boolean isFrozen(String name) {
        return frozen.containsKey(name);
    }

    /**
     * @return the handle of an active or frozen group.
     */
    public Optional<GroupHandle> handle(String name) {
        Entry entry = entry(name);
        return entry == null ? Optional.empty() : Optional.of(entry.handle());
    }

    /**
     * @return the stored timeout: clamped for active groups, {@code 0} for frozen groups,
     *         {@code -1} for absent names.
     */
    public int timeout(String name) {
        Entry entry = entry(name);
        return entry == null ? -1 : entry.timeoutMillis();
    }

    /**
     * @return active group names mapped to their timeouts, in creation order.
     */
    public Map<String, Integer> activeTimeouts() {
        Map<String, Integer> result = new LinkedHashMap<>();
        active.forEach((name, entry) -> result.put(name, entry.timeoutMillis()));
        return result;
    }

    public List<String> activeNames() {
        return new ArrayList<>(active.keySet());
    }

    public List<String> frozenNames() {
        return new ArrayList<>(frozen.keySet());
    }

    private Entry entry(String name) {
        Entry entry = active.get(name);
        return entry != null ? entry : frozen.get(name);
    }
}
