package org.runekit.overlay.group;

/**
 * Receives lifecycle notifications emitted by the {@link GroupRegistry}.
 * <p>
 * Called on the engine thread. Implementations that forward events to other threads
 * (e.g. server-sent events) must not block.
 */
@FunctionalInterface
public interface OverlayEventListener {

    /** Listener that drops every event. */
    OverlayEventListener NONE = name -> { };

    /**
     * An active group was hidden, either explicitly or because its timeout expired.
     *
     * @param name the group name.
     */
    void onGroupHidden(String name);
}
