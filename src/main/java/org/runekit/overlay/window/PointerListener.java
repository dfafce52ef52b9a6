package org.runekit.overlay.window;

/**
 * Notified when the pointer moves. May be called on any thread.
 */
@FunctionalInterface
public interface PointerListener {

    void pointerMoved();
}
