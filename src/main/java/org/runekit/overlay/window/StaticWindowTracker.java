package org.runekit.overlay.window;

import java.awt.Point;
import java.awt.Rectangle;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link WindowTracker} for headless hosts: the target window has fixed bounds and the
 * pointer is moved programmatically, e.g. by the HTTP transport or a replayed log.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe.
 */
public class StaticWindowTracker implements WindowTracker {

    private final Rectangle bounds;
    private final List<PointerListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Point pointer = new Point();

    /**
     * @param bounds the fixed target window bounds in screen coordinates.
     */
    public StaticWindowTracker(Rectangle bounds) {
        this.bounds = new Rectangle(bounds);
    }

    @Override
    public Point pointerPosition() {
        return new Point(pointer);
    }

    @Override
    public Rectangle gameBounds() {
        return new Rectangle(bounds);
    }

    /**
     * Moves the pointer and notifies listeners on the calling thread.
     */
    public void movePointer(int x, int y) {
        pointer = new Point(x, y);
        for (PointerListener listener : listeners) {
            listener.pointerMoved();
        }
    }

    @Override
    public void addPointerListener(PointerListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removePointerListener(PointerListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }
}
