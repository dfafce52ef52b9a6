package org.runekit.overlay.window;

import java.awt.Point;
import java.awt.Rectangle;

/**
 * The windowing collaborator: where the target application window is and where the
 * pointer is.
 * <p>
 * Implementations must be thread-safe. Listeners may be notified on any thread.
 */
public interface WindowTracker {

    /**
     * @return the pointer position in screen coordinates.
     */
    Point pointerPosition();

    /**
     * @return position and size of the target window in screen coordinates.
     */
    Rectangle gameBounds();

    void addPointerListener(PointerListener listener);

    void removePointerListener(PointerListener listener);
}
