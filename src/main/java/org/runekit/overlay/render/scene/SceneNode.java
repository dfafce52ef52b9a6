package org.runekit.overlay.render.scene;

import java.awt.Graphics2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.HashMap;
import java.util.Map;

import org.runekit.overlay.render.PrimitiveHandle;

/**
 * Base class of all nodes in the {@link SceneRenderSurface} graph. Nodes double as the
 * handles given out to the engine.
 */
abstract class SceneNode implements PrimitiveHandle {

    private final long id;
    private final Map<String, Object> data = new HashMap<>();

    GroupNode parent;
    boolean inScene;
    double x;
    double y;
    double z;
    double originX;
    double originY;
    /** Insertion order among siblings, breaks z ties. */
    long order;

    SceneNode(long id) {
        this.id = id;
    }

    @Override
    public long id() {
        return id;
    }

    /**
     * @return bounds in local coordinates.
     */
    abstract Rectangle2D localBounds();

    /**
     * Paints the node with the graphics already translated to the node's position.
     */
    abstract void paint(Graphics2D g, long nowMillis);

    Point2D scenePosition() {
        double sx = x;
        double sy = y;
        for (GroupNode p = parent; p != null; p = p.parent) {
            sx += p.x;
            sy += p.y;
        }
        return new Point2D.Double(sx, sy);
    }

    Map<String, Object> data() {
        return data;
    }

    @Override
    public String toString() {
        return kind() + "#" + id;
    }
}
