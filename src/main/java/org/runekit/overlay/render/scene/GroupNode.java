package org.runekit.overlay.render.scene;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.runekit.overlay.render.GroupHandle;

/**
 * Group node; children are positioned relative to the group.
 */
final class GroupNode extends SceneNode implements GroupHandle {

    static final Comparator<SceneNode> PAINT_ORDER =
            Comparator.<SceneNode>comparingDouble(n -> n.z).thenComparingLong(n -> n.order);

    final List<SceneNode> children = new ArrayList<>();

    GroupNode(long id) {
        super(id);
    }

    @Override
    public Kind kind() {
        return Kind.GROUP;
    }

    @Override
    Rectangle2D localBounds() {
        Rectangle2D union = null;
        for (SceneNode child : children) {
            Rectangle2D b = child.localBounds();
            Rectangle2D moved = new Rectangle2D.Double(b.getX() + child.x, b.getY() + child.y,
                    b.getWidth(), b.getHeight());
            if (union == null) {
                union = moved;
            } else {
                union.add(moved);
            }
        }
        return union == null ? new Rectangle2D.Double() : union;
    }

    @Override
    void paint(Graphics2D g, long nowMillis) {
        List<SceneNode> ordered = new ArrayList<>(children);
        ordered.sort(PAINT_ORDER);
        for (SceneNode child : ordered) {
            Graphics2D cg = (Graphics2D) g.create();
            try {
                cg.translate(child.x, child.y);
                child.paint(cg, nowMillis);
            } finally {
                cg.dispose();
            }
        }
    }
}
