package org.runekit.overlay.render.scene;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Line2D;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

import org.runekit.overlay.render.DropShadow;
import org.runekit.overlay.render.GroupHandle;
import org.runekit.overlay.render.PrimitiveHandle;
import org.runekit.overlay.render.RenderSurface;
import org.runekit.overlay.render.scene.ShapeNodes.ImageNode;
import org.runekit.overlay.render.scene.ShapeNodes.LineNode;
import org.runekit.overlay.render.scene.ShapeNodes.RectNode;

/**
 * Headless, in-memory {@link RenderSurface} that composites the scene with Java2D.
 * <p>
 * Maintains a scene graph of rectangles, lines, text, images and groups. Top-level nodes
 * and group children are painted in ascending z order, ties broken by insertion order.
 * {@link #renderFrame()} produces a transparent ARGB frame of the configured size which a
 * host window (or a test) can composite over the target application.
 * <p>
 * Text highlight animations are evaluated against the supplied clock at paint time.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Use from the engine thread only.
 */
public class SceneRenderSurface implements RenderSurface {

    private final int width;
    private final int height;
    private final LongSupplier clock;
    private final List<SceneNode> roots = new ArrayList<>();
    private long nextId = 1;
    private long nextOrder;

    /**
     * @param width  frame width in pixels.
     * @param height frame height in pixels.
     * @param clock  millisecond clock driving text animations.
     */
    public SceneRenderSurface(int width, int height, LongSupplier clock) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Surface size must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public PrimitiveHandle createRect(double x, double y, double w, double h, Color color, float strokeWidth) {
        return new RectNode(nextId++, new Rectangle2D.Double(x, y, w, h), color, strokeWidth);
    }

    @Override
    public PrimitiveHandle createLine(double x1, double y1, double x2, double y2, Color color, float strokeWidth) {
        return new LineNode(nextId++, new Line2D.Double(x1, y1, x2, y2), color, strokeWidth);
    }

    @Override
    public PrimitiveHandle createText(String text, Font font, Color color, DropShadow shadow) {
        return new TextNode(nextId++, text, font, color, shadow);
    }

    @Override
    public PrimitiveHandle createImage(BufferedImage image) {
        return new ImageNode(nextId++, Objects.requireNonNull(image, "image"));
    }

    @Override
    public GroupHandle group(List<PrimitiveHandle> primitives) {
        GroupNode group = new GroupNode(nextId++);
        attachToRoot(group, 0, 0);
        for (PrimitiveHandle primitive : primitives) {
            addToGroup(group, primitive);
        }
        return group;
    }

    @Override
    public void addToGroup(GroupHandle group, PrimitiveHandle primitive) {
        GroupNode target = node(group, GroupNode.class);
        SceneNode child = node(primitive);
        if (child == target) {
            throw new IllegalArgumentException("Cannot add a group to itself");
        }
        Point2D childScene = child.inScene ? child.scenePosition() : new Point2D.Double(child.x, child.y);
        detach(child);
        Point2D groupScene = target.scenePosition();
        child.parent = target;
        child.x = childScene.getX() - groupScene.getX();
        child.y = childScene.getY() - groupScene.getY();
        child.order = nextOrder++;
        target.children.add(child);
        markInScene(child, target.inScene);
    }

    @Override
    public List<PrimitiveHandle> disbandGroup(GroupHandle group) {
        GroupNode target = node(group, GroupNode.class);
        List<PrimitiveHandle> former = new ArrayList<>(target.children);
        boolean wasInScene = target.inScene;
        for (SceneNode child : new ArrayList<>(target.children)) {
            Point2D scene = child.scenePosition();
            target.children.remove(child);
            child.parent = null;
            if (wasInScene) {
                attachToRoot(child, scene.getX(), scene.getY());
            } else {
                child.x = scene.getX();
                child.y = scene.getY();
            }
        }
        detach(target);
        markInScene(target, false);
        return former;
    }

    @Override
    public void removeFromScene(PrimitiveHandle handle) {
        SceneNode node = node(handle);
        detach(node);
        markInScene(node, false);
    }

    @Override
    public boolean isInScene(PrimitiveHandle handle) {
        return node(handle).inScene;
    }

    @Override
    public List<PrimitiveHandle> children(GroupHandle group) {
        return Collections.unmodifiableList(new ArrayList<>(node(group, GroupNode.class).children));
    }

    @Override
    public void setZ(PrimitiveHandle handle, double z) {
        node(handle).z = z;
    }

    @Override
    public double z(PrimitiveHandle handle) {
        return node(handle).z;
    }

    @Override
    public void setPosition(PrimitiveHandle handle, double x, double y) {
        SceneNode node = node(handle);
        node.x = x;
        node.y = y;
    }

    @Override
    public Point2D position(PrimitiveHandle handle) {
        SceneNode node = node(handle);
        return new Point2D.Double(node.x, node.y);
    }

    @Override
    public Rectangle2D boundingBox(PrimitiveHandle handle) {
        return node(handle).localBounds();
    }

    @Override
    public Point2D mapFromScene(PrimitiveHandle handle, double x, double y) {
        Point2D origin = node(handle).scenePosition();
        return new Point2D.Double(x - origin.getX(), y - origin.getY());
    }

    @Override
    public Point2D mapPointToScene(PrimitiveHandle handle, double x, double y) {
        Point2D origin = node(handle).scenePosition();
        return new Point2D.Double(x + origin.getX(), y + origin.getY());
    }

    @Override
    public void setTransformOrigin(PrimitiveHandle handle, double x, double y) {
        SceneNode node = node(handle);
        node.originX = x;
        node.originY = y;
    }

    /**
     * @return the local transform origin of a primitive.
     */
    public Point2D transformOrigin(PrimitiveHandle handle) {
        SceneNode node = node(handle);
        return new Point2D.Double(node.originX, node.originY);
    }

    @Override
    public void setData(PrimitiveHandle handle, String key, Object value) {
        if (value == null) {
            node(handle).data().remove(key);
        } else {
            node(handle).data().put(key, value);
        }
    }

    @Override
    public Object data(PrimitiveHandle handle, String key) {
        return node(handle).data().get(key);
    }

    @Override
    public String text(PrimitiveHandle handle) {
        return node(handle, TextNode.class).text();
    }

    @Override
    public void setText(PrimitiveHandle handle, String text) {
        node(handle, TextNode.class).setText(text);
    }

    @Override
    public void animate(PrimitiveHandle handle) {
        node(handle, TextNode.class).startAnimation(clock.getAsLong());
    }

    /**
     * @return true if the text primitive's highlight animation is still playing.
     */
    public boolean isAnimating(PrimitiveHandle handle) {
        return node(handle, TextNode.class).isAnimating(clock.getAsLong());
    }

    /**
     * @return the font of a text primitive.
     */
    public Font font(PrimitiveHandle handle) {
        return node(handle, TextNode.class).font();
    }

    /**
     * @return the color of a text or rectangle primitive.
     */
    public Color color(PrimitiveHandle handle) {
        SceneNode node = node(handle);
        if (node instanceof TextNode text) {
            return text.color();
        }
        if (node instanceof RectNode rect) {
            return rect.color();
        }
        throw new IllegalArgumentException(handle + " has no single color");
    }

    /**
     * @return the drop shadow of a text primitive, or {@code null}.
     */
    public DropShadow shadow(PrimitiveHandle handle) {
        return node(handle, TextNode.class).shadow();
    }

    /**
     * @return the stroke width of a rectangle or line primitive.
     */
    public float strokeWidth(PrimitiveHandle handle) {
        SceneNode node = node(handle);
        if (node instanceof RectNode rect) {
            return rect.strokeWidth();
        }
        if (node instanceof LineNode line) {
            return line.strokeWidth();
        }
        throw new IllegalArgumentException(handle + " has no stroke");
    }

    /**
     * @return top-level primitives currently in the scene, in paint order.
     */
    public List<PrimitiveHandle> topLevel() {
        List<SceneNode> ordered = new ArrayList<>(roots);
        ordered.sort(GroupNode.PAINT_ORDER);
        return Collections.unmodifiableList(new ArrayList<>(ordered));
    }

    /**
     * Renders the current scene into a new transparent frame.
     *
     * @return the rendered frame.
     */
    public BufferedImage renderFrame() {
        BufferedImage frame = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        render(frame);
        return frame;
    }

    /**
     * Renders the current scene on top of an existing frame.
     *
     * @param frame the image to paint onto.
     */
    public void render(BufferedImage frame) {
        long now = clock.getAsLong();
        Graphics2D g2d = frame.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setComposite(AlphaComposite.SrcOver);
            List<SceneNode> ordered = new ArrayList<>(roots);
            ordered.sort(GroupNode.PAINT_ORDER);
            for (SceneNode node : ordered) {
                Graphics2D ng = (Graphics2D) g2d.create();
                try {
                    ng.translate(node.x, node.y);
                    node.paint(ng, now);
                } finally {
                    ng.dispose();
                }
            }
        } finally {
            g2d.dispose();
        }
    }

    private void attachToRoot(SceneNode node, double x, double y) {
        node.parent = null;
        node.x = x;
        node.y = y;
        node.order = nextOrder++;
        roots.add(node);
        markInScene(node, true);
    }

    private void detach(SceneNode node) {
        if (node.parent != null) {
            node.parent.children.remove(node);
            node.parent = null;
        } else {
            roots.remove(node);
        }
    }

    private static void markInScene(SceneNode node, boolean inScene) {
        node.inScene = inScene;
        if (node instanceof GroupNode group) {
            for (SceneNode child : group.children) {
                markInScene(child, inScene);
            }
        }
    }

    private static SceneNode node(PrimitiveHandle handle) {
        if (handle instanceof SceneNode node) {
            return node;
        }
        throw new IllegalArgumentException("Handle does not belong to this surface: " + handle);
    }

    private static <T extends SceneNode> T node(PrimitiveHandle handle, Class<T> type) {
        SceneNode node = node(handle);
        if (!type.isInstance(node)) {
            throw new IllegalArgumentException(handle + " is not a " + type.getSimpleName());
        }
        return type.cast(node);
    }
}
