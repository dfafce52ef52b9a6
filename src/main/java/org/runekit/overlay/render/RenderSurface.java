package org.runekit.overlay.render;

import java.awt.Color;
import java.awt.Font;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * The rendering surface the overlay engine draws on.
 * <p>
 * Implementations own the actual visuals; the engine only holds handles. Geometry follows
 * the scene-graph convention: every primitive has a position relative to its parent, and
 * a group's children keep their scene positions when the group is created or disbanded.
 * <p>
 * <strong>Thread Safety:</strong> Implementations are only called from the engine thread
 * and need not be thread-safe.
 */
public interface RenderSurface {

    /**
     * Creates an outlined rectangle, positioned at the scene origin.
     */
    PrimitiveHandle createRect(double x, double y, double width, double height, Color color, float strokeWidth);

    /**
     * Creates a line segment, positioned at the scene origin.
     */
    PrimitiveHandle createLine(double x1, double y1, double x2, double y2, Color color, float strokeWidth);

    /**
     * Creates a text primitive at the scene origin.
     *
     * @param shadow drop shadow, or {@code null} for none.
     */
    PrimitiveHandle createText(String text, Font font, Color color, DropShadow shadow);

    /**
     * Creates an image primitive at the scene origin.
     */
    PrimitiveHandle createImage(BufferedImage image);

    /**
     * Groups primitives under a new group at the scene origin. Children keep their scene
     * positions. An empty list creates an empty group.
     */
    GroupHandle group(List<PrimitiveHandle> primitives);

    /**
     * Adds a primitive to an existing group, keeping its scene position.
     */
    void addToGroup(GroupHandle group, PrimitiveHandle primitive);

    /**
     * Destroys a group while keeping its children alive as top-level primitives at their
     * current scene positions.
     *
     * @return the former children, in insertion order.
     */
    List<PrimitiveHandle> disbandGroup(GroupHandle group);

    /**
     * Removes a primitive (and, for groups, all descendants) from the scene.
     */
    void removeFromScene(PrimitiveHandle handle);

    /**
     * @return true if the primitive is currently part of the scene.
     */
    boolean isInScene(PrimitiveHandle handle);

    /**
     * @return direct children of a group, in insertion order.
     */
    List<PrimitiveHandle> children(GroupHandle group);

    void setZ(PrimitiveHandle handle, double z);

    double z(PrimitiveHandle handle);

    void setPosition(PrimitiveHandle handle, double x, double y);

    Point2D position(PrimitiveHandle handle);

    /**
     * @return bounds in the primitive's local coordinates.
     */
    Rectangle2D boundingBox(PrimitiveHandle handle);

    /**
     * Maps a scene point into the primitive's local coordinates.
     */
    Point2D mapFromScene(PrimitiveHandle handle, double x, double y);

    /**
     * Maps a local point of the primitive into scene coordinates.
     */
    Point2D mapPointToScene(PrimitiveHandle handle, double x, double y);

    /**
     * Sets the local point that scale animations pivot around.
     */
    void setTransformOrigin(PrimitiveHandle handle, double x, double y);

    /**
     * Attaches an arbitrary value to a primitive.
     */
    void setData(PrimitiveHandle handle, String key, Object value);

    /**
     * @return the value attached under {@code key}, or {@code null}.
     */
    Object data(PrimitiveHandle handle, String key);

    /**
     * @return the displayed text of a text primitive.
     * @throws IllegalArgumentException if the handle is not a text primitive.
     */
    String text(PrimitiveHandle handle);

    /**
     * Replaces the displayed text of a text primitive.
     *
     * @throws IllegalArgumentException if the handle is not a text primitive.
     */
    void setText(PrimitiveHandle handle, String text);

    /**
     * Plays the transient highlight animation on a text primitive.
     *
     * @throws IllegalArgumentException if the handle is not a text primitive.
     */
    void animate(PrimitiveHandle handle);
}
