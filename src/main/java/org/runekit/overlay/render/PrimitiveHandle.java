package org.runekit.overlay.render;

/**
 * Opaque reference to a primitive owned by a {@link RenderSurface}.
 * <p>
 * Handles are compared by identity. A handle stays valid while the primitive exists,
 * including across group disband/regroup cycles.
 */
public interface PrimitiveHandle {

    /**
     * The visual kind of a primitive.
     */
    enum Kind { RECT, LINE, TEXT, IMAGE, GROUP }

    /**
     * @return surface-assigned identifier, unique for the surface's lifetime.
     */
    long id();

    /**
     * @return the kind of primitive this handle refers to.
     */
    Kind kind();
}
