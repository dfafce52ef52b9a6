package org.runekit.overlay.render;

/**
 * Handle to a group of primitives. Groups can be nested inside other groups.
 */
public interface GroupHandle extends PrimitiveHandle {

    @Override
    default Kind kind() {
        return Kind.GROUP;
    }
}
