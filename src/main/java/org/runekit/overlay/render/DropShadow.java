package org.runekit.overlay.render;

import java.awt.Color;

/**
 * Drop shadow effect for text primitives.
 *
 * @param offsetX    horizontal shadow offset in pixels.
 * @param offsetY    vertical shadow offset in pixels.
 * @param blurRadius blur radius in pixels, {@code 0} for a hard shadow.
 * @param color      shadow color.
 */
public record DropShadow(int offsetX, int offsetY, int blurRadius, Color color) {

    /** Hard one-pixel black shadow used for overlay text. */
    public static final DropShadow HARD_BLACK = new DropShadow(1, 1, 0, Color.BLACK);
}
