package org.runekit.overlay.primitives;

import java.awt.Color;

/**
 * Packed color conversion for the wire protocol.
 * <p>
 * Colors are packed as {@code 0xAARRGGBB}: alpha in bits 24-31, red in 16-23, green in
 * 8-15 and blue in 0-7.
 */
public final class ColorCodec {

    private ColorCodec() {
        // Utility class
    }

    /**
     * Decodes a packed ARGB value.
     *
     * @param packed the packed color; negative values are read as their unsigned bit pattern.
     * @return the color, including alpha.
     */
    public static Color decode(int packed) {
        int r = (packed >> 16) & 0xFF;
        int g = (packed >> 8) & 0xFF;
        int b = packed & 0xFF;
        int a = (packed >>> 24) & 0xFF;
        return new Color(r, g, b, a);
    }

    /**
     * Packs a color into {@code 0xAARRGGBB}.
     */
    public static int encode(Color color) {
        return color.getAlpha() << 24 | color.getRed() << 16 | color.getGreen() << 8 | color.getBlue();
    }
}
