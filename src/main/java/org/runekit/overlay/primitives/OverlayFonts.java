package org.runekit.overlay.primitives;

import java.awt.Font;
import java.util.Locale;

/**
 * Font selection for overlay text primitives.
 * <p>
 * Clients request a family name and size per text command. An empty family means "the
 * platform default", which on macOS resolves to a face that is hard to read on top of the
 * game client, so a configured fallback family is substituted there.
 * <p>
 * <strong>Thread Safety:</strong> Immutable, thread-safe.
 */
public final class OverlayFonts {

    /** Smallest font size ever produced. */
    public static final int MIN_FONT_SIZE = 1;

    private final int maxFontSize;
    private final String macFallbackFont;
    private final boolean mac;

    /**
     * @param maxFontSize     requested sizes above this are clamped.
     * @param macFallbackFont family used instead of the default font on macOS.
     * @param osName          value of the {@code os.name} system property.
     */
    public OverlayFonts(int maxFontSize, String macFallbackFont, String osName) {
        this.maxFontSize = maxFontSize;
        this.macFallbackFont = macFallbackFont;
        this.mac = osName != null && osName.toLowerCase(Locale.ROOT).startsWith("mac");
    }

    /**
     * Resolves the family to use for a requested family name.
     *
     * @param requested the family requested by the client, may be empty.
     * @return the requested family, the macOS fallback, or {@link Font#SANS_SERIF}.
     */
    public String resolveFamily(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        return mac ? macFallbackFont : Font.SANS_SERIF;
    }

    /**
     * Clamps a requested size into {@code [MIN_FONT_SIZE, maxFontSize]}.
     */
    public int clampSize(int requested) {
        return Math.max(MIN_FONT_SIZE, Math.min(maxFontSize, requested));
    }

    /**
     * Creates the font for a text command.
     *
     * @param family requested family, may be empty.
     * @param size   requested size in points.
     * @return a plain font of the resolved family and clamped size.
     */
    public Font font(String family, int size) {
        return new Font(resolveFamily(family), Font.PLAIN, clampSize(size));
    }

    public int getMaxFontSize() {
        return maxFontSize;
    }
}
