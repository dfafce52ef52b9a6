package org.runekit.overlay.primitives;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Font;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class OverlayFontsTest {

    @Test
    void substitutesFallbackForDefaultFontOnMac() {
        OverlayFonts fonts = new OverlayFonts(50, "Menlo", "Mac OS X");

        assertThat(fonts.resolveFamily("")).isEqualTo("Menlo");
        assertThat(fonts.resolveFamily(null)).isEqualTo("Menlo");
        assertThat(fonts.resolveFamily("Serif")).isEqualTo("Serif");
    }

    @Test
    void usesSansSerifElsewhere() {
        OverlayFonts fonts = new OverlayFonts(50, "Menlo", "Linux");

        assertThat(fonts.resolveFamily(" ")).isEqualTo(Font.SANS_SERIF);
    }

    @Test
    void clampsSizes() {
        OverlayFonts fonts = new OverlayFonts(50, "Menlo", "Linux");

        assertThat(fonts.clampSize(500)).isEqualTo(50);
        assertThat(fonts.clampSize(0)).isEqualTo(OverlayFonts.MIN_FONT_SIZE);
        assertThat(fonts.clampSize(12)).isEqualTo(12);
        assertThat(fonts.font("", 80).getSize()).isEqualTo(50);
        assertThat(fonts.font("", 80).getStyle()).isEqualTo(Font.PLAIN);
    }
}
