package org.runekit.overlay.primitives;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Color;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ColorCodecTest {

    @Test
    void decodesOpaqueBlue() {
        Color color = ColorCodec.decode(0xFF0000FF);

        assertThat(color.getAlpha()).isEqualTo(255);
        assertThat(color.getRed()).isZero();
        assertThat(color.getGreen()).isZero();
        assertThat(color.getBlue()).isEqualTo(255);
    }

    @Test
    void decodesTranslucentColor() {
        Color color = ColorCodec.decode(0x80112233);

        assertThat(color.getAlpha()).isEqualTo(0x80);
        assertThat(color.getRed()).isEqualTo(0x11);
        assertThat(color.getGreen()).isEqualTo(0x22);
        assertThat(color.getBlue()).isEqualTo(0x33);
    }

    @Test
    void zeroAlphaIsFullyTransparent() {
        assertThat(ColorCodec.decode(0x00FFFFFF).getAlpha()).isZero();
    }

    @Test
    void encodeInvertsDecode() {
        assertThat(ColorCodec.encode(ColorCodec.decode(0xC0FFEE42))).isEqualTo(0xC0FFEE42);
        assertThat(ColorCodec.encode(new Color(1, 2, 3, 4))).isEqualTo(0x04010203);
    }
}
