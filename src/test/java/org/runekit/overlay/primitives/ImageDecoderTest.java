package org.runekit.overlay.primitives;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;

import javax.imageio.ImageIO;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ImageDecoderTest {

    static byte[] png(int width, int height, Color fill) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, fill.getRGB());
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    void decodesPng() throws IOException {
        ImageDecoder decoder = new ImageDecoder(10);

        BufferedImage image = decoder.decode(png(3, 2, Color.GREEN));

        assertThat(image.getWidth()).isEqualTo(3);
        assertThat(image.getHeight()).isEqualTo(2);
        assertThat(image.getRGB(0, 0)).isEqualTo(Color.GREEN.getRGB());
    }

    @Test
    void repeatedPayloadIsServedFromCache() throws IOException {
        ImageDecoder decoder = new ImageDecoder(10);
        byte[] payload = png(4, 4, Color.RED);

        BufferedImage first = decoder.decode(payload);
        BufferedImage second = decoder.decode(payload.clone());

        assertThat(second).isSameAs(first);
        assertThat(decoder.stats().hitCount()).isEqualTo(1);
        assertThat(decoder.stats().missCount()).isEqualTo(1);
        assertThat(decoder.estimatedSize()).isEqualTo(1);
    }

    @Test
    void reusedCallerArrayDoesNotCorruptCache() throws IOException {
        ImageDecoder decoder = new ImageDecoder(10);
        byte[] red = png(2, 2, Color.RED);
        byte[] buffer = red.clone();

        decoder.decode(buffer);
        Arrays.fill(buffer, (byte) 0);

        assertThat(decoder.decode(red).getRGB(0, 0)).isEqualTo(Color.RED.getRGB());
        assertThat(decoder.stats().hitCount()).isEqualTo(1);
    }

    @Test
    void rejectsUnknownFormat() {
        ImageDecoder decoder = new ImageDecoder(10);

        assertThatThrownBy(() -> decoder.decode(new byte[] {1, 2, 3, 4}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported image format");
    }
}
