package org.runekit.overlay.primitives;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

/**
 * Decodes image payloads (PNG, JPEG, GIF, BMP) into drawable images.
 * <p>
 * Scripts tend to send the same small sprite over and over, so decoded images are kept in
 * a bounded Caffeine cache keyed by the raw byte content. Cached images are shared and
 * must not be modified by callers.
 * <p>
 * <strong>Thread Safety:</strong> Thread-safe; the Caffeine cache is thread-safe.
 */
public class ImageDecoder {

    private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

    private final Cache<ByteBuffer, BufferedImage> cache;

    /**
     * @param maximumSize maximum number of decoded images to keep.
     */
    public ImageDecoder(int maximumSize) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build();
        log.debug("Image cache initialized: maxSize={}", maximumSize);
    }

    /**
     * Decodes an encoded image, serving repeated payloads from the cache.
     *
     * @param encoded the encoded image bytes.
     * @return the decoded image.
     * @throws IllegalArgumentException if no installed reader understands the payload.
     * @throws UncheckedIOException     if the payload is truncated or corrupt.
     */
    public BufferedImage decode(byte[] encoded) {
        // The key must not alias the caller's array, which may be reused.
        ByteBuffer key = ByteBuffer.wrap(encoded.clone());
        return cache.get(key, k -> read(encoded));
    }

    /**
     * @return cache hit/miss statistics.
     */
    public CacheStats stats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private static BufferedImage read(byte[] encoded) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
            if (image == null) {
                throw new IllegalArgumentException("Unsupported image format (" + encoded.length + " bytes)");
            }
            return image;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decode image (" + encoded.length + " bytes)", e);
        }
    }
}
