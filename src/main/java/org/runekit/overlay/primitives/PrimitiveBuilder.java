package org.runekit.overlay.primitives;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;

import org.runekit.overlay.OverlaySettings;
import org.runekit.overlay.group.GroupContextStack;
import org.runekit.overlay.group.GroupRegistry;
import org.runekit.overlay.render.DropShadow;
import org.runekit.overlay.render.PrimitiveHandle;
import org.runekit.overlay.render.RenderSurface;
import org.runekit.overlay.template.TemplateBindings;

/**
 * Materializes validated draw commands on the {@link RenderSurface} and files the result
 * under the current group.
 * <p>
 * Applies the per-primitive visual policy:
 * <ul>
 *   <li>colors are packed {@code 0xAARRGGBB};</li>
 *   <li>line widths arrive in tenths and are clamped to a minimum visual weight;</li>
 *   <li>font sizes are clamped, the default font is substituted on macOS;</li>
 *   <li>centered text is positioned around {@code (x, y)}, other text has its top-left
 *       corner there; the animation pivot is the text centre in both cases;</li>
 *   <li>images are decoded through a bounded cache.</li>
 * </ul>
 * Every primitive is registered with the {@link GroupRegistry} under the current group of
 * the {@link GroupContextStack}, using the command's timeout.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Engine thread only.
 */
public class PrimitiveBuilder {

    private final RenderSurface surface;
    private final GroupRegistry registry;
    private final GroupContextStack contexts;
    private final TemplateBindings bindings;
    private final OverlayFonts fonts;
    private final ImageDecoder images;
    private final OverlaySettings settings;

    public PrimitiveBuilder(RenderSurface surface, GroupRegistry registry, GroupContextStack contexts,
                            TemplateBindings bindings, OverlayFonts fonts, ImageDecoder images,
                            OverlaySettings settings) {
        this.surface = Objects.requireNonNull(surface, "surface");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
        this.fonts = Objects.requireNonNull(fonts, "fonts");
        this.images = Objects.requireNonNull(images, "images");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public PrimitiveHandle rect(int color, int x, int y, int w, int h, int timeout, int lineWidth) {
        PrimitiveHandle rect = surface.createRect(x, y, w, h, ColorCodec.decode(color), strokeWidth(lineWidth));
        return register(rect, timeout);
    }

    public PrimitiveHandle line(int color, int lineWidth, int x1, int y1, int x2, int y2, int timeout) {
        PrimitiveHandle line = surface.createLine(x1, y1, x2, y2, ColorCodec.decode(color), strokeWidth(lineWidth));
        return register(line, timeout);
    }

    /**
     * Draws a text. The message is a template evaluated against the current group's model,
     * and is remembered so later model changes can refresh it.
     *
     * @throws org.runekit.overlay.template.TemplateException if the template cannot be evaluated.
     */
    public PrimitiveHandle text(String message, int color, int size, int x, int y, int timeout,
                                String fontName, boolean centered, boolean shadow) {
        String displayed = bindings.render(contexts.current(), message);
        PrimitiveHandle text = surface.createText(displayed, fonts.font(fontName, size), ColorCodec.decode(color),
                shadow ? DropShadow.HARD_BLACK : null);
        surface.setData(text, TemplateBindings.TEMPLATE_DATA_KEY, message);

        Rectangle2D bounds = surface.boundingBox(text);
        Point2D origin;
        if (centered) {
            surface.setPosition(text, x - bounds.getWidth() / 2, y - bounds.getHeight() / 2);
            origin = surface.mapFromScene(text, x, y);
        } else {
            surface.setPosition(text, x, y);
            origin = surface.mapFromScene(text, x + bounds.getWidth() / 2, y + bounds.getHeight() / 2);
        }
        surface.setTransformOrigin(text, origin.getX(), origin.getY());
        return register(text, timeout);
    }

    /**
     * Draws an image at {@code (x, y)}.
     *
     * @throws IllegalArgumentException if the payload is not a supported image.
     */
    public PrimitiveHandle image(byte[] encoded, int x, int y, int timeout) {
        BufferedImage decoded = images.decode(encoded);
        PrimitiveHandle image = surface.createImage(decoded);
        surface.setPosition(image, x, y);
        return register(image, timeout);
    }

    /**
     * Converts a wire line width (tenths) into a stroke width no thinner than the
     * configured minimum.
     */
    public float strokeWidth(int lineWidth) {
        return (float) Math.max(settings.minStrokeWidth(), lineWidth / settings.strokeDivisor());
    }

    private PrimitiveHandle register(PrimitiveHandle primitive, int timeout) {
        registry.register(contexts.current(), timeout, List.of(primitive));
        return primitive;
    }
}
