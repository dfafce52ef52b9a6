package org.runekit.overlay.render.scene;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.awt.geom.AffineTransform;
import java.awt.geom.Rectangle2D;

import org.runekit.overlay.render.DropShadow;

/**
 * Multi-line text node with optional drop shadow and a highlight animation.
 * <p>
 * The highlight flashes the text white at three times its size and eases back to the
 * normal color and scale over {@link #ANIMATION_MILLIS}, pivoting around the transform
 * origin.
 */
final class TextNode extends SceneNode {

    static final long ANIMATION_MILLIS = 500;
    static final double ANIMATION_START_SCALE = 3.0;

    private static final FontRenderContext FRC = new FontRenderContext(null, true, true);

    private final Font font;
    private final Color color;
    private final DropShadow shadow;
    private String text;
    private long animationStart = -1;

    TextNode(long id, String text, Font font, Color color, DropShadow shadow) {
        super(id);
        this.text = text == null ? "" : text;
        this.font = font;
        this.color = color;
        this.shadow = shadow;
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }

    String text() {
        return text;
    }

    void setText(String text) {
        this.text = text == null ? "" : text;
    }

    Font font() {
        return font;
    }

    Color color() {
        return color;
    }

    DropShadow shadow() {
        return shadow;
    }

    void startAnimation(long nowMillis) {
        this.animationStart = nowMillis;
    }

    boolean isAnimating(long nowMillis) {
        return animationStart >= 0 && nowMillis - animationStart < ANIMATION_MILLIS;
    }

    @Override
    Rectangle2D localBounds() {
        String[] lines = text.split("\n", -1);
        double width = 0;
        double height = 0;
        for (String line : lines) {
            width = Math.max(width, font.getStringBounds(line, FRC).getWidth());
            height += lineHeight(line);
        }
        return new Rectangle2D.Double(0, 0, width, height);
    }

    @Override
    void paint(Graphics2D g, long nowMillis) {
        g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g.setFont(font);

        Color paintColor = color;
        AffineTransform saved = g.getTransform();
        if (isAnimating(nowMillis)) {
            double progress = (nowMillis - animationStart) / (double) ANIMATION_MILLIS;
            paintColor = blend(Color.WHITE, color, progress);
            double scale = ANIMATION_START_SCALE + (1.0 - ANIMATION_START_SCALE) * progress;
            g.translate(originX, originY);
            g.scale(scale, scale);
            g.translate(-originX, -originY);
        }

        String[] lines = text.split("\n", -1);
        float baseline = 0;
        for (String line : lines) {
            LineMetrics metrics = font.getLineMetrics(line, FRC);
            baseline += metrics.getAscent();
            if (shadow != null) {
                g.setColor(shadow.color());
                g.drawString(line, (float) shadow.offsetX(), baseline + shadow.offsetY());
            }
            g.setColor(paintColor);
            g.drawString(line, 0f, baseline);
            baseline += metrics.getDescent() + metrics.getLeading();
        }
        g.setTransform(saved);
    }

    private double lineHeight(String line) {
        return font.getLineMetrics(line, FRC).getHeight();
    }

    private static Color blend(Color from, Color to, double progress) {
        double p = Math.max(0.0, Math.min(1.0, progress));
        return new Color(
                (int) Math.round(from.getRed() + (to.getRed() - from.getRed()) * p),
                (int) Math.round(from.getGreen() + (to.getGreen() - from.getGreen()) * p),
                (int) Math.round(from.getBlue() + (to.getBlue() - from.getBlue()) * p),
                (int) Math.round(from.getAlpha() + (to.getAlpha() - from.getAlpha()) * p));
    }
}
