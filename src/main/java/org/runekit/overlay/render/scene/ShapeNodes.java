package org.runekit.overlay.render.scene;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Line2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;

/**
 * Leaf nodes without text layout: outlined rectangles, lines and images.
 */
final class ShapeNodes {

    private ShapeNodes() {
    }

    static final class RectNode extends SceneNode {

        private final Rectangle2D rect;
        private final Color color;
        private final float strokeWidth;

        RectNode(long id, Rectangle2D rect, Color color, float strokeWidth) {
            super(id);
            this.rect = rect;
            this.color = color;
            this.strokeWidth = strokeWidth;
        }

        @Override
        public Kind kind() {
            return Kind.RECT;
        }

        @Override
        Rectangle2D localBounds() {
            double half = strokeWidth / 2.0;
            return new Rectangle2D.Double(rect.getX() - half, rect.getY() - half,
                    rect.getWidth() + strokeWidth, rect.getHeight() + strokeWidth);
        }

        @Override
        void paint(Graphics2D g, long nowMillis) {
            g.setColor(color);
            g.setStroke(new BasicStroke(strokeWidth));
            g.draw(rect);
        }

        Color color() {
            return color;
        }

        float strokeWidth() {
            return strokeWidth;
        }
    }

    static final class LineNode extends SceneNode {

        private final Line2D line;
        private final Color color;
        private final float strokeWidth;

        LineNode(long id, Line2D line, Color color, float strokeWidth) {
            super(id);
            this.line = line;
            this.color = color;
            this.strokeWidth = strokeWidth;
        }

        @Override
        public Kind kind() {
            return Kind.LINE;
        }

        @Override
        Rectangle2D localBounds() {
            Rectangle2D bounds = line.getBounds2D();
            double half = strokeWidth / 2.0;
            return new Rectangle2D.Double(bounds.getX() - half, bounds.getY() - half,
                    bounds.getWidth() + strokeWidth, bounds.getHeight() + strokeWidth);
        }

        @Override
        void paint(Graphics2D g, long nowMillis) {
            g.setColor(color);
            g.setStroke(new BasicStroke(strokeWidth, BasicStroke.CAP_SQUARE, BasicStroke.JOIN_MITER));
            g.draw(line);
        }

        float strokeWidth() {
            return strokeWidth;
        }
    }

    static final class ImageNode extends SceneNode {

        private final BufferedImage image;

        ImageNode(long id, BufferedImage image) {
            super(id);
            this.image = image;
        }

        @Override
        public Kind kind() {
            return Kind.IMAGE;
        }

        @Override
        Rectangle2D localBounds() {
            return new Rectangle2D.Double(0, 0, image.getWidth(), image.getHeight());
        }

        @Override
        void paint(Graphics2D g, long nowMillis) {
            g.drawImage(image, 0, 0, null);
        }
    }
}
