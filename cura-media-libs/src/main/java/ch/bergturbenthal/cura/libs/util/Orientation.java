package ch.bergturbenthal.cura.libs.util;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * EXIF orientation handling.
 */
public class Orientation {

    public static boolean swapsDimensions(final int orientation) {
        return orientation >= 5 && orientation <= 8;
    }

    /**
     * Draws the image upright into a new RGB image. Unknown values are treated as 1.
     */
    public static BufferedImage apply(final BufferedImage image, final int orientation) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final AffineTransform t;
        switch (orientation) {
        case 2: // flip x
            t = new AffineTransform(-1, 0, 0, 1, width, 0);
            break;
        case 3: // rotate 180
            t = new AffineTransform(-1, 0, 0, -1, width, height);
            break;
        case 4: // flip y
            t = new AffineTransform(1, 0, 0, -1, 0, height);
            break;
        case 5: // transpose
            t = new AffineTransform(0, 1, 1, 0, 0, 0);
            break;
        case 6: // rotate 90 clockwise
            t = new AffineTransform(0, 1, -1, 0, height, 0);
            break;
        case 7: // transverse
            t = new AffineTransform(0, -1, -1, 0, height, width);
            break;
        case 8: // rotate 90 counter clockwise
            t = new AffineTransform(0, -1, 1, 0, 0, width);
            break;
        default:
            t = new AffineTransform();
        }
        final boolean swap = swapsDimensions(orientation);
        final BufferedImage targetImage = new BufferedImage(swap ? height : width, swap ? width : height,
                BufferedImage.TYPE_INT_RGB);
        final Graphics2D graphics = targetImage.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, targetImage.getWidth(), targetImage.getHeight());
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            graphics.drawImage(image, t, null);
        } finally {
            graphics.dispose();
        }
        return targetImage;
    }
}
