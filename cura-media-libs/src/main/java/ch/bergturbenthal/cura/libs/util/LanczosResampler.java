package ch.bergturbenthal.cura.libs.util;

import java.awt.image.BufferedImage;

/**
 * Separable Lanczos (a = 3) resampling of RGB images.
 */
public class LanczosResampler {
    private static final int RADIUS = 3;

    public static BufferedImage resize(final BufferedImage source, final int targetWidth, final int targetHeight) {
        if (targetWidth <= 0 || targetHeight <= 0)
            throw new IllegalArgumentException("Invalid target size " + targetWidth + "x" + targetHeight);
        final int sourceWidth = source.getWidth();
        final int sourceHeight = source.getHeight();
        final int[] sourcePixels = source.getRGB(0, 0, sourceWidth, sourceHeight, null, 0, sourceWidth);

        final Contributions horizontal = contributions(sourceWidth, targetWidth);
        final float[] intermediate = new float[targetWidth * sourceHeight * 3];
        for (int y = 0; y < sourceHeight; y++) {
            final int rowOffset = y * sourceWidth;
            for (int x = 0; x < targetWidth; x++) {
                final float[] weights = horizontal.weights[x];
                final int start = horizontal.start[x];
                float r = 0, g = 0, b = 0;
                for (int i = 0; i < weights.length; i++) {
                    final int rgb = sourcePixels[rowOffset + start + i];
                    final float w = weights[i];
                    r += ((rgb >> 16) & 0xff) * w;
                    g += ((rgb >> 8) & 0xff) * w;
                    b += (rgb & 0xff) * w;
                }
                final int index = (y * targetWidth + x) * 3;
                intermediate[index] = r;
                intermediate[index + 1] = g;
                intermediate[index + 2] = b;
            }
        }

        final Contributions vertical = contributions(sourceHeight, targetHeight);
        final int[] targetPixels = new int[targetWidth * targetHeight];
        for (int y = 0; y < targetHeight; y++) {
            final float[] weights = vertical.weights[y];
            final int start = vertical.start[y];
            for (int x = 0; x < targetWidth; x++) {
                float r = 0, g = 0, b = 0;
                for (int i = 0; i < weights.length; i++) {
                    final int index = ((start + i) * targetWidth + x) * 3;
                    final float w = weights[i];
                    r += intermediate[index] * w;
                    g += intermediate[index + 1] * w;
                    b += intermediate[index + 2] * w;
                }
                targetPixels[y * targetWidth + x] = (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
            }
        }
        final BufferedImage target = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_RGB);
        target.setRGB(0, 0, targetWidth, targetHeight, targetPixels, 0, targetWidth);
        return target;
    }

    static double kernel(final double x) {
        if (x == 0)
            return 1;
        if (x <= -RADIUS || x >= RADIUS)
            return 0;
        final double px = Math.PI * x;
        return RADIUS * Math.sin(px) * Math.sin(px / RADIUS) / (px * px);
    }

    private static Contributions contributions(final int sourceSize, final int targetSize) {
        final double scale = (double) targetSize / sourceSize;
        // widen the kernel when shrinking
        final double filterScale = Math.max(1.0, 1.0 / scale);
        final double support = RADIUS * filterScale;
        final int[] starts = new int[targetSize];
        final float[][] weights = new float[targetSize][];
        for (int i = 0; i < targetSize; i++) {
            final double center = (i + 0.5) / scale;
            final int left = Math.max(0, (int) Math.floor(center - support));
            final int right = Math.min(sourceSize - 1, (int) Math.ceil(center + support));
            final float[] w = new float[right - left + 1];
            double sum = 0;
            for (int j = left; j <= right; j++) {
                final double value = kernel((j + 0.5 - center) / filterScale);
                w[j - left] = (float) value;
                sum += value;
            }
            if (sum == 0) {
                final int nearest = Math.min(sourceSize - 1, (int) center);
                starts[i] = nearest;
                weights[i] = new float[] { 1f };
                continue;
            }
            for (int j = 0; j < w.length; j++)
                w[j] = (float) (w[j] / sum);
            starts[i] = left;
            weights[i] = w;
        }
        return new Contributions(starts, weights);
    }

    private static int clamp(final float value) {
        final int rounded = Math.round(value);
        if (rounded < 0)
            return 0;
        if (rounded > 255)
            return 255;
        return rounded;
    }

    private static class Contributions {
        private final int[] start;
        private final float[][] weights;

        private Contributions(final int[] start, final float[][] weights) {
            this.start = start;
            this.weights = weights;
        }
    }
}
