package net.panotour.util.image;

import java.util.Locale;

/**
 * Single Source of Truth for panorama geometry: aspect-ratio checks and fit-inside sizing.
 */
public final class ImageDimensionUtils {

    private ImageDimensionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Width divided by height; 0.0 when the height is not positive.
     */
    public static double aspectRatio(int width, int height) {
        return height <= 0 ? 0.0 : (double) width / height;
    }

    /**
     * Checks whether a ratio lies inside the inclusive tolerance band.
     */
    public static boolean isWithin(double ratio, double min, double max) {
        return ratio >= min && ratio <= max;
    }

    /**
     * Formats a ratio with two decimals for messages, independent of the JVM locale.
     */
    public static String formatRatio(double ratio) {
        return String.format(Locale.ROOT, "%.2f", ratio);
    }

    /**
     * Computes the largest size that fits inside the box while keeping the aspect ratio.
     * The box is first clamped to the source so the result is never larger than the source.
     *
     * @param sourceWidth source width in pixels, must be positive
     * @param sourceHeight source height in pixels, must be positive
     * @param boxWidth maximum target width
     * @param boxHeight maximum target height
     * @return target dimensions, both at least 1 pixel
     */
    public static Dimensions fitInside(int sourceWidth, int sourceHeight, int boxWidth, int boxHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException("Source dimensions must be positive: " + sourceWidth + "x" + sourceHeight);
        }
        int clampedWidth = Math.min(boxWidth, sourceWidth);
        int clampedHeight = Math.min(boxHeight, sourceHeight);

        double scale = Math.min(1.0d, Math.min(
            (double) clampedWidth / sourceWidth,
            (double) clampedHeight / sourceHeight));

        int targetWidth = Math.max(1, Math.min(clampedWidth, (int) Math.round(sourceWidth * scale)));
        int targetHeight = Math.max(1, Math.min(clampedHeight, (int) Math.round(sourceHeight * scale)));
        return new Dimensions(targetWidth, targetHeight);
    }

    /**
     * Pixel dimensions of an image.
     */
    public record Dimensions(int width, int height) {

        public boolean sameAs(int otherWidth, int otherHeight) {
            return width == otherWidth && height == otherHeight;
        }
    }
}
