package net.panotour.model.image;

import java.util.List;

/**
 * Named target box for one web derivative of a panorama.
 *
 * <p>The box is an upper bound: rendering clamps it to the source dimensions and never
 * enlarges the image.</p>
 *
 * @param label storage and response label ({@code high}, {@code medium}, {@code low})
 * @param maxWidth maximum width in pixels
 * @param maxHeight maximum height in pixels
 * @param quality lossy encoder quality, 0-100
 */
public record ResolutionSpec(String label, int maxWidth, int maxHeight, int quality) {

    public static final ResolutionSpec HIGH = new ResolutionSpec("high", 4096, 2048, 85);
    public static final ResolutionSpec MEDIUM = new ResolutionSpec("medium", 2048, 1024, 85);
    public static final ResolutionSpec LOW = new ResolutionSpec("low", 512, 256, 60);

    /** All derivatives in rendering and response order. */
    public static final List<ResolutionSpec> ALL = List.of(HIGH, MEDIUM, LOW);

    public ResolutionSpec {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Resolution label is required");
        }
        if (maxWidth <= 0 || maxHeight <= 0) {
            throw new IllegalArgumentException("Resolution box must be positive: " + maxWidth + "x" + maxHeight);
        }
        if (quality < 0 || quality > 100) {
            throw new IllegalArgumentException("Quality must be within 0-100: " + quality);
        }
    }

    /** Encoder quality as the 0.0-1.0 fraction expected by {@code ImageWriteParam}. */
    public float compressionQuality() {
        return quality / 100f;
    }
}
