package net.panotour.model.image;

import java.util.Arrays;

/**
 * One encoded web derivative of a panorama.
 *
 * @param label resolution label this asset was rendered for
 * @param encodedBytes encoded WebP payload
 * @param width rendered width in pixels
 * @param height rendered height in pixels
 */
public record RenderedAsset(String label, byte[] encodedBytes, int width, int height) {

    public static final String FILE_EXTENSION = ".webp";
    public static final String MIME_TYPE = "image/webp";

    public RenderedAsset {
        if (encodedBytes == null || encodedBytes.length == 0) {
            throw new IllegalArgumentException("Rendered asset '" + label + "' has no encoded bytes");
        }
        encodedBytes = Arrays.copyOf(encodedBytes, encodedBytes.length);
    }

    @Override
    public byte[] encodedBytes() {
        return Arrays.copyOf(encodedBytes, encodedBytes.length);
    }

    public int byteSize() {
        return encodedBytes.length;
    }
}
