/**
 * Record representing the single decodable image chosen for rendering
 *
 * Features:
 * - Immutable container for the chosen image bytes and their origin
 * - Carries advisory warnings collected while choosing the source
 * - Rejects empty buffers and buffers without a known image signature
 * - Takes ownership of the byte array instead of copying large payloads
 *
 * @param bytes Self-contained image buffer decodable by a standard codec
 * @param sourceKind Whether the buffer is the upload itself or an embedded preview
 * @param warnings Human-readable warnings in the order they were raised
 */

package net.panotour.model.image;

import java.util.List;
import net.panotour.util.raw.ImageSignatures;

public record ExtractedImage(byte[] bytes, SourceKind sourceKind, List<String> warnings) {

    public ExtractedImage {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Extracted image bytes must not be empty");
        }
        if (!ImageSignatures.isRecognized(bytes)) {
            throw new IllegalArgumentException("Extracted image bytes do not start with a known image signature");
        }
        if (sourceKind == null) {
            throw new IllegalArgumentException("Source kind is required");
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Creates an extracted image for an upload that is decoded as-is.
     */
    public static ExtractedImage direct(byte[] bytes) {
        return new ExtractedImage(bytes, SourceKind.DIRECT_IMAGE, List.of());
    }

    /**
     * Creates an extracted image for a preview carved out of a RAW container.
     */
    public static ExtractedImage embeddedPreview(byte[] bytes, String warning) {
        return new ExtractedImage(bytes, SourceKind.EMBEDDED_PREVIEW, List.of(warning));
    }

    public int byteSize() {
        return bytes.length;
    }
}
