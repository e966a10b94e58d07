package net.panotour.service.image;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.panotour.config.PanoramaIngestProperties;
import net.panotour.exception.NoDecodableImageException;
import net.panotour.exception.UnreadableImageException;
import net.panotour.model.image.ExtractedImage;
import net.panotour.util.FileExtensionUtils;
import net.panotour.util.raw.EmbeddedJpegScanner;
import net.panotour.util.raw.ImageSignatures;
import net.panotour.util.raw.JpegSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Chooses the single decodable image buffer for an upload.
 *
 * <p>RAW containers are never decoded. Their largest embedded JPEG preview is used instead,
 * provided it is large enough to feed a 4K derivative; anything else is passed through
 * untouched.</p>
 */
@Service
public class SourceImageExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SourceImageExtractor.class);

    public static final String EMBEDDED_PREVIEW_WARNING =
        "DNG wurde über eingebettetes JPEG-Preview verarbeitet. "
            + "Für volle RAW-Qualität bitte das exportierte JPEG/TIFF hochladen.";

    private final EmbeddedJpegScanner scanner;
    private final List<String> rawExtensions;
    private final int minEmbeddedSourceBytes;

    @Autowired
    public SourceImageExtractor(EmbeddedJpegScanner scanner, PanoramaIngestProperties properties) {
        this(scanner, properties.getRawExtensions(), properties.getMinEmbeddedSourceBytes());
    }

    public SourceImageExtractor(EmbeddedJpegScanner scanner, List<String> rawExtensions, int minEmbeddedSourceBytes) {
        this.scanner = scanner;
        this.rawExtensions = List.copyOf(rawExtensions);
        this.minEmbeddedSourceBytes = minEmbeddedSourceBytes;
    }

    /**
     * Produces the image buffer the resolution pipeline renders from.
     *
     * @param rawBytes complete upload payload
     * @param filename original filename, used for RAW detection only
     * @return extracted image with its origin and warnings
     * @throws NoDecodableImageException if a RAW container has no usable embedded preview
     * @throws UnreadableImageException if a non-RAW upload carries no known image signature
     */
    public ExtractedImage extract(byte[] rawBytes, String filename) {
        if (isRawContainer(filename)) {
            return extractEmbeddedPreview(rawBytes, filename);
        }

        if (!ImageSignatures.isRecognized(rawBytes)) {
            logger.warn("Upload {} does not start with a known image signature; refusing to decode.", filename);
            throw new UnreadableImageException();
        }
        return ExtractedImage.direct(rawBytes);
    }

    /**
     * Whether the filename denotes a RAW container handled via its embedded preview.
     */
    public boolean isRawContainer(String filename) {
        return FileExtensionUtils.hasExtension(filename, rawExtensions);
    }

    private ExtractedImage extractEmbeddedPreview(byte[] rawBytes, String filename) {
        logger.info("Processing RAW container {} ({} MB)", filename,
            FileExtensionUtils.megabytes(rawBytes == null ? 0 : rawBytes.length));

        Optional<JpegSegment> largest = scanner.findLargestSegment(rawBytes);
        if (largest.isEmpty()) {
            logger.warn("RAW container {}: no embedded JPEG of at least {} bytes found.",
                filename, scanner.getMinSegmentBytes());
            throw new NoDecodableImageException();
        }

        JpegSegment segment = largest.get();
        if (segment.length() < minEmbeddedSourceBytes) {
            logger.warn("RAW container {}: largest embedded JPEG is only {} bytes (minimum {}). Rejecting thumbnail-only container.",
                filename, segment.length(), minEmbeddedSourceBytes);
            throw new NoDecodableImageException();
        }

        logger.info("RAW container {}: using embedded JPEG at [{}, {}) ({} MB)",
            filename, segment.start(), segment.end(), FileExtensionUtils.megabytes(segment.length()));
        byte[] preview = Arrays.copyOfRange(rawBytes, segment.start(), segment.end());
        return ExtractedImage.embeddedPreview(preview, EMBEDDED_PREVIEW_WARNING);
    }
}
