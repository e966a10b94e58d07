package net.panotour.exception;

/**
 * A RAW container did not hold an embedded JPEG large enough to serve as panorama source.
 * RETRYABLE: No (re-export the panorama as JPEG/TIFF instead)
 */
public class NoDecodableImageException extends PanoramaIngestException {

    public NoDecodableImageException() {
        super(IngestErrorKind.NO_DECODABLE_IMAGE, IngestErrorKind.NO_DECODABLE_IMAGE.defaultMessage(), null);
    }
}
