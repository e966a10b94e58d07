package net.panotour.exception;

/**
 * The codec could not parse the header or pixels of the chosen image buffer.
 * RETRYABLE: No (same bytes will fail again)
 */
public class UnreadableImageException extends PanoramaIngestException {

    public UnreadableImageException(Throwable cause) {
        super(IngestErrorKind.UNREADABLE_IMAGE, IngestErrorKind.UNREADABLE_IMAGE.defaultMessage(), cause);
    }

    public UnreadableImageException() {
        this(null);
    }
}
