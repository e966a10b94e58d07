package net.panotour.exception;

/**
 * A configured storage backend rejected a write or a listing (service error, permissions, timeout).
 * RETRYABLE: Yes, by the caller re-submitting; the pipeline itself makes a single attempt.
 */
public class StorageUnavailableException extends PanoramaIngestException {

    private static final String LISTING_FAILED_PREFIX = "Auflisten fehlgeschlagen";

    private final String panoramaId;

    public StorageUnavailableException(String panoramaId, String detail, Throwable cause) {
        this(panoramaId, IngestErrorKind.STORAGE_UNAVAILABLE.defaultMessage(), detail, cause);
    }

    private StorageUnavailableException(String panoramaId, String prefix, String detail, Throwable cause) {
        super(IngestErrorKind.STORAGE_UNAVAILABLE, prefix + ": " + detail, cause);
        this.panoramaId = panoramaId;
    }

    /**
     * The bucket could not be listed; no panorama is involved.
     */
    public static StorageUnavailableException listingFailed(String detail, Throwable cause) {
        return new StorageUnavailableException(null, LISTING_FAILED_PREFIX, detail, cause);
    }

    public String getPanoramaId() {
        return panoramaId;
    }
}
