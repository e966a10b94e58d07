package net.panotour.exception;

/**
 * Upload rejected before any decoding: missing payload, disallowed extension or oversized file.
 * RETRYABLE: No (the same file fails again)
 */
public class InvalidUploadException extends PanoramaIngestException {

    public static final String MISSING_FILE_MESSAGE = "Keine Datei gefunden";
    public static final String UNSUPPORTED_EXTENSION_MESSAGE =
        "Ungültiges Dateiformat. Bitte DNG, JPEG, PNG, TIFF oder WebP verwenden.";

    public InvalidUploadException(String message) {
        super(IngestErrorKind.INVALID_UPLOAD, message, null);
    }

    public static InvalidUploadException missingFile() {
        return new InvalidUploadException(MISSING_FILE_MESSAGE);
    }

    public static InvalidUploadException unsupportedExtension() {
        return new InvalidUploadException(UNSUPPORTED_EXTENSION_MESSAGE);
    }

    public static InvalidUploadException tooLarge(long maxBytes) {
        return new InvalidUploadException("Datei zu groß. Maximum ist " + (maxBytes / (1024 * 1024)) + "MB.");
    }
}
