package net.panotour.exception;

/**
 * Stable failure taxonomy of the panorama ingest pipeline.
 *
 * <p>Each kind carries the default German message shown to uploaders. Individual
 * exceptions may refine the message (e.g. which validation failed), but the kind
 * alone decides how callers react.</p>
 */
public enum IngestErrorKind {

    INVALID_UPLOAD("Ungültiger Upload"),
    NO_DECODABLE_IMAGE("Kein eingebettetes JPEG im DNG gefunden. "
        + "Bitte exportiere das Panorama als JPEG oder TIFF und lade diese Datei hoch."),
    UNREADABLE_IMAGE("Ungültiges Bildformat"),
    DEGENERATE_GEOMETRY("Ungültiges Bildformat: Bildabmessungen fehlen"),
    STORAGE_UNAVAILABLE("Speichern fehlgeschlagen");

    private final String defaultMessage;

    IngestErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    /** German message suitable for the client-facing error field. */
    public String defaultMessage() {
        return defaultMessage;
    }
}
