package net.panotour.exception;

/**
 * The decoded image reported a zero or missing width or height.
 * RETRYABLE: No
 */
public class DegenerateGeometryException extends PanoramaIngestException {

    private final int width;
    private final int height;

    public DegenerateGeometryException(int width, int height) {
        super(IngestErrorKind.DEGENERATE_GEOMETRY, IngestErrorKind.DEGENERATE_GEOMETRY.defaultMessage(), null);
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
