package net.panotour.util.raw;

/**
 * Half-open byte range {@code [start, end)} bounding one embedded JPEG.
 */
public record JpegSegment(int start, int end) {

    public JpegSegment {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid JPEG segment range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
