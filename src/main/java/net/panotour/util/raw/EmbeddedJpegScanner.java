package net.panotour.util.raw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Locates complete JPEG streams embedded at unknown offsets inside an arbitrary buffer.
 *
 * <p>RAW containers (DNG and friends) store one or more full JPEG previews next to the
 * sensor data without a directory this class relies on. A segment starts at the
 * {@code FF D8 FF} signature and ends after the first {@code FF D9} marker found behind
 * that signature. Segments never overlap and are reported in buffer order. Candidates
 * shorter than the configured floor are dropped so that thumbnails never compete with
 * real previews.</p>
 *
 * <p>The scanner only enumerates; choosing a candidate is left to the caller.</p>
 */
public final class EmbeddedJpegScanner {

    /** Default candidate floor: 50 KB. */
    public static final int DEFAULT_MIN_SEGMENT_BYTES = 50 * 1024;

    private static final byte MARKER = (byte) 0xFF;
    private static final byte START_OF_IMAGE = (byte) 0xD8;
    private static final byte END_OF_IMAGE = (byte) 0xD9;
    private static final int SIGNATURE_LENGTH = 3;

    private final int minSegmentBytes;

    public EmbeddedJpegScanner() {
        this(DEFAULT_MIN_SEGMENT_BYTES);
    }

    public EmbeddedJpegScanner(int minSegmentBytes) {
        if (minSegmentBytes < 0) {
            throw new IllegalArgumentException("minSegmentBytes must be >= 0");
        }
        this.minSegmentBytes = minSegmentBytes;
    }

    /**
     * Finds all embedded JPEG segments that meet the size floor.
     *
     * @param buffer buffer to scan, may be null
     * @return segments in buffer order; empty when none qualifies
     */
    public List<JpegSegment> findJpegSegments(byte[] buffer) {
        if (buffer == null || buffer.length < SIGNATURE_LENGTH + 2) {
            return Collections.emptyList();
        }

        List<JpegSegment> segments = new ArrayList<>();
        int position = 0;
        while (position < buffer.length) {
            int start = indexOfStartSignature(buffer, position);
            if (start < 0) {
                break;
            }
            int endMarker = indexOfEndMarker(buffer, start + SIGNATURE_LENGTH);
            if (endMarker < 0) {
                // No end marker behind this start means none behind any later start either.
                break;
            }
            int end = endMarker + 2;
            int length = end - start;
            if (length >= minSegmentBytes) {
                segments.add(new JpegSegment(start, end));
            }
            position = end;
        }
        return segments;
    }

    /**
     * Returns the largest qualifying segment, or empty when the buffer holds none.
     */
    public Optional<JpegSegment> findLargestSegment(byte[] buffer) {
        JpegSegment largest = null;
        for (JpegSegment segment : findJpegSegments(buffer)) {
            if (largest == null || segment.length() > largest.length()) {
                largest = segment;
            }
        }
        return Optional.ofNullable(largest);
    }

    public int getMinSegmentBytes() {
        return minSegmentBytes;
    }

    private static int indexOfStartSignature(byte[] buffer, int from) {
        for (int i = from; i <= buffer.length - SIGNATURE_LENGTH; i++) {
            if (buffer[i] == MARKER && buffer[i + 1] == START_OF_IMAGE && buffer[i + 2] == MARKER) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOfEndMarker(byte[] buffer, int from) {
        for (int i = from; i < buffer.length - 1; i++) {
            if (buffer[i] == MARKER && buffer[i + 1] == END_OF_IMAGE) {
                return i;
            }
        }
        return -1;
    }
}
