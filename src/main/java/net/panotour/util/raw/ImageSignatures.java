package net.panotour.util.raw;

/**
 * Magic-byte checks for the image formats the pipeline can decode.
 */
public final class ImageSignatures {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};
    private static final byte[] TIFF_LITTLE_ENDIAN = {'I', 'I', 0x2A, 0x00};
    private static final byte[] TIFF_BIG_ENDIAN = {'M', 'M', 0x00, 0x2A};
    private static final int WEBP_FOURCC_OFFSET = 8;

    private ImageSignatures() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns true when the buffer starts with a JPEG, PNG, WebP or TIFF signature.
     */
    public static boolean isRecognized(byte[] bytes) {
        return isJpeg(bytes)
            || startsWith(bytes, PNG, 0)
            || (startsWith(bytes, RIFF, 0) && startsWith(bytes, WEBP, WEBP_FOURCC_OFFSET))
            || startsWith(bytes, TIFF_LITTLE_ENDIAN, 0)
            || startsWith(bytes, TIFF_BIG_ENDIAN, 0);
    }

    public static boolean isJpeg(byte[] bytes) {
        return startsWith(bytes, JPEG, 0);
    }

    private static boolean startsWith(byte[] bytes, byte[] signature, int offset) {
        if (bytes == null || bytes.length < offset + signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (bytes[offset + i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
