package net.panotour.testsupport;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Random;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * In-memory image fixtures: real JPEGs encoded with ImageIO, synthetic JPEG-shaped byte
 * ranges for the scanner, and fake DNG containers wrapping them.
 */
public final class PanoramaTestImages {

    private static final byte[] TIFF_LITTLE_ENDIAN_HEADER = {'I', 'I', 0x2A, 0x00};
    private static final byte CONTAINER_FILLER = 0x11;

    private PanoramaTestImages() {
    }

    /** Smooth horizontal/vertical gradient; compresses well. */
    public static byte[] gradientJpeg(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = (x * 255) / Math.max(1, width - 1);
                int g = (y * 255) / Math.max(1, height - 1);
                int b = 128;
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return encodeJpeg(image, 0.85f);
    }

    /**
     * Random 2x2 pixel blocks; compresses badly, so even moderate sizes yield multi-megabyte JPEGs.
     */
    public static byte[] noiseJpeg(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y += 2) {
            for (int x = 0; x < width; x += 2) {
                int rgb = random.nextInt(0x1000000);
                for (int dy = 0; dy < 2 && y + dy < height; dy++) {
                    for (int dx = 0; dx < 2 && x + dx < width; dx++) {
                        image.setRGB(x + dx, y + dy, rgb);
                    }
                }
            }
        }
        return encodeJpeg(image, 0.95f);
    }

    /**
     * Byte range that only looks like a JPEG to the marker scanner: {@code FF D8 FF E0},
     * zero filler, {@code FF D9}. Not decodable.
     */
    public static byte[] syntheticJpegSegment(int totalLength) {
        if (totalLength < 6) {
            throw new IllegalArgumentException("Synthetic segment needs at least 6 bytes");
        }
        byte[] segment = new byte[totalLength];
        segment[0] = (byte) 0xFF;
        segment[1] = (byte) 0xD8;
        segment[2] = (byte) 0xFF;
        segment[3] = (byte) 0xE0;
        segment[totalLength - 2] = (byte) 0xFF;
        segment[totalLength - 1] = (byte) 0xD9;
        return segment;
    }

    /**
     * Little-endian TIFF header, filler, then each payload separated by filler.
     */
    public static byte[] fakeDng(byte[]... payloads) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(TIFF_LITTLE_ENDIAN_HEADER);
        out.writeBytes(filler(1024));
        for (byte[] payload : payloads) {
            out.writeBytes(payload);
            out.writeBytes(filler(4096));
        }
        return out.toByteArray();
    }

    public static byte[] filler(int length) {
        byte[] filler = new byte[length];
        Arrays.fill(filler, CONTAINER_FILLER);
        return filler;
    }

    private static byte[] encodeJpeg(BufferedImage image, float quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            ImageWriteParam params = writer.getDefaultWriteParam();
            params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            params.setCompressionQuality(quality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), params);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
