package net.panotour.service.image;

import net.panotour.config.PanoramaIngestProperties;
import net.panotour.exception.DegenerateGeometryException;
import net.panotour.exception.UnreadableImageException;
import net.panotour.model.image.ExtractedImage;
import net.panotour.model.image.RenderOutcome;
import net.panotour.model.image.RenderedAsset;
import net.panotour.model.image.ResolutionSpec;
import net.panotour.util.image.ImageDimensionUtils;
import net.panotour.util.image.ImageDimensionUtils.Dimensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Renders the fixed set of web derivatives for a panorama source image
 *
 * Features:
 * - Reads dimensions from the codec header before touching pixel data
 * - Flags sources whose aspect ratio is far from the 2:1 equirectangular layout
 * - Fit-inside resizing that never enlarges and never crops or pads
 * - Encodes every derivative as lossy WebP with a per-resolution quality
 * - Deterministic output: no metadata, timestamps or randomness in the encoded bytes
 */
@Service
public class PanoramaResolutionPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PanoramaResolutionPipeline.class);
    private static final String WEBP_LOSSY_COMPRESSION = "Lossy";

    private final List<ResolutionSpec> resolutions;
    private final double aspectRatioMin;
    private final double aspectRatioMax;

    @Autowired
    public PanoramaResolutionPipeline(PanoramaIngestProperties properties) {
        this(ResolutionSpec.ALL, properties.getAspectRatioMin(), properties.getAspectRatioMax());
    }

    public PanoramaResolutionPipeline(List<ResolutionSpec> resolutions, double aspectRatioMin, double aspectRatioMax) {
        this.resolutions = List.copyOf(resolutions);
        this.aspectRatioMin = aspectRatioMin;
        this.aspectRatioMax = aspectRatioMax;
        ImageIO.setUseCache(false);
    }

    /**
     * Renders all derivatives of an extracted source image.
     *
     * @param extractedImage source buffer chosen by {@link SourceImageExtractor}
     * @return assets in resolution order together with advisory warnings
     * @throws UnreadableImageException if no codec can parse the buffer
     * @throws DegenerateGeometryException if the decoded width or height is zero
     *
     * @implNote Processing workflow:
     * 1. Reads width/height from the header so corrupt input fails before pixel decoding
     * 2. Adds an advisory warning when the aspect ratio is outside the tolerance band
     * 3. Decodes the pixels once and normalizes them to RGB
     * 4. Resizes and encodes each resolution; all assets exist before anything is stored
     */
    public RenderOutcome render(ExtractedImage extractedImage) {
        BufferedImage source = decode(extractedImage.bytes());
        int width = source.getWidth();
        int height = source.getHeight();

        List<String> warnings = new ArrayList<>();
        aspectRatioWarning(width, height).ifPresent(warnings::add);

        List<RenderedAsset> assets = new ArrayList<>(resolutions.size());
        for (ResolutionSpec spec : resolutions) {
            assets.add(renderResolution(source, spec));
        }
        return new RenderOutcome(assets, warnings);
    }

    /**
     * Builds the advisory warning for sources that are not roughly 2:1.
     */
    Optional<String> aspectRatioWarning(int width, int height) {
        double aspectRatio = ImageDimensionUtils.aspectRatio(width, height);
        if (ImageDimensionUtils.isWithin(aspectRatio, aspectRatioMin, aspectRatioMax)) {
            return Optional.empty();
        }
        String ratio = ImageDimensionUtils.formatRatio(aspectRatio);
        logger.warn("Aspect ratio {} is not 2:1. Image may not display correctly as 360° panorama.", ratio);
        return Optional.of("Seitenverhältnis ist " + ratio + ":1 statt 2:1. "
            + "Das Bild wird möglicherweise nicht korrekt als 360°-Panorama angezeigt.");
    }

    /**
     * Rejects geometry a panorama can't be rendered from.
     */
    static void requireRenderableGeometry(int width, int height) {
        if (width <= 0 || height <= 0) {
            logger.warn("Decoded image reports degenerate dimensions {}x{}.", width, height);
            throw new DegenerateGeometryException(width, height);
        }
    }

    private BufferedImage decode(byte[] imageBytes) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(imageBytes);
             ImageInputStream iis = ImageIO.createImageInputStream(bais)) {
            if (iis == null) {
                throw new UnreadableImageException();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                logger.warn("No ImageReader accepts the source buffer ({} bytes). Format unsupported or corrupt.", imageBytes.length);
                throw new UnreadableImageException();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                requireRenderableGeometry(width, height);
                logger.info("Image dimensions: {}x{} ({})", width, height, reader.getFormatName());

                BufferedImage decoded = reader.read(0);
                if (decoded == null) {
                    throw new UnreadableImageException();
                }
                return toRgb(decoded);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            logger.warn("Could not decode source image: {}", e.getMessage());
            throw new UnreadableImageException(e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // ImageIO plugins signal some malformed headers with unchecked exceptions
            logger.warn("Image codec rejected source image: {}", e.getMessage());
            throw new UnreadableImageException(e);
        }
    }

    // Convert to a standard RGB colorspace so every writer sees the same pixel layout
    private BufferedImage toRgb(BufferedImage decoded) {
        if (decoded.getType() == BufferedImage.TYPE_INT_RGB) {
            return decoded;
        }
        BufferedImage rgb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        g.drawImage(decoded, 0, 0, null);
        g.dispose();
        return rgb;
    }

    private RenderedAsset renderResolution(BufferedImage source, ResolutionSpec spec) {
        Dimensions target = ImageDimensionUtils.fitInside(
            source.getWidth(), source.getHeight(), spec.maxWidth(), spec.maxHeight());

        BufferedImage output = target.sameAs(source.getWidth(), source.getHeight())
            ? source
            : resize(source, target.width(), target.height());

        byte[] encoded = encodeWebp(output, spec);
        logger.info("Generated {}: {}x{} ({} KB)", spec.label(), target.width(), target.height(), encoded.length / 1024);
        return new RenderedAsset(spec.label(), encoded, target.width(), target.height());
    }

    /**
     * Downscales in halving steps before the final bicubic pass so large reductions
     * (e.g. 8K source to the 512 px preview) don't alias.
     */
    private BufferedImage resize(BufferedImage source, int targetWidth, int targetHeight) {
        BufferedImage current = source;
        int width = source.getWidth();
        int height = source.getHeight();
        while (width / 2 >= targetWidth && height / 2 >= targetHeight) {
            width = width / 2;
            height = height / 2;
            current = draw(current, width, height);
        }
        if (width != targetWidth || height != targetHeight) {
            current = draw(current, targetWidth, targetHeight);
        }
        return current;
    }

    private BufferedImage draw(BufferedImage source, int width, int height) {
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = dst.createGraphics();
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.drawImage(source, 0, 0, width, height, null);
        g2d.dispose();
        return dst;
    }

    private byte[] encodeWebp(BufferedImage image, ResolutionSpec spec) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(RenderedAsset.MIME_TYPE);
        if (!writers.hasNext()) {
            logger.error("No WebP ImageWriter registered. Cannot encode {} derivative.", spec.label());
            throw new IllegalStateException("No WebP ImageWriter available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageWriteParam webpParams = writer.getDefaultWriteParam();
            webpParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            webpParams.setCompressionType(lossyCompressionType(webpParams));
            webpParams.setCompressionQuality(spec.compressionQuality());

            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, null), webpParams);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            logger.error("WebP encoding failed for {} derivative: {}", spec.label(), e.getMessage(), e);
            throw new IllegalStateException("WebP encoding failed for '" + spec.label() + "'", e);
        } finally {
            writer.dispose();
        }
    }

    private String lossyCompressionType(ImageWriteParam params) {
        String[] types = params.getCompressionTypes();
        for (String type : types) {
            if (WEBP_LOSSY_COMPRESSION.equalsIgnoreCase(type)) {
                return type;
            }
        }
        return types[0];
    }
}
