package net.panotour.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration for upload validation and source-selection thresholds.
 *
 * <p>The size floors are empirical values tuned to observed camera output, not values
 * derived from any RAW format.</p>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "panorama.ingest")
public class PanoramaIngestProperties {

    public static final long DEFAULT_MAX_UPLOAD_BYTES = 200L * 1024L * 1024L;

    @Min(1)
    private long maxUploadBytes = DEFAULT_MAX_UPLOAD_BYTES;

    @NotEmpty
    private List<String> allowedExtensions = new ArrayList<>(List.of("dng", "jpg", "jpeg", "png", "webp", "tif", "tiff"));

    @NotEmpty
    private List<String> rawExtensions = new ArrayList<>(List.of("dng"));

    @Min(0)
    private int minCandidateBytes = 50 * 1024;

    @Min(0)
    private int minEmbeddedSourceBytes = 500 * 1024;

    @DecimalMin("0.0")
    private double aspectRatioMin = 1.8;

    @DecimalMin("0.0")
    private double aspectRatioMax = 2.2;

    private Duration storageTimeout = Duration.ofSeconds(60);

    /**
     * Hard ceiling for a single upload in bytes.
     */
    public long getMaxUploadBytes() {
        return maxUploadBytes;
    }

    public void setMaxUploadBytes(long maxUploadBytes) {
        this.maxUploadBytes = maxUploadBytes;
    }

    /**
     * Filename extensions accepted at all, RAW containers included.
     */
    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    /**
     * Filename extensions treated as RAW containers that need preview extraction.
     */
    public List<String> getRawExtensions() {
        return rawExtensions;
    }

    public void setRawExtensions(List<String> rawExtensions) {
        this.rawExtensions = rawExtensions;
    }

    /**
     * Minimum length for an embedded JPEG to be considered at all.
     */
    public int getMinCandidateBytes() {
        return minCandidateBytes;
    }

    public void setMinCandidateBytes(int minCandidateBytes) {
        this.minCandidateBytes = minCandidateBytes;
    }

    /**
     * Minimum length for the largest embedded JPEG to be accepted as panorama source.
     */
    public int getMinEmbeddedSourceBytes() {
        return minEmbeddedSourceBytes;
    }

    public void setMinEmbeddedSourceBytes(int minEmbeddedSourceBytes) {
        this.minEmbeddedSourceBytes = minEmbeddedSourceBytes;
    }

    public double getAspectRatioMin() {
        return aspectRatioMin;
    }

    public void setAspectRatioMin(double aspectRatioMin) {
        this.aspectRatioMin = aspectRatioMin;
    }

    public double getAspectRatioMax() {
        return aspectRatioMax;
    }

    public void setAspectRatioMax(double aspectRatioMax) {
        this.aspectRatioMax = aspectRatioMax;
    }

    /**
     * Upper bound for writing all derivatives of one panorama to the object store.
     */
    public Duration getStorageTimeout() {
        return storageTimeout;
    }

    public void setStorageTimeout(Duration storageTimeout) {
        this.storageTimeout = storageTimeout;
    }
}
