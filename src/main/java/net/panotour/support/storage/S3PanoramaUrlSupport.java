package net.panotour.support.storage;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Builds public URLs for stored panorama objects.
 *
 * <p>Resolution order: explicit public CDN base, then custom server URL plus bucket
 * (MinIO, DigitalOcean Spaces), then the AWS virtual-hosted bucket endpoint.</p>
 */
public class S3PanoramaUrlSupport {

    private static final Logger logger = LoggerFactory.getLogger(S3PanoramaUrlSupport.class);

    private final String publicCdnUrl;
    private final String serverUrl;
    private final String bucketName;
    private final String region;

    public S3PanoramaUrlSupport(String publicCdnUrl, String serverUrl, String bucketName, String region) {
        this.publicCdnUrl = publicCdnUrl;
        this.serverUrl = serverUrl;
        this.bucketName = bucketName;
        this.region = region;
    }

    /**
     * Builds the externally accessible URL for a storage key.
     */
    public String buildPublicUrl(String key) {
        return resolveBase()
            .map(base -> appendPath(base, key))
            .orElseThrow(() -> new IllegalStateException("No public URL base can be derived for bucket '" + bucketName + "'"));
    }

    private Optional<String> resolveBase() {
        if (StringUtils.hasText(publicCdnUrl)) {
            return Optional.of(normalizeBase(publicCdnUrl));
        }
        if (StringUtils.hasText(serverUrl) && StringUtils.hasText(bucketName)) {
            return Optional.of(appendPath(normalizeBase(serverUrl), bucketName));
        }
        if (StringUtils.hasText(bucketName) && StringUtils.hasText(region)) {
            return Optional.of("https://" + bucketName + ".s3." + region + ".amazonaws.com");
        }
        logger.warn("No public URL base configured for panorama storage (bucket={}, region={})", bucketName, region);
        return Optional.empty();
    }

    private String normalizeBase(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private String appendPath(String base, String suffix) {
        if (base == null || base.isBlank()) {
            return suffix;
        }
        if (base.endsWith("/")) {
            return base + suffix;
        }
        return base + "/" + suffix;
    }
}
