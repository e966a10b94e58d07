package net.panotour.config;

import net.panotour.support.storage.InlineDataUriStorageSink;
import net.panotour.support.storage.PanoramaStorageSink;
import net.panotour.util.raw.EmbeddedJpegScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ingest pipeline collaborators that are not plain {@code @Service} beans.
 *
 * <p>The inline sink only exists when the S3 credential set is absent, the mirror image of
 * {@link S3Config}, so the storage mode is decided exactly once at startup.</p>
 */
@Configuration
public class PanoramaIngestConfig {

    private static final Logger logger = LoggerFactory.getLogger(PanoramaIngestConfig.class);

    @Bean
    public EmbeddedJpegScanner embeddedJpegScanner(PanoramaIngestProperties properties) {
        return new EmbeddedJpegScanner(properties.getMinCandidateBytes());
    }

    @Bean
    @Conditional(S3MissingCondition.class)
    public PanoramaStorageSink inlineDataUriStorageSink() {
        logger.warn("No object store configured. Panorama derivatives are returned as inline data URIs.");
        return new InlineDataUriStorageSink();
    }
}
