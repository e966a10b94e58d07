/**
 * Configuration for the S3-compatible object store that holds panorama derivatives
 *
 * Features:
 * - Creates S3Client bean only when the credential set is present
 * - Supports custom endpoint URL for MinIO or other S3 compatible services
 * - Builds the persistent storage sink with bucket, public URL base and write timeout
 * - Fails startup when the configuration is present but unusable
 */
package net.panotour.config;

import net.panotour.support.storage.PanoramaStorageSink;
import net.panotour.support.storage.S3PanoramaStorageSink;
import net.panotour.support.storage.S3PanoramaUrlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String s3ServerUrl;
    private final String s3Region;

    public S3Config(@Value("${s3.access-key-id:${S3_ACCESS_KEY_ID:}}") String accessKeyId,
                    @Value("${s3.secret-access-key:${S3_SECRET_ACCESS_KEY:}}") String secretAccessKey,
                    @Value("${s3.server-url:${S3_SERVER_URL:}}") String s3ServerUrl,
                    @Value("${s3.region:${AWS_REGION:us-west-2}}") String s3Region) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.s3ServerUrl = s3ServerUrl;
        this.s3Region = s3Region;
    }

    /**
     * Creates and configures S3Client bean for panorama uploads
     * - Validates required configuration parameters before creating client
     * - Overrides endpoint for compatibility with MinIO or local S3 services
     * - Uses static credentials provider for authentication
     *
     * @return Configured S3Client instance
     */
    @Bean(destroyMethod = "close") // Ensure Spring calls close() on S3Client shutdown
    public S3Client s3Client() {
        if (!hasText(accessKeyId) || !hasText(secretAccessKey)) {
            throw new IllegalStateException("S3 credentials are incomplete. Ensure s3.access-key-id and s3.secret-access-key are configured.");
        }

        try {
            var builder = S3Client.builder()
                    .region(Region.of(s3Region))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create(accessKeyId, secretAccessKey)));
            if (hasText(s3ServerUrl)) {
                builder.endpointOverride(URI.create(s3ServerUrl));
                logger.info("Configuring S3Client with custom endpoint {} and region {}", s3ServerUrl, s3Region);
            } else {
                logger.info("Configuring S3Client for AWS-managed endpoint in region {}", s3Region);
            }
            return builder.build();
        } catch (RuntimeException ex) {
            logger.error("Failed to create S3Client bean due to configuration error", ex);
            throw new IllegalStateException("Failed to configure S3Client", ex);
        }
    }

    /**
     * Public URL builder for stored objects.
     */
    @Bean
    public S3PanoramaUrlSupport s3PanoramaUrlSupport(@Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName,
                                                     @Value("${s3.public-cdn-url:${S3_PUBLIC_CDN_URL:}}") String publicCdnUrl) {
        return new S3PanoramaUrlSupport(publicCdnUrl, s3ServerUrl, bucketName, s3Region);
    }

    /**
     * Persistent sink writing to the configured bucket.
     */
    @Bean
    public PanoramaStorageSink panoramaStorageSink(S3Client s3Client,
                                                   S3PanoramaUrlSupport urlSupport,
                                                   @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName,
                                                   PanoramaIngestProperties properties) {
        logger.info("Panorama storage: S3 bucket {} (write timeout {})", bucketName, properties.getStorageTimeout());
        return new S3PanoramaStorageSink(s3Client, bucketName, urlSupport, properties.getStorageTimeout());
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
