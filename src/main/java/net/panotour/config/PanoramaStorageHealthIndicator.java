package net.panotour.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import net.panotour.util.IdGenerator;
import net.panotour.util.PanoramaKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Reports whether panorama derivatives can currently be persisted.
 *
 * <p>Inline mode is always UP. In S3 mode a small text object is written under
 * {@code panoramas/} and deleted again, so the check covers both calls the upload
 * path depends on: the write and the rollback delete. The check object has no
 * panorama id segment and never shows up in the listing.</p>
 */
@Component("panoramaStorageHealthIndicator")
public class PanoramaStorageHealthIndicator implements ReactiveHealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(PanoramaStorageHealthIndicator.class);
    private static final Duration DEFAULT_CHECK_TIMEOUT = Duration.ofSeconds(5);
    static final String CHECK_KEY_PREFIX = PanoramaKeyGenerator.PANORAMA_DIRECTORY + "storage-check-";

    private final S3Client s3Client;
    private final String bucketName;
    private final Duration checkTimeout;

    /**
     * @param s3Client the S3 client, or null when no object store is configured
     * @param bucketName target bucket of the panorama derivatives
     */
    @Autowired
    public PanoramaStorageHealthIndicator(
            @Nullable S3Client s3Client,
            @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName) {
        this(s3Client, bucketName, DEFAULT_CHECK_TIMEOUT);
    }

    PanoramaStorageHealthIndicator(S3Client s3Client, String bucketName, Duration checkTimeout) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.checkTimeout = checkTimeout;
    }

    @Override
    public Mono<Health> health() {
        if (s3Client == null) {
            return Mono.just(Health.up()
                    .withDetail("storage_mode", "inline")
                    .withDetail("detail", "No object store configured; derivatives are returned as data URIs.")
                    .build());
        }
        if (bucketName == null || bucketName.isBlank()) {
            return Mono.just(s3Health(false, "misconfigured")
                    .withDetail("detail", "S3 bucket name is not configured.")
                    .build());
        }
        return Mono.fromCallable(this::checkWriteAccess)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(checkTimeout, Mono.fromSupplier(() -> s3Health(false, "timeout")
                        .withDetail("error", "No answer within " + checkTimeout.toMillis() + "ms")
                        .build()))
                .onErrorResume(RuntimeException.class, ex -> Mono.just(s3Health(false, "unexpected_error")
                        .withDetail("error", ex.getClass().getSimpleName() + ": " + ex.getMessage())
                        .build()));
    }

    private Health checkWriteAccess() {
        String key = CHECK_KEY_PREFIX + IdGenerator.randomSuffix(7) + ".txt";
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .contentType("text/plain")
                            .build(),
                    RequestBody.fromString("Storage check at " + Instant.now(), StandardCharsets.UTF_8));
        } catch (S3Exception | SdkClientException ex) {
            log.warn("Storage check could not write {} to bucket {}: {}", key, bucketName, ex.getMessage());
            return s3Health(false, "write_failed").withDetail("error", errorText(ex)).build();
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (S3Exception | SdkClientException ex) {
            // failed uploads could not be rolled back either
            log.warn("Storage check wrote {} but could not delete it: {}", key, ex.getMessage());
            return s3Health(false, "cleanup_failed")
                    .withDetail("error", errorText(ex))
                    .withDetail("leftover_key", key)
                    .build();
        }
        return s3Health(true, "ok").build();
    }

    private Health.Builder s3Health(boolean up, String writeCheck) {
        return (up ? Health.up() : Health.down())
                .withDetail("storage_mode", "s3")
                .withDetail("bucket", String.valueOf(bucketName))
                .withDetail("write_check", writeCheck);
    }

    private static String errorText(RuntimeException ex) {
        if (ex instanceof S3Exception s3Exception && s3Exception.awsErrorDetails() != null
                && s3Exception.awsErrorDetails().errorCode() != null) {
            return s3Exception.awsErrorDetails().errorCode() + ": " + s3Exception.awsErrorDetails().errorMessage();
        }
        return String.valueOf(ex.getMessage());
    }
}
