package net.panotour.support.storage;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import net.panotour.exception.StorageUnavailableException;
import net.panotour.model.image.RenderedAsset;
import net.panotour.util.PanoramaKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Writes panorama derivatives to an S3-compatible bucket with public read access.
 *
 * <p>Assets are written one after another on the bounded-elastic scheduler, and the whole
 * write phase is bounded by a timeout. A failure deletes the keys this call already wrote,
 * so a panorama is either stored completely or not at all. There is no retry.</p>
 *
 * <p>A timeout cancels the chain but cannot stop a {@code PutObject} that is already on the
 * wire. Such a late write sees its batch marked abandoned and deletes its own key.</p>
 */
public class S3PanoramaStorageSink implements PanoramaStorageSink {

    private static final Logger logger = LoggerFactory.getLogger(S3PanoramaStorageSink.class);
    public static final String MODE = "s3";

    // S3Client is thread-safe and immutable per AWS SDK v2; storing reference is safe
    private final S3Client s3Client;
    private final String bucketName;
    private final S3PanoramaUrlSupport urlSupport;
    private final Duration writeTimeout;

    public S3PanoramaStorageSink(S3Client s3Client,
                                 String bucketName,
                                 S3PanoramaUrlSupport urlSupport,
                                 Duration writeTimeout) {
        if (s3Client == null) {
            throw new IllegalArgumentException("S3 client is required for persistent panorama storage");
        }
        if (bucketName == null || bucketName.isBlank()) {
            throw new IllegalArgumentException("Bucket name is required for persistent panorama storage");
        }
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.urlSupport = urlSupport;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public Map<String, String> store(String panoramaId, List<RenderedAsset> assets) {
        WriteBatch batch = new WriteBatch(panoramaId);
        try {
            List<Map.Entry<String, String>> stored = Flux.fromIterable(assets)
                .concatMap(asset -> upload(batch, asset))
                .collectList()
                .timeout(writeTimeout)
                .block();

            Map<String, String> urls = new LinkedHashMap<>();
            if (stored != null) {
                stored.forEach(entry -> urls.put(entry.getKey(), entry.getValue()));
            }
            return urls;
        } catch (RuntimeException failure) {
            Throwable cause = Exceptions.unwrap(failure);
            String detail = describe(cause);
            logger.error("Storing panorama {} in bucket {} failed after {} of {} objects: {}",
                panoramaId, bucketName, batch.writtenKeys.size(), assets.size(), detail, cause);
            rollback(batch);
            throw new StorageUnavailableException(panoramaId, detail, cause);
        }
    }

    @Override
    public boolean isPersistent() {
        return true;
    }

    @Override
    public String mode() {
        return MODE;
    }

    private Mono<Map.Entry<String, String>> upload(WriteBatch batch, RenderedAsset asset) {
        return Mono.fromCallable(() -> {
            String key = PanoramaKeyGenerator.generateAssetKey(batch.panoramaId, asset.label(), RenderedAsset.FILE_EXTENSION);
            PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(RenderedAsset.MIME_TYPE)
                .acl(ObjectCannedACL.PUBLIC_READ)
                .build();
            s3Client.putObject(putObjectRequest, RequestBody.fromBytes(asset.encodedBytes()));
            batch.writtenKeys.add(key);
            if (batch.abandoned.get()) {
                logger.warn("Upload of {} finished after panorama {} was rolled back; deleting it",
                    key, batch.panoramaId);
                delete(batch.panoramaId, key);
            } else {
                logger.info("Uploaded {} derivative of panorama {} ({} KB). Key: {}",
                    asset.label(), batch.panoramaId, asset.byteSize() / 1024, key);
            }
            return Map.entry(asset.label(), urlSupport.buildPublicUrl(key));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    // Abandon before reading the keys: a write either lands in this snapshot or sees the flag.
    private void rollback(WriteBatch batch) {
        batch.abandoned.set(true);
        for (String key : batch.writtenKeys) {
            delete(batch.panoramaId, key);
        }
    }

    private void delete(String panoramaId, String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
            logger.info("Rolled back partial upload of panorama {}: deleted {}", panoramaId, key);
        } catch (S3Exception | SdkClientException deleteFailure) {
            logger.warn("Could not delete orphaned object {} of panorama {}: {}",
                key, panoramaId, deleteFailure.getMessage(), deleteFailure);
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof S3Exception s3Exception) {
            var details = s3Exception.awsErrorDetails();
            if (details != null && details.errorCode() != null) {
                return details.errorCode() + ": " + details.errorMessage();
            }
            return s3Exception.getMessage();
        }
        if (cause instanceof TimeoutException) {
            return "Zeitüberschreitung nach " + formatTimeout();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private String formatTimeout() {
        long millis = writeTimeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    private static final class WriteBatch {
        private final String panoramaId;
        private final List<String> writtenKeys = new CopyOnWriteArrayList<>();
        private final AtomicBoolean abandoned = new AtomicBoolean();

        private WriteBatch(String panoramaId) {
            this.panoramaId = panoramaId;
        }
    }
}
