package net.panotour.service.storage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.panotour.exception.StorageUnavailableException;
import net.panotour.model.panorama.StoredPanorama;
import net.panotour.model.panorama.StoredPanorama.StoredFile;
import net.panotour.support.storage.S3PanoramaUrlSupport;
import net.panotour.util.PanoramaKeyGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Lists panoramas already persisted in the object store, grouped by panorama id.
 */
@Service
public class PanoramaCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(PanoramaCatalogService.class);
    static final int PAGE_SIZE = 100;

    private final S3Client s3Client;
    private final S3PanoramaUrlSupport urlSupport;
    private final String bucketName;

    public PanoramaCatalogService(@Nullable S3Client s3Client,
                                  @Nullable S3PanoramaUrlSupport urlSupport,
                                  @Value("${s3.bucket-name:${S3_BUCKET:}}") String bucketName) {
        this.s3Client = s3Client;
        this.urlSupport = urlSupport;
        this.bucketName = bucketName;
    }

    /**
     * Whether an object store is configured; listing is impossible in inline mode.
     */
    public boolean isStorageConfigured() {
        return s3Client != null && urlSupport != null && StringUtils.hasText(bucketName);
    }

    /**
     * Lists one page of stored objects and groups them into panoramas, newest first.
     *
     * @param cursor continuation token from a previous page, or null for the first page
     * @return grouped panoramas plus paging information
     * @throws IllegalStateException if no object store is configured
     * @throws StorageUnavailableException if the store rejects the listing
     */
    public PanoramaListing listPanoramas(@Nullable String cursor) {
        if (!isStorageConfigured()) {
            throw new IllegalStateException("Panorama listing requires a configured object store");
        }

        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
            .bucket(bucketName)
            .prefix(PanoramaKeyGenerator.PANORAMA_DIRECTORY)
            .maxKeys(PAGE_SIZE);
        if (StringUtils.hasText(cursor)) {
            request.continuationToken(cursor);
        }

        ListObjectsV2Response response;
        try {
            response = s3Client.listObjectsV2(request.build());
        } catch (S3Exception | SdkClientException ex) {
            logger.error("Listing panoramas in bucket {} failed: {}", bucketName, ex.getMessage(), ex);
            throw StorageUnavailableException.listingFailed(String.valueOf(ex.getMessage()), ex);
        }

        List<S3Object> objects = response.contents();
        List<StoredPanorama> panoramas = group(objects);
        boolean hasMore = Boolean.TRUE.equals(response.isTruncated());
        logger.debug("Listed {} objects in {} panoramas (hasMore={})", objects.size(), panoramas.size(), hasMore);
        return new PanoramaListing(panoramas, objects.size(), hasMore, response.nextContinuationToken());
    }

    private List<StoredPanorama> group(List<S3Object> objects) {
        Map<String, List<StoredFile>> filesById = new LinkedHashMap<>();
        for (S3Object object : objects) {
            PanoramaKeyGenerator.parse(object.key()).ifPresent(parsed -> {
                long size = object.size() == null ? 0L : object.size();
                Instant uploadedAt = object.lastModified() == null ? Instant.EPOCH : object.lastModified();
                filesById.computeIfAbsent(parsed.panoramaId(), id -> new ArrayList<>())
                    .add(new StoredFile(parsed.resolution(), urlSupport.buildPublicUrl(object.key()), size, uploadedAt));
            });
        }

        List<StoredPanorama> panoramas = new ArrayList<>();
        filesById.forEach((id, files) -> panoramas.add(new StoredPanorama(
            id, files, files.stream().mapToLong(StoredFile::size).sum())));
        panoramas.sort(Comparator.comparing(StoredPanorama::firstUploadedAt).reversed());
        return panoramas;
    }

    /**
     * @param panoramas grouped panoramas, newest first
     * @param totalObjects number of objects in this page
     * @param hasMore whether another page exists
     * @param cursor continuation token for the next page, null on the last page
     */
    public record PanoramaListing(List<StoredPanorama> panoramas, int totalObjects, boolean hasMore, String cursor) {

        public PanoramaListing {
            panoramas = List.copyOf(panoramas);
        }
    }
}
