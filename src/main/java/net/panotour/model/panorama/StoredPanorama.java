package net.panotour.model.panorama;

import java.time.Instant;
import java.util.List;

/**
 * A panorama found in object storage, grouped from its per-resolution objects.
 *
 * @param id panorama identifier (second key segment)
 * @param files stored derivatives in listing order
 * @param totalSize sum of all file sizes in bytes
 */
public record StoredPanorama(String id, List<StoredFile> files, long totalSize) {

    public StoredPanorama {
        files = List.copyOf(files);
    }

    /**
     * Upload time of the first listed file, used to sort newest first.
     */
    public Instant firstUploadedAt() {
        return files.isEmpty() ? Instant.EPOCH : files.get(0).uploadedAt();
    }

    /**
     * @param resolution label derived from the file name
     * @param url public URL of the object
     * @param size object size in bytes
     * @param uploadedAt last-modified timestamp reported by the store
     */
    public record StoredFile(String resolution, String url, long size, Instant uploadedAt) {
    }
}
