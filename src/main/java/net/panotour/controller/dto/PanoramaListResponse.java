package net.panotour.controller.dto;

import java.util.List;
import net.panotour.model.panorama.StoredPanorama;
import net.panotour.service.storage.PanoramaCatalogService.PanoramaListing;

/**
 * JSON body returned by {@code GET /api/panoramas}.
 */
public record PanoramaListResponse(boolean success,
                                   List<StoredPanorama> panoramas,
                                   int count,
                                   int totalObjects,
                                   boolean hasMore,
                                   String cursor,
                                   boolean storageConfigured) {

    public static PanoramaListResponse from(PanoramaListing listing) {
        return new PanoramaListResponse(
            true,
            listing.panoramas(),
            listing.panoramas().size(),
            listing.totalObjects(),
            listing.hasMore(),
            listing.cursor(),
            true
        );
    }
}
