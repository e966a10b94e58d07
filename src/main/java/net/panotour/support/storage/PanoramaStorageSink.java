package net.panotour.support.storage;

import java.util.List;
import java.util.Map;
import net.panotour.exception.StorageUnavailableException;
import net.panotour.model.image.RenderedAsset;

/**
 * Persists the rendered derivatives of one panorama and hands back one URL per resolution.
 *
 * <p>Exactly one implementation is active per application context, chosen once from the
 * storage configuration.</p>
 */
public interface PanoramaStorageSink {

    /**
     * Stores all assets of a panorama.
     *
     * @param panoramaId panorama identifier, used as key prefix
     * @param assets rendered assets in resolution order
     * @return label to URL in the order of {@code assets}
     * @throws StorageUnavailableException if a configured backend rejects a write
     */
    Map<String, String> store(String panoramaId, List<RenderedAsset> assets);

    /**
     * Whether returned URLs point at network-addressable objects.
     */
    boolean isPersistent();

    /**
     * Short mode label for logs and health details.
     */
    String mode();
}
