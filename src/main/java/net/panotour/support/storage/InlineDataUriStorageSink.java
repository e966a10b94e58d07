package net.panotour.support.storage;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.panotour.model.image.RenderedAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback sink used when no object store is configured: every asset comes back as a
 * self-contained {@code data:} URI. Responses get large, so this mode is meant for local
 * runs and tests.
 */
public class InlineDataUriStorageSink implements PanoramaStorageSink {

    private static final Logger logger = LoggerFactory.getLogger(InlineDataUriStorageSink.class);
    public static final String MODE = "inline";

    @Override
    public Map<String, String> store(String panoramaId, List<RenderedAsset> assets) {
        Map<String, String> urls = new LinkedHashMap<>();
        long totalBytes = 0;
        for (RenderedAsset asset : assets) {
            urls.put(asset.label(), toDataUri(asset));
            totalBytes += asset.byteSize();
        }
        logger.info("Panorama {}: returned {} derivatives as inline data URIs ({} KB before base64).",
            panoramaId, assets.size(), totalBytes / 1024);
        return urls;
    }

    @Override
    public boolean isPersistent() {
        return false;
    }

    @Override
    public String mode() {
        return MODE;
    }

    static String toDataUri(RenderedAsset asset) {
        return "data:" + RenderedAsset.MIME_TYPE + ";base64," + Base64.getEncoder().encodeToString(asset.encodedBytes());
    }
}
