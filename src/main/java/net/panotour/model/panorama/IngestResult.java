package net.panotour.model.panorama;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final outcome of a successful panorama ingest.
 *
 * @param panoramaId identifier used as storage prefix
 * @param urls label to URL, iterated as high, medium, low
 * @param warnings every advisory warning raised upstream, in order
 */
public record IngestResult(String panoramaId, Map<String, String> urls, List<String> warnings) {

    private static final String WARNING_SEPARATOR = " ";

    public IngestResult {
        urls = Collections.unmodifiableMap(new LinkedHashMap<>(urls));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Collapses the warnings into the single string exposed to clients that only read one slot.
     */
    public Optional<String> joinedWarning() {
        if (warnings.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(WARNING_SEPARATOR, warnings));
    }
}
