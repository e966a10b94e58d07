package net.panotour.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;
import net.panotour.model.panorama.IngestResult;

/**
 * JSON body returned by {@code POST /api/upload} on success.
 *
 * @param success always {@code true}
 * @param panoramaId generated panorama id
 * @param images resolution label to URL or data URI
 * @param warning all warnings joined with a single space, absent when there are none
 * @param warnings the same warnings as a list, absent when there are none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UploadResponse(boolean success,
                             String panoramaId,
                             Map<String, String> images,
                             String warning,
                             List<String> warnings) {

    public static UploadResponse from(IngestResult result) {
        List<String> warnings = result.warnings().isEmpty() ? null : result.warnings();
        return new UploadResponse(
            true,
            result.panoramaId(),
            result.urls(),
            result.joinedWarning().orElse(null),
            warnings
        );
    }
}
