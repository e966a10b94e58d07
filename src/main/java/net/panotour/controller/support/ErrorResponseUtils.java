package net.panotour.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import net.panotour.exception.IngestErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent {@code {success:false, error}} payloads across controllers.
 */
public final class ErrorResponseUtils {

    public static final String UNKNOWN_ERROR_MESSAGE = "Unbekannter Fehler";

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return body;
    }

    public static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(errorBody(message));
    }

    public static ResponseEntity<Map<String, Object>> internalServerError(String message) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    /**
     * HTTP status for a failed ingest. Client input problems are 400/422, backend failures 502.
     */
    public static HttpStatus statusFor(IngestErrorKind kind) {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case INVALID_UPLOAD -> HttpStatus.BAD_REQUEST;
            case NO_DECODABLE_IMAGE, UNREADABLE_IMAGE, DEGENERATE_GEOMETRY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case STORAGE_UNAVAILABLE -> HttpStatus.BAD_GATEWAY;
        };
    }
}
