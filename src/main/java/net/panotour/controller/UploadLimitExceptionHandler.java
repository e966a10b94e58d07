package net.panotour.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.panotour.config.PanoramaIngestProperties;
import net.panotour.controller.support.ErrorResponseUtils;
import net.panotour.exception.InvalidUploadException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Translates the servlet container's multipart size rejection into the regular
 * {@code INVALID_UPLOAD} error body. Multipart parsing fails before a handler is chosen,
 * so controller-local exception handlers never see it.
 */
@RestControllerAdvice
@Slf4j
public class UploadLimitExceptionHandler {

    private final PanoramaIngestProperties properties;

    public UploadLimitExceptionHandler(PanoramaIngestProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex) {
        log.warn("Multipart upload rejected by the container limit: {}", ex.getMessage());
        return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST,
            InvalidUploadException.tooLarge(properties.getMaxUploadBytes()).getMessage());
    }
}
