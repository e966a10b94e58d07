package net.panotour.controller;

import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.panotour.application.panorama.PanoramaIngestUseCase;
import net.panotour.controller.dto.PanoramaListResponse;
import net.panotour.controller.dto.UploadResponse;
import net.panotour.controller.support.ErrorResponseUtils;
import net.panotour.exception.InvalidUploadException;
import net.panotour.exception.PanoramaIngestException;
import net.panotour.model.panorama.IngestResult;
import net.panotour.model.panorama.RawUpload;
import net.panotour.service.storage.PanoramaCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * HTTP adapter for panorama uploads and the stored-panorama listing.
 * Failures are reported as {@code {success:false, error}} with a status derived from the ingest error kind.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class PanoramaUploadController {

    static final String STORAGE_NOT_CONFIGURED_MESSAGE = "Objektspeicher nicht konfiguriert";

    private final PanoramaIngestUseCase panoramaIngestUseCase;
    private final PanoramaCatalogService panoramaCatalogService;

    public PanoramaUploadController(PanoramaIngestUseCase panoramaIngestUseCase,
                                    PanoramaCatalogService panoramaCatalogService) {
        this.panoramaIngestUseCase = panoramaIngestUseCase;
        this.panoramaCatalogService = panoramaCatalogService;
    }

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw InvalidUploadException.missingFile();
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException ioException) {
            log.error("Failed to read uploaded panorama {}: {}", file.getOriginalFilename(), ioException.getMessage(), ioException);
            throw new IllegalStateException("Unable to read uploaded file bytes", ioException);
        }

        IngestResult result = panoramaIngestUseCase.ingest(new RawUpload(bytes, file.getOriginalFilename()));
        log.info("Panorama {} stored with {} derivatives and {} warnings",
            result.panoramaId(), result.urls().size(), result.warnings().size());
        return ResponseEntity.ok(UploadResponse.from(result));
    }

    @GetMapping("/panoramas")
    public ResponseEntity<?> listPanoramas(@RequestParam(value = "cursor", required = false) String cursor) {
        if (!panoramaCatalogService.isStorageConfigured()) {
            Map<String, Object> body = ErrorResponseUtils.errorBody(STORAGE_NOT_CONFIGURED_MESSAGE);
            body.put("storageConfigured", false);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
        return ResponseEntity.ok(PanoramaListResponse.from(panoramaCatalogService.listPanoramas(cursor)));
    }

    @ExceptionHandler(PanoramaIngestException.class)
    public ResponseEntity<Map<String, Object>> handleIngestFailure(PanoramaIngestException ex) {
        HttpStatus status = ErrorResponseUtils.statusFor(ex.getKind());
        log.warn("Request failed with {} ({}): {}", ex.getKind(), status.value(), ex.getMessage());
        return ErrorResponseUtils.error(status, ex.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        log.error("Unexpected failure while handling panorama request: {}", ex.getMessage(), ex);
        return ErrorResponseUtils.internalServerError(ErrorResponseUtils.UNKNOWN_ERROR_MESSAGE);
    }
}
