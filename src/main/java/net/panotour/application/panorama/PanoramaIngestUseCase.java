package net.panotour.application.panorama;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import net.panotour.config.PanoramaIngestProperties;
import net.panotour.exception.InvalidUploadException;
import net.panotour.exception.PanoramaIngestException;
import net.panotour.model.image.ExtractedImage;
import net.panotour.model.image.RenderOutcome;
import net.panotour.model.panorama.IngestResult;
import net.panotour.model.panorama.IngestStage;
import net.panotour.model.panorama.RawUpload;
import net.panotour.service.image.PanoramaResolutionPipeline;
import net.panotour.service.image.SourceImageExtractor;
import net.panotour.support.storage.PanoramaStorageSink;
import net.panotour.util.FileExtensionUtils;
import net.panotour.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns one uploaded panorama file into three stored WebP derivatives.
 *
 * <p>This use case validates the upload, selects a decodable source image, renders every
 * resolution and only then hands the assets to the configured storage sink. Each ingest
 * runs on the caller's thread and shares no mutable state with other ingests.</p>
 */
@Service
public class PanoramaIngestUseCase {

    private static final Logger log = LoggerFactory.getLogger(PanoramaIngestUseCase.class);

    private final SourceImageExtractor sourceImageExtractor;
    private final PanoramaResolutionPipeline resolutionPipeline;
    private final PanoramaStorageSink storageSink;
    private final PanoramaIngestProperties properties;
    private final Supplier<String> panoramaIdSupplier;

    /**
     * Creates the panorama ingest use case.
     *
     * @param sourceImageExtractor chooses the image to decode, carving RAW previews when needed
     * @param resolutionPipeline renders the high/medium/low WebP derivatives
     * @param storageSink persistent or inline sink, chosen once from the S3 configuration
     * @param properties upload limits and allow-listed extensions
     */
    @Autowired
    public PanoramaIngestUseCase(SourceImageExtractor sourceImageExtractor,
                                 PanoramaResolutionPipeline resolutionPipeline,
                                 PanoramaStorageSink storageSink,
                                 PanoramaIngestProperties properties) {
        this(sourceImageExtractor, resolutionPipeline, storageSink, properties, IdGenerator::panoramaId);
    }

    PanoramaIngestUseCase(SourceImageExtractor sourceImageExtractor,
                          PanoramaResolutionPipeline resolutionPipeline,
                          PanoramaStorageSink storageSink,
                          PanoramaIngestProperties properties,
                          Supplier<String> panoramaIdSupplier) {
        this.sourceImageExtractor = sourceImageExtractor;
        this.resolutionPipeline = resolutionPipeline;
        this.storageSink = storageSink;
        this.properties = properties;
        this.panoramaIdSupplier = panoramaIdSupplier;
    }

    /**
     * Ingests a single upload.
     *
     * @param upload raw bytes plus the client filename
     * @return panorama id, one URL per resolution label and all advisory warnings
     * @throws PanoramaIngestException with the kind of the first stage that failed
     *
     * @implNote Stage order is fixed: validate, extract, render all assets, store, assemble.
     * Nothing reaches the sink unless every resolution rendered successfully.
     */
    public IngestResult ingest(RawUpload upload) {
        String panoramaId = panoramaIdSupplier.get();
        IngestStage stage = IngestStage.RECEIVED;
        try {
            validate(upload);
            log.info("Received panorama upload {} as {} ({} MB)",
                upload.filename(), panoramaId, FileExtensionUtils.megabytes(upload.size()));

            ExtractedImage extracted = sourceImageExtractor.extract(upload.bytes(), upload.filename());
            stage = advance(panoramaId, stage, IngestStage.EXTRACTED);
            List<String> warnings = new ArrayList<>(extracted.warnings());

            RenderOutcome rendered = resolutionPipeline.render(extracted);
            // the source buffer is not needed once the derivatives exist
            extracted = null;
            stage = advance(panoramaId, stage, IngestStage.RENDERED);
            warnings.addAll(rendered.warnings());

            log.info("Storing {} derivatives of panorama {} via {} storage (persistent: {})",
                rendered.assets().size(), panoramaId, storageSink.mode(), storageSink.isPersistent());
            Map<String, String> urls = storageSink.store(panoramaId, rendered.assets());
            stage = advance(panoramaId, stage, IngestStage.STORED);

            IngestResult result = new IngestResult(panoramaId, urls, warnings);
            advance(panoramaId, stage, IngestStage.COMPLETE);
            return result;
        } catch (PanoramaIngestException e) {
            e.recordLastCompletedStage(stage);
            advance(panoramaId, stage, IngestStage.FAILED);
            log.warn("Panorama ingest {} failed after stage {} with {}: {}",
                panoramaId, stage, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            advance(panoramaId, stage, IngestStage.FAILED);
            log.error("Panorama ingest {} failed unexpectedly after stage {}: {}",
                panoramaId, stage, e.getMessage(), e);
            throw e;
        }
    }

    private void validate(RawUpload upload) {
        if (upload == null || upload.isEmpty()) {
            throw InvalidUploadException.missingFile();
        }
        if (!FileExtensionUtils.hasExtension(upload.filename(), properties.getAllowedExtensions())) {
            log.warn("Rejected upload {}: extension not allowed", upload.filename());
            throw InvalidUploadException.unsupportedExtension();
        }
        if (upload.size() > properties.getMaxUploadBytes()) {
            log.warn("Rejected upload {}: {} MB exceeds the {} MB limit", upload.filename(),
                FileExtensionUtils.megabytes(upload.size()),
                FileExtensionUtils.megabytes(properties.getMaxUploadBytes()));
            throw InvalidUploadException.tooLarge(properties.getMaxUploadBytes());
        }
    }

    private IngestStage advance(String panoramaId, IngestStage from, IngestStage to) {
        if (from.isTerminal()) {
            throw new IllegalStateException("Panorama " + panoramaId + " already reached " + from);
        }
        log.debug("Panorama {}: {} -> {}", panoramaId, from, to);
        return to;
    }
}
