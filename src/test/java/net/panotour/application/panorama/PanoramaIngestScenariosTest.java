package net.panotour.application.panorama;

import static net.panotour.testsupport.PanoramaTestImages.fakeDng;
import static net.panotour.testsupport.PanoramaTestImages.gradientJpeg;
import static net.panotour.testsupport.PanoramaTestImages.noiseJpeg;
import static net.panotour.testsupport.PanoramaTestImages.syntheticJpegSegment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import net.panotour.config.PanoramaIngestProperties;
import net.panotour.exception.IngestErrorKind;
import net.panotour.exception.InvalidUploadException;
import net.panotour.exception.NoDecodableImageException;
import net.panotour.model.panorama.IngestResult;
import net.panotour.model.panorama.RawUpload;
import net.panotour.service.image.PanoramaResolutionPipeline;
import net.panotour.service.image.SourceImageExtractor;
import net.panotour.support.storage.InlineDataUriStorageSink;
import net.panotour.util.raw.EmbeddedJpegScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * End-to-end ingests through the real extractor, pipeline and inline sink.
 */
class PanoramaIngestScenariosTest {

    private static final String DATA_URI_PREFIX = "data:image/webp;base64,";

    private PanoramaIngestProperties properties;
    private PanoramaIngestUseCase useCase;

    @BeforeEach
    void setUp() {
        properties = new PanoramaIngestProperties();
        useCase = newUseCase(new EmbeddedJpegScanner(properties.getMinCandidateBytes()));
    }

    @Test
    void should_ReturnThreeInlineWebps_When_EquirectangularJpegIsUploaded() {
        IngestResult result = useCase.ingest(new RawUpload(gradientJpeg(4096, 2048), "room.jpg"));

        assertThat(result.panoramaId()).matches("pano_\\d+_[0-9a-z]{7}");
        assertThat(result.urls().keySet()).containsExactly("high", "medium", "low");
        assertThat(result.urls().values()).allSatisfy(url -> {
            assertThat(url).startsWith(DATA_URI_PREFIX);
            byte[] webp = Base64.getDecoder().decode(url.substring(DATA_URI_PREFIX.length()));
            assertThat(new String(webp, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
            assertThat(new String(webp, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WEBP");
        });
        assertThat(result.warnings()).isEmpty();
        assertThat(result.joinedWarning()).isEmpty();
    }

    @Test
    void should_UseEmbeddedPreviewAndWarn_When_DngCarriesLargePreview() {
        byte[] preview = noiseJpeg(4096, 2048, 7L);
        assertThat(preview.length).isGreaterThan(properties.getMinEmbeddedSourceBytes());
        byte[] container = fakeDng(gradientJpeg(160, 80), preview);

        IngestResult result = useCase.ingest(new RawUpload(container, "IMG_0001.dng"));

        assertThat(result.urls().keySet()).containsExactly("high", "medium", "low");
        assertThat(result.urls().values()).allSatisfy(url -> assertThat(url).startsWith(DATA_URI_PREFIX));
        assertThat(result.warnings()).containsExactly(SourceImageExtractor.EMBEDDED_PREVIEW_WARNING);
        assertThat(result.joinedWarning()).hasValueSatisfying(warning -> assertThat(warning).contains("RAW"));
    }

    @Test
    void should_FailWithNoDecodableImage_When_DngOnlyHasThumbnails() {
        byte[] container = fakeDng(syntheticJpegSegment(10 * 1024), syntheticJpegSegment(10 * 1024));

        assertThatThrownBy(() -> useCase.ingest(new RawUpload(container, "thumbs.dng")))
            .isInstanceOfSatisfying(NoDecodableImageException.class,
                e -> assertThat(e.getKind()).isEqualTo(IngestErrorKind.NO_DECODABLE_IMAGE));
    }

    @Test
    void should_RejectOversizedUploadWithoutScanning_When_CeilingIsExceeded() {
        properties.setMaxUploadBytes(1024L * 1024L);
        EmbeddedJpegScanner scanner = mock(EmbeddedJpegScanner.class);
        PanoramaIngestUseCase guardedUseCase = newUseCase(scanner);
        byte[] oversized = fakeDng(syntheticJpegSegment(1024 * 1024));

        assertThatThrownBy(() -> guardedUseCase.ingest(new RawUpload(oversized, "huge.dng")))
            .isInstanceOfSatisfying(InvalidUploadException.class, e -> {
                assertThat(e.getKind()).isEqualTo(IngestErrorKind.INVALID_UPLOAD);
                assertThat(e.getMessage()).isEqualTo("Datei zu groß. Maximum ist 1MB.");
            });
        verifyNoInteractions(scanner);
    }

    private PanoramaIngestUseCase newUseCase(EmbeddedJpegScanner scanner) {
        return new PanoramaIngestUseCase(
            new SourceImageExtractor(scanner, properties),
            new PanoramaResolutionPipeline(properties),
            new InlineDataUriStorageSink(),
            properties);
    }
}
