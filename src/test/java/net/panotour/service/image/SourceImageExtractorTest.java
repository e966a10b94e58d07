package net.panotour.service.image;

import static net.panotour.testsupport.PanoramaTestImages.fakeDng;
import static net.panotour.testsupport.PanoramaTestImages.gradientJpeg;
import static net.panotour.testsupport.PanoramaTestImages.syntheticJpegSegment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import net.panotour.exception.IngestErrorKind;
import net.panotour.exception.NoDecodableImageException;
import net.panotour.exception.UnreadableImageException;
import net.panotour.model.image.ExtractedImage;
import net.panotour.model.image.SourceKind;
import net.panotour.util.raw.EmbeddedJpegScanner;
import org.junit.jupiter.api.Test;

class SourceImageExtractorTest {

    private static final int MIN_EMBEDDED_SOURCE_BYTES = 500 * 1024;

    private final SourceImageExtractor extractor = new SourceImageExtractor(
        new EmbeddedJpegScanner(), List.of("dng"), MIN_EMBEDDED_SOURCE_BYTES);

    @Test
    void should_PassBytesThrough_When_UploadIsDirectImage() {
        byte[] jpeg = gradientJpeg(64, 32);

        ExtractedImage extracted = extractor.extract(jpeg, "room.jpg");

        assertThat(extracted.sourceKind()).isEqualTo(SourceKind.DIRECT_IMAGE);
        assertThat(extracted.bytes()).isEqualTo(jpeg);
        assertThat(extracted.warnings()).isEmpty();
    }

    @Test
    void should_CarveLargestPreview_When_DngContainsSeveralJpegs() {
        byte[] thumbnail = syntheticJpegSegment(60 * 1024);
        byte[] preview = syntheticJpegSegment(600 * 1024);
        byte[] container = fakeDng(thumbnail, preview);

        ExtractedImage extracted = extractor.extract(container, "IMG_0042.DNG");

        assertThat(extracted.sourceKind()).isEqualTo(SourceKind.EMBEDDED_PREVIEW);
        assertThat(extracted.bytes()).isEqualTo(preview);
        assertThat(extracted.warnings()).containsExactly(SourceImageExtractor.EMBEDDED_PREVIEW_WARNING);
    }

    @Test
    void should_RejectContainer_When_OnlyThumbnailsAreEmbedded() {
        byte[] container = fakeDng(syntheticJpegSegment(10 * 1024), syntheticJpegSegment(10 * 1024));

        assertThatThrownBy(() -> extractor.extract(container, "thumbs.dng"))
            .isInstanceOfSatisfying(NoDecodableImageException.class,
                e -> assertThat(e.getKind()).isEqualTo(IngestErrorKind.NO_DECODABLE_IMAGE))
            .hasMessageContaining("Kein eingebettetes JPEG im DNG gefunden");
    }

    @Test
    void should_RejectContainer_When_LargestPreviewIsBelowSourceFloor() {
        byte[] container = fakeDng(syntheticJpegSegment(200 * 1024));

        assertThatThrownBy(() -> extractor.extract(container, "small.dng"))
            .isInstanceOf(NoDecodableImageException.class);
    }

    @Test
    void should_RejectContainer_When_NoJpegIsEmbedded() {
        byte[] container = fakeDng(new byte[2 * 1024 * 1024]);

        assertThatThrownBy(() -> extractor.extract(container, "sensor-only.dng"))
            .isInstanceOf(NoDecodableImageException.class);
    }

    @Test
    void should_FailAsUnreadable_When_DirectUploadHasNoImageSignature() {
        byte[] text = "definitely not an image".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> extractor.extract(text, "room.png"))
            .isInstanceOf(UnreadableImageException.class)
            .hasMessage("Ungültiges Bildformat");
    }

    @Test
    void isRawContainer_dependsOnlyOnExtension() {
        assertThat(extractor.isRawContainer("pano.dng")).isTrue();
        assertThat(extractor.isRawContainer("pano.DNG")).isTrue();
        assertThat(extractor.isRawContainer("pano.tif")).isFalse();
        assertThat(extractor.isRawContainer(null)).isFalse();
    }

    @Test
    void should_NotModifyUpload_When_PreviewIsCarved() {
        byte[] container = fakeDng(syntheticJpegSegment(600 * 1024));
        byte[] snapshot = Arrays.copyOf(container, container.length);

        extractor.extract(container, "pano.dng");

        assertThat(container).isEqualTo(snapshot);
    }
}
