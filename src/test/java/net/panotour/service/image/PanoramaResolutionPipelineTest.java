package net.panotour.service.image;

import static net.panotour.testsupport.PanoramaTestImages.gradientJpeg;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import net.panotour.exception.DegenerateGeometryException;
import net.panotour.exception.IngestErrorKind;
import net.panotour.exception.UnreadableImageException;
import net.panotour.model.image.ExtractedImage;
import net.panotour.model.image.RenderOutcome;
import net.panotour.model.image.RenderedAsset;
import net.panotour.model.image.ResolutionSpec;
import net.panotour.util.raw.ImageSignatures;
import org.junit.jupiter.api.Test;

class PanoramaResolutionPipelineTest {

    private final PanoramaResolutionPipeline pipeline =
        new PanoramaResolutionPipeline(ResolutionSpec.ALL, 1.8, 2.2);

    @Test
    void should_RenderThreeWebpAssetsInResolutionOrder_When_SourceIsTwoToOne() {
        RenderOutcome outcome = pipeline.render(ExtractedImage.direct(gradientJpeg(2048, 1024)));

        assertThat(outcome.assets()).extracting(RenderedAsset::label).containsExactly("high", "medium", "low");
        assertThat(outcome.warnings()).isEmpty();
        for (RenderedAsset asset : outcome.assets()) {
            assertThat(ImageSignatures.isRecognized(asset.encodedBytes())).isTrue();
            assertThat(new String(asset.encodedBytes(), 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WEBP");
        }
        assertThat(outcome.assets().get(2).width()).isEqualTo(512);
        assertThat(outcome.assets().get(2).height()).isEqualTo(256);
    }

    @Test
    void should_NeverUpscale_When_SourceIsSmallerThanResolutionBox() {
        RenderOutcome outcome = pipeline.render(ExtractedImage.direct(gradientJpeg(1000, 500)));

        RenderedAsset high = outcome.assets().get(0);
        RenderedAsset medium = outcome.assets().get(1);
        RenderedAsset low = outcome.assets().get(2);
        assertThat(high.width()).isEqualTo(1000);
        assertThat(high.height()).isEqualTo(500);
        assertThat(medium.width()).isEqualTo(1000);
        assertThat(medium.height()).isEqualTo(500);
        assertThat(low.width()).isEqualTo(512);
        assertThat(low.height()).isEqualTo(256);
    }

    @Test
    void should_KeepEveryAssetInsideItsBox_When_SourceIsOffRatio() {
        RenderOutcome outcome = pipeline.render(ExtractedImage.direct(gradientJpeg(1800, 600)));

        for (int i = 0; i < ResolutionSpec.ALL.size(); i++) {
            ResolutionSpec spec = ResolutionSpec.ALL.get(i);
            RenderedAsset asset = outcome.assets().get(i);
            assertThat(asset.width()).isLessThanOrEqualTo(Math.min(spec.maxWidth(), 1800));
            assertThat(asset.height()).isLessThanOrEqualTo(Math.min(spec.maxHeight(), 600));
        }
        assertThat(outcome.assets().get(2).width()).isEqualTo(512);
        assertThat(outcome.assets().get(2).height()).isEqualTo(171);
    }

    @Test
    void should_ProduceIdenticalBytes_When_SameSourceIsRenderedTwice() {
        byte[] source = gradientJpeg(1024, 512);

        RenderOutcome first = pipeline.render(ExtractedImage.direct(source));
        RenderOutcome second = pipeline.render(ExtractedImage.direct(source));

        for (int i = 0; i < first.assets().size(); i++) {
            assertThat(second.assets().get(i).encodedBytes()).isEqualTo(first.assets().get(i).encodedBytes());
        }
    }

    @Test
    void should_WarnExactlyOnce_When_AspectRatioIsThreeToOne() {
        RenderOutcome outcome = pipeline.render(ExtractedImage.direct(gradientJpeg(1800, 600)));

        assertThat(outcome.warnings()).hasSize(1);
        assertThat(outcome.warnings().get(0)).contains("3.00");
    }

    @Test
    void aspectRatioWarning_respectsInclusiveToleranceBand() {
        assertThat(pipeline.aspectRatioWarning(4096, 2048)).isEmpty();
        assertThat(pipeline.aspectRatioWarning(1800, 1000)).isEmpty();
        assertThat(pipeline.aspectRatioWarning(2200, 1000)).isEmpty();
        assertThat(pipeline.aspectRatioWarning(1000, 1000)).hasValueSatisfying(
            warning -> assertThat(warning).startsWith("Seitenverhältnis ist 1.00:1 statt 2:1."));
    }

    @Test
    void should_FailAsUnreadable_When_ImageHeaderIsCorrupt() {
        byte[] corruptPng = new byte[256];
        byte[] signature = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
        System.arraycopy(signature, 0, corruptPng, 0, signature.length);

        assertThatThrownBy(() -> pipeline.render(ExtractedImage.direct(corruptPng)))
            .isInstanceOfSatisfying(UnreadableImageException.class,
                e -> assertThat(e.getKind()).isEqualTo(IngestErrorKind.UNREADABLE_IMAGE));
    }

    @Test
    void requireRenderableGeometry_rejectsZeroDimensions() {
        assertThatThrownBy(() -> PanoramaResolutionPipeline.requireRenderableGeometry(0, 1024))
            .isInstanceOfSatisfying(DegenerateGeometryException.class, e -> {
                assertThat(e.getKind()).isEqualTo(IngestErrorKind.DEGENERATE_GEOMETRY);
                assertThat(e.getWidth()).isZero();
                assertThat(e.getHeight()).isEqualTo(1024);
            });
        assertThatThrownBy(() -> PanoramaResolutionPipeline.requireRenderableGeometry(2048, 0))
            .isInstanceOf(DegenerateGeometryException.class);
    }

    @Test
    void should_RenderOnlyConfiguredResolutions_When_CustomListIsGiven() {
        PanoramaResolutionPipeline previewOnly =
            new PanoramaResolutionPipeline(List.of(ResolutionSpec.LOW), 1.8, 2.2);

        RenderOutcome outcome = previewOnly.render(ExtractedImage.direct(gradientJpeg(1024, 512)));

        assertThat(outcome.assets()).extracting(RenderedAsset::label).containsExactly("low");
    }
}
