package net.panotour.util.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.panotour.util.image.ImageDimensionUtils.Dimensions;
import org.junit.jupiter.api.Test;

class ImageDimensionUtilsTest {

    @Test
    void fitInside_scalesDownKeepingAspectRatio() {
        assertThat(ImageDimensionUtils.fitInside(8192, 4096, 4096, 2048)).isEqualTo(new Dimensions(4096, 2048));
        assertThat(ImageDimensionUtils.fitInside(8000, 4000, 2048, 1024)).isEqualTo(new Dimensions(2048, 1024));
        assertThat(ImageDimensionUtils.fitInside(9000, 3000, 512, 256)).isEqualTo(new Dimensions(512, 171));
    }

    @Test
    void fitInside_neverEnlargesSmallSources() {
        assertThat(ImageDimensionUtils.fitInside(1000, 500, 4096, 2048)).isEqualTo(new Dimensions(1000, 500));
        assertThat(ImageDimensionUtils.fitInside(300, 600, 512, 256)).isEqualTo(new Dimensions(128, 256));
    }

    @Test
    void fitInside_keepsAtLeastOnePixel() {
        Dimensions dimensions = ImageDimensionUtils.fitInside(10_000, 1, 512, 256);

        assertThat(dimensions.width()).isEqualTo(512);
        assertThat(dimensions.height()).isEqualTo(1);
    }

    @Test
    void fitInside_rejectsDegenerateSource() {
        assertThatThrownBy(() -> ImageDimensionUtils.fitInside(0, 100, 512, 256))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void aspectRatio_handlesZeroHeightAndFormatsIndependentOfLocale() {
        assertThat(ImageDimensionUtils.aspectRatio(4096, 2048)).isEqualTo(2.0);
        assertThat(ImageDimensionUtils.aspectRatio(100, 0)).isEqualTo(0.0);
        assertThat(ImageDimensionUtils.formatRatio(3.0)).isEqualTo("3.00");
        assertThat(ImageDimensionUtils.isWithin(2.2, 1.8, 2.2)).isTrue();
        assertThat(ImageDimensionUtils.isWithin(2.21, 1.8, 2.2)).isFalse();
    }
}
