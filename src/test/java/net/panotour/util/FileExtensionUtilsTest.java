package net.panotour.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class FileExtensionUtilsTest {

    @Test
    void extensionOf_returnsLowerCasedExtension() {
        assertThat(FileExtensionUtils.extensionOf("Room.JPG")).isEqualTo("jpg");
        assertThat(FileExtensionUtils.extensionOf("archive.tar.dng")).isEqualTo("dng");
        assertThat(FileExtensionUtils.extensionOf("noext")).isEmpty();
        assertThat(FileExtensionUtils.extensionOf("trailing.")).isEmpty();
        assertThat(FileExtensionUtils.extensionOf(null)).isEmpty();
    }

    @Test
    void hasExtension_matchesCaseInsensitivelyWithOrWithoutDot() {
        List<String> allowed = List.of(".dng", "JPEG", "png");

        assertThat(FileExtensionUtils.hasExtension("IMG_0001.DNG", allowed)).isTrue();
        assertThat(FileExtensionUtils.hasExtension("room.jpeg", allowed)).isTrue();
        assertThat(FileExtensionUtils.hasExtension("room.gif", allowed)).isFalse();
        assertThat(FileExtensionUtils.hasExtension("dng", allowed)).isFalse();
        assertThat(FileExtensionUtils.hasExtension("room.png", null)).isFalse();
    }

    @Test
    void megabytes_formatsWithTwoDecimals() {
        assertThat(FileExtensionUtils.megabytes(5L * 1024 * 1024)).isEqualTo("5.00");
        assertThat(FileExtensionUtils.megabytes(1536L * 1024)).isEqualTo("1.50");
    }
}
