package net.convertcompress.model.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ImageFormatTest {

    @Test
    void should_FoldAliases_When_ParsingKnownMimeVariants() {
        assertThat(ImageFormat.of("image/jpg")).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.of(" IMAGE/PJPEG ")).isEqualTo(ImageFormat.JPEG);
        assertThat(ImageFormat.of("image/x-png")).isEqualTo(ImageFormat.PNG);
        assertThat(ImageFormat.of("image/vnd.microsoft.icon")).isEqualTo(ImageFormat.ICO);
    }

    @Test
    void should_KeepUnknownIdentifier_When_NotAnAlias() {
        ImageFormat format = ImageFormat.of("image/x-made-up");

        assertThat(format.identifier()).isEqualTo("image/x-made-up");
        assertThat(format.subtype()).isEqualTo("x-made-up");
    }

    @Test
    void should_Reject_When_IdentifierBlank() {
        assertThatThrownBy(() -> ImageFormat.of("  ")).isInstanceOf(IllegalArgumentException.class);
    }
}
