package net.tilefetch.service.image;

import net.tilefetch.exception.TileDecodeException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileImage;
import net.tilefetch.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageIoTileImageCodecTest {

    private static final SourceLocation LOCATION = SourceLocation.of("https://tiles.example.com/0/0/0.png");

    private final ImageIoTileImageCodec codec = new ImageIoTileImageCodec();

    @Test
    void should_DecodePngWithDimensions() {
        TileImage image = codec.decode(TestImages.png(TestImages.solid(Color.RED, 12, 6)), LOCATION);

        assertThat(image.width()).isEqualTo(12);
        assertThat(image.height()).isEqualTo(6);
        assertThat(TestImages.argbAt(image, 3, 3)).isEqualTo(Color.RED.getRGB());
    }

    @Test
    void should_Reject_When_BodyEmpty() {
        assertThatThrownBy(() -> codec.decode(new byte[0], LOCATION))
            .isInstanceOf(TileDecodeException.class)
            .hasMessageContaining("empty body");
    }

    @Test
    void should_WrapPluginFailures_When_HeaderDeclaresOversizedImage() {
        assertThatThrownBy(() -> codec.decode(TestImages.oversizedGif(), LOCATION))
            .isInstanceOf(TileDecodeException.class)
            .hasMessageContaining(LOCATION.toString())
            .hasCauseInstanceOf(RuntimeException.class);
    }

    @Test
    void should_Reject_When_BytesAreNotAnImage() {
        assertThatThrownBy(() -> codec.decode("not found".getBytes(), LOCATION))
            .isInstanceOf(TileDecodeException.class)
            .hasMessageContaining(LOCATION.toString());
    }

    @Test
    void should_EncodeReadablePng() throws Exception {
        TileImage original = TestImages.rightHalf(Color.BLUE);

        TileImage decoded = codec.decode(codec.encodePng(original), LOCATION);

        assertThat(TestImages.argbAt(decoded, TestImages.TILE_SIZE - 1, 0)).isEqualTo(Color.BLUE.getRGB());
        assertThat(decoded.image().getRGB(0, 0) >>> 24).isZero();
    }
}
