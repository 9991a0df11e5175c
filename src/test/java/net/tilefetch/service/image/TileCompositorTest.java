package net.tilefetch.service.image;

import net.tilefetch.model.TileImage;
import net.tilefetch.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TileCompositorTest {

    private final TileCompositor compositor = new TileCompositor();

    @Test
    void should_ReturnEmpty_When_NoLayerPresent() {
        assertThat(compositor.composite(List.of())).isEmpty();
        assertThat(compositor.composite(List.of(Optional.empty(), Optional.empty()))).isEmpty();
    }

    @Test
    void should_ReturnSameInstance_When_OnlyOneLayerPresent() {
        TileImage only = TestImages.solid(Color.RED);

        Optional<TileImage> result = compositor.composite(List.of(Optional.empty(), Optional.of(only), Optional.empty()));

        assertThat(result).containsSame(only);
    }

    @Test
    void should_DrawLaterLayersOnTop_WhereTheyAreOpaque() {
        TileImage base = TestImages.solid(Color.RED);
        TileImage overlay = TestImages.rightHalf(Color.BLUE);

        TileImage result = compositor.composite(List.of(Optional.of(base), Optional.of(overlay))).orElseThrow();

        assertThat(TestImages.argbAt(result, 0, 0)).isEqualTo(Color.RED.getRGB());
        assertThat(TestImages.argbAt(result, TestImages.TILE_SIZE - 1, 0)).isEqualTo(Color.BLUE.getRGB());
    }

    @Test
    void should_MatchCompositeOfAvailableLayers_When_MiddleLayerMissing() {
        TileImage base = TestImages.solid(Color.RED);
        TileImage top = TestImages.rightHalf(Color.GREEN);

        TileImage withGap = compositor.composite(List.of(Optional.of(base), Optional.empty(), Optional.of(top))).orElseThrow();
        TileImage withoutGap = compositor.composite(List.of(Optional.of(base), Optional.of(top))).orElseThrow();

        for (int x = 0; x < TestImages.TILE_SIZE; x++) {
            for (int y = 0; y < TestImages.TILE_SIZE; y++) {
                assertThat(TestImages.argbAt(withGap, x, y)).isEqualTo(TestImages.argbAt(withoutGap, x, y));
            }
        }
    }

    @Test
    void should_SizeCanvasToFirstPresentLayer() {
        TileImage base = TestImages.solid(Color.RED, 16, 16);
        TileImage larger = TestImages.solid(Color.BLUE, 32, 32);

        TileImage result = compositor.composite(List.of(Optional.empty(), Optional.of(base), Optional.of(larger))).orElseThrow();

        assertThat(result.width()).isEqualTo(16);
        assertThat(result.height()).isEqualTo(16);
        assertThat(TestImages.argbAt(result, 0, 0)).isEqualTo(Color.BLUE.getRGB());
    }
}
