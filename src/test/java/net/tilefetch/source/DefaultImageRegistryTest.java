package net.tilefetch.source;

import net.tilefetch.model.TileImage;
import net.tilefetch.testutil.TestImages;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultImageRegistryTest {

    private final DefaultImageRegistry registry = new DefaultImageRegistry();

    @Test
    void should_ReturnImageRegisteredForZoom() {
        TileImage ocean = TestImages.solid(Color.BLUE);
        registry.register(4, ocean);

        assertThat(registry.lookup(4)).containsSame(ocean);
        assertThat(registry.lookup(5)).isEmpty();
    }

    @Test
    void should_ReplacePreviousImage_When_ZoomRegisteredAgain() {
        TileImage replacement = TestImages.solid(Color.GREEN);
        registry.register(4, TestImages.solid(Color.BLUE));
        registry.register(4, replacement);

        assertThat(registry.lookup(4)).containsSame(replacement);
    }

    @Test
    void should_RejectNegativeZoomAndNullImage() {
        assertThatThrownBy(() -> registry.register(-1, TestImages.solid(Color.BLUE)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(1, null))
            .isInstanceOf(NullPointerException.class);
    }
}
