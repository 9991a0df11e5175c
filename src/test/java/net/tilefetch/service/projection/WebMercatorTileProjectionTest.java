package net.tilefetch.service.projection;

import net.tilefetch.model.TileIdentity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebMercatorTileProjectionTest {

    private final WebMercatorTileProjection projection = new WebMercatorTileProjection(0, 18);

    @Test
    void should_WrapXAroundTheAntimeridian() {
        assertThat(projection.normalize(TileIdentity.of(4, 1, 2))).isEqualTo(TileIdentity.of(0, 1, 2));
        assertThat(projection.normalize(TileIdentity.of(-1, 1, 2))).isEqualTo(TileIdentity.of(3, 1, 2));
    }

    @Test
    void should_ReturnSameInstance_When_AlreadyNormalized() {
        TileIdentity tile = TileIdentity.of(2, 3, 5);

        assertThat(projection.normalize(tile)).isSameAs(tile);
    }

    @Test
    void should_NotWrapY() {
        TileIdentity tile = projection.normalize(TileIdentity.of(0, 4, 2));

        assertThat(tile.y()).isEqualTo(4);
        assertThat(projection.tileExists(tile)).isFalse();
    }

    @Test
    void should_RespectZoomRange() {
        WebMercatorTileProjection limited = new WebMercatorTileProjection(2, 10);

        assertThat(limited.tileExists(TileIdentity.of(0, 0, 1))).isFalse();
        assertThat(limited.tileExists(TileIdentity.of(0, 0, 2))).isTrue();
        assertThat(limited.tileExists(TileIdentity.of(0, 0, 11))).isFalse();
    }

    @Test
    void should_RejectInvalidZoomRange() {
        assertThatThrownBy(() -> new WebMercatorTileProjection(5, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WebMercatorTileProjection(0, 29)).isInstanceOf(IllegalArgumentException.class);
    }
}
