package net.tilefetch.source;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;

import java.util.Optional;

/**
 * Outcome of asking a tile source for a tile.
 *
 * @param tile the tile that was looked up (normalized, except for hidden sources)
 * @param status how the request ended
 * @param image the image, {@code null} for {@link TileResultStatus#ABSENT} and {@link TileResultStatus#NO_SUCH_TILE}
 */
public record TileResult(TileIdentity tile, TileResultStatus status, TileImage image) {

    public static TileResult cached(TileIdentity tile, TileImage image) {
        return new TileResult(tile, TileResultStatus.CACHED, image);
    }

    public static TileResult fetched(TileIdentity tile, TileImage image) {
        return new TileResult(tile, TileResultStatus.FETCHED, image);
    }

    public static TileResult defaultImage(TileIdentity tile, TileImage image) {
        return new TileResult(tile, TileResultStatus.DEFAULT_IMAGE, image);
    }

    public static TileResult absent(TileIdentity tile) {
        return new TileResult(tile, TileResultStatus.ABSENT, null);
    }

    public static TileResult noSuchTile(TileIdentity tile) {
        return new TileResult(tile, TileResultStatus.NO_SUCH_TILE, null);
    }

    public boolean hasImage() {
        return image != null;
    }

    public Optional<TileImage> imageIfPresent() {
        return Optional.ofNullable(image);
    }
}
