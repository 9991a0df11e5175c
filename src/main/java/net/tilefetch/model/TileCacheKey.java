package net.tilefetch.model;

import java.util.Objects;

/**
 * Cache key pairing a tile with the unique key of the source that produced it, so
 * several sources can share one cache without colliding.
 *
 * @param tile normalized tile identity
 * @param sourceKey per-source unique cache key
 */
public record TileCacheKey(TileIdentity tile, String sourceKey) {

    public TileCacheKey {
        Objects.requireNonNull(tile, "tile");
        Objects.requireNonNull(sourceKey, "sourceKey");
    }
}
