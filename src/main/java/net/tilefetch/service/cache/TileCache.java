package net.tilefetch.service.cache;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;

import java.util.Optional;

/**
 * Storage collaborator for decoded tiles. Eviction and persistence belong to the implementation.
 * Implementations must tolerate concurrent readers and writers.
 */
public interface TileCache {

    Optional<TileImage> lookup(TileIdentity tile, String cacheKey);

    void store(TileIdentity tile, String cacheKey, TileImage image);
}
