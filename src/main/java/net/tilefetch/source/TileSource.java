package net.tilefetch.source;

import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;

import java.util.List;

/**
 * A provider of map tiles. Implementations must be safe to call from many threads at once.
 */
public interface TileSource {

    /**
     * Source locations for a tile, bottom-most layer first. An empty list means there is
     * nothing to fetch for this tile.
     */
    List<SourceLocation> resolve(TileIdentity tile);

    /**
     * Identifier distinguishing this source's entries in a shared tile cache.
     */
    String uniqueTileCacheKey();

    boolean isCacheable();

    boolean isHidden();

    /**
     * Returns the tile image, going to the cache first and then to the network.
     * Never throws for network failures.
     */
    TileResult imageForTile(TileIdentity tile);

    /**
     * Cache-only variant of {@link #imageForTile(TileIdentity)}; never touches the network.
     */
    TileResult cachedImageForTile(TileIdentity tile);
}
