package net.tilefetch.service.cache;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;
import net.tilefetch.source.TileSource;
import net.tilefetch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Read-through / write-through access to the shared {@link TileCache} on behalf of a tile source
 *
 * Features:
 * - Keys every entry by the tile and the source's unique cache key
 * - Never reads or writes for hidden or non-cacheable sources
 * - Treats cache failures as misses so a broken backend cannot fail a tile fetch
 */
@Component
public class TileCacheGateway {

    private static final Logger log = LoggerFactory.getLogger(TileCacheGateway.class);

    private final TileCache cache;

    public TileCacheGateway(TileCache cache) {
        this.cache = cache;
    }

    public Optional<TileImage> lookup(TileSource source, TileIdentity tile) {
        if (!isEnabledFor(source)) {
            return Optional.empty();
        }
        try {
            return cache.lookup(tile, source.uniqueTileCacheKey());
        } catch (RuntimeException ex) {
            LoggingUtils.warn(log, ex, "Tile cache lookup failed for {} ({}), treating as miss",
                tile, source.uniqueTileCacheKey());
            return Optional.empty();
        }
    }

    public void store(TileSource source, TileIdentity tile, TileImage image) {
        if (image == null || !isEnabledFor(source)) {
            return;
        }
        try {
            cache.store(tile, source.uniqueTileCacheKey(), image);
        } catch (RuntimeException ex) {
            LoggingUtils.warn(log, ex, "Tile cache store failed for {} ({})", tile, source.uniqueTileCacheKey());
        }
    }

    private static boolean isEnabledFor(TileSource source) {
        return source.isCacheable() && !source.isHidden();
    }
}
