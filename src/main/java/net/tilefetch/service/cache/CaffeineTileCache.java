package net.tilefetch.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import net.tilefetch.model.TileCacheKey;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;

import java.time.Duration;
import java.util.Optional;

/**
 * In-memory {@link TileCache} on top of a bounded Caffeine cache.
 */
public class CaffeineTileCache implements TileCache {

    private final Cache<TileCacheKey, TileImage> cache;

    public CaffeineTileCache(Cache<TileCacheKey, TileImage> cache) {
        this.cache = cache;
    }

    public static CaffeineTileCache create(long maxSize, Duration ttl) {
        return new CaffeineTileCache(Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build());
    }

    @Override
    public Optional<TileImage> lookup(TileIdentity tile, String cacheKey) {
        return Optional.ofNullable(cache.getIfPresent(new TileCacheKey(tile, cacheKey)));
    }

    @Override
    public void store(TileIdentity tile, String cacheKey, TileImage image) {
        cache.put(new TileCacheKey(tile, cacheKey), image);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
