package net.tilefetch.config;

import net.tilefetch.service.cache.CaffeineTileCache;
import net.tilefetch.service.cache.TileCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default in-memory tile cache. Integrators with a persistent store provide their own {@link TileCache} bean.
 */
@Configuration
public class TileCacheConfig {

    @Bean
    @ConditionalOnMissingBean(TileCache.class)
    public TileCache tileCache(TileSourceProperties properties) {
        return CaffeineTileCache.create(properties.getCache().getMaxSize(), properties.getCache().getTtl());
    }
}
