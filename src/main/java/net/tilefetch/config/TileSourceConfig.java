package net.tilefetch.config;

import net.tilefetch.exception.TileDecodeException;
import net.tilefetch.exception.TileSourceConfigurationException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileImage;
import net.tilefetch.service.TileLifecycleNotifier;
import net.tilefetch.service.cache.TileCacheGateway;
import net.tilefetch.service.fetch.FanOutCoordinator;
import net.tilefetch.service.fetch.TileFetchExecutor;
import net.tilefetch.service.image.TileCompositor;
import net.tilefetch.service.image.TileImageCodec;
import net.tilefetch.service.projection.TileProjection;
import net.tilefetch.service.projection.WebMercatorTileProjection;
import net.tilefetch.source.AbstractWebTileSource;
import net.tilefetch.source.CompositeTileSource;
import net.tilefetch.source.TemplateTileSource;
import net.tilefetch.source.TileSourceCollaborators;
import net.tilefetch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Builds the configured web tile source and the services it drives.
 */
@Configuration
public class TileSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(TileSourceConfig.class);

    @Bean
    public TileProjection tileProjection(TileSourceProperties properties) {
        return new WebMercatorTileProjection(properties.getMinZoom(), properties.getMaxZoom());
    }

    @Bean
    public TileSourceCollaborators tileSourceCollaborators(TileProjection projection,
                                                           TileCacheGateway cacheGateway,
                                                           TileFetchExecutor fetchExecutor,
                                                           FanOutCoordinator fanOutCoordinator,
                                                           TileCompositor compositor,
                                                           TileLifecycleNotifier notifier) {
        return new TileSourceCollaborators(projection, cacheGateway, fetchExecutor, fanOutCoordinator, compositor, notifier);
    }

    @Bean
    public AbstractWebTileSource tileSource(TileSourceProperties properties,
                                            TileSourceCollaborators collaborators,
                                            TileImageCodec codec,
                                            ResourceLoader resourceLoader) {
        List<String> templates = properties.getUrlTemplates();
        AbstractWebTileSource source = templates.size() == 1
            ? new TemplateTileSource(templates.get(0), properties.getSubdomains(), properties.getCacheKey(), collaborators)
            : new CompositeTileSource(templates, properties.getSubdomains(), properties.getCacheKey(), collaborators);

        source.setRetryBudget(properties.toRetryBudget());
        source.setCacheable(properties.isCacheable());
        source.setHidden(properties.isHidden());

        for (Map.Entry<Integer, String> entry : properties.getDefaultImages().entrySet()) {
            source.addDefaultImage(loadImage(entry.getValue(), codec, resourceLoader), entry.getKey());
        }

        log.info("Tile source {} configured: {} layer(s), retryCount={}, requestTimeoutSeconds={}, cacheable={}, hidden={}, default images for zooms {}",
            source.uniqueTileCacheKey(), templates.size(), source.getRetryCount(), source.getRequestTimeoutSeconds(),
            source.isCacheable(), source.isHidden(), properties.getDefaultImages().keySet());
        return source;
    }

    private static TileImage loadImage(String location, TileImageCodec codec, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return codec.decode(in.readAllBytes(), new SourceLocation(resource.getURI()));
        } catch (IOException | TileDecodeException e) {
            LoggingUtils.error(log, e, "Default tile image {} could not be loaded", location);
            throw new TileSourceConfigurationException("Cannot load default tile image from " + location, e);
        }
    }
}
