package net.tilefetch.source;

import net.tilefetch.service.TileLifecycleNotifier;
import net.tilefetch.service.cache.TileCacheGateway;
import net.tilefetch.service.fetch.FanOutCoordinator;
import net.tilefetch.service.fetch.TileFetchExecutor;
import net.tilefetch.service.image.TileCompositor;
import net.tilefetch.service.projection.TileProjection;

import java.util.Objects;

/**
 * The shared services a web tile source drives. One instance can back any number of sources.
 */
public record TileSourceCollaborators(
    TileProjection projection,
    TileCacheGateway cacheGateway,
    TileFetchExecutor fetchExecutor,
    FanOutCoordinator fanOutCoordinator,
    TileCompositor compositor,
    TileLifecycleNotifier notifier
) {
    public TileSourceCollaborators {
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(cacheGateway, "cacheGateway");
        Objects.requireNonNull(fetchExecutor, "fetchExecutor");
        Objects.requireNonNull(fanOutCoordinator, "fanOutCoordinator");
        Objects.requireNonNull(compositor, "compositor");
        Objects.requireNonNull(notifier, "notifier");
    }
}
