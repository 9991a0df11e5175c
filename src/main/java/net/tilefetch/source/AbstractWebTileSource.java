package net.tilefetch.source;

import net.tilefetch.exception.TileSourceConfigurationException;
import net.tilefetch.model.RetryBudget;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;
import net.tilefetch.model.fetch.FanOutResult;
import net.tilefetch.model.fetch.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for tile sources that download their tiles over HTTP.
 *
 * <p>Subclasses only decide where a tile lives, either by overriding
 * {@link #resolveLocation(TileIdentity)} for single-layer sources or
 * {@link #resolve(TileIdentity)} for layered ones. Everything else (cache, retries,
 * fan-out, compositing, default images and lifecycle events) is handled here.</p>
 *
 * <p>Pipeline for {@link #imageForTile(TileIdentity)}:</p>
 * <ol>
 *   <li>hidden source: absent, nothing else happens</li>
 *   <li>normalize; tile outside the pyramid: {@code NO_SUCH_TILE}</li>
 *   <li>cache hit: returned without network activity or events</li>
 *   <li>"requested" event, resolve locations; none resolved: absent, no "retrieved" event</li>
 *   <li>one location: retry loop, no-content answered with the zoom's default image</li>
 *   <li>several locations: concurrent fan-out, then composite in resolver order</li>
 *   <li>store the image in the cache unless a fan-out layer failed, "retrieved" event</li>
 * </ol>
 */
public abstract class AbstractWebTileSource implements TileSource {

    private static final Logger log = LoggerFactory.getLogger(AbstractWebTileSource.class);

    private final TileSourceCollaborators collaborators;
    private final DefaultImageRegistry defaultImages = new DefaultImageRegistry();

    private volatile RetryBudget retryBudget = RetryBudget.defaults();
    private volatile boolean cacheable = true;
    private volatile boolean hidden;

    protected AbstractWebTileSource(TileSourceCollaborators collaborators) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    }

    /**
     * Location of the single layer of a tile. Single-layer sources override this;
     * calling it on a source that does not is a configuration error.
     */
    protected SourceLocation resolveLocation(TileIdentity tile) {
        throw new TileSourceConfigurationException(getClass().getName()
            + " does not override resolveLocation(TileIdentity); a web tile source must say where its tiles live");
    }

    @Override
    public List<SourceLocation> resolve(TileIdentity tile) {
        return List.of(resolveLocation(tile));
    }

    @Override
    public TileResult cachedImageForTile(TileIdentity tile) {
        if (hidden) {
            return TileResult.absent(tile);
        }
        TileIdentity normalized = collaborators.projection().normalize(tile);
        if (!collaborators.projection().tileExists(normalized)) {
            return TileResult.noSuchTile(normalized);
        }
        return collaborators.cacheGateway().lookup(this, normalized)
            .map(image -> TileResult.cached(normalized, image))
            .orElseGet(() -> TileResult.absent(normalized));
    }

    @Override
    public TileResult imageForTile(TileIdentity tile) {
        if (hidden) {
            return TileResult.absent(tile);
        }

        TileIdentity normalized = collaborators.projection().normalize(tile);
        if (!collaborators.projection().tileExists(normalized)) {
            return TileResult.noSuchTile(normalized);
        }

        Optional<TileImage> cached = collaborators.cacheGateway().lookup(this, normalized);
        if (cached.isPresent()) {
            return TileResult.cached(normalized, cached.get());
        }

        String cacheKey = uniqueTileCacheKey();
        collaborators.notifier().tileRequested(normalized, cacheKey);

        List<SourceLocation> locations = resolve(normalized);
        if (locations == null || locations.isEmpty()) {
            log.debug("Tile {}: source {} resolved no locations", normalized, cacheKey);
            return TileResult.absent(normalized);
        }

        FetchedTile fetched = fetch(normalized, locations);
        TileResult result = fetched.result();
        if (result.hasImage() && fetched.complete()) {
            collaborators.cacheGateway().store(this, normalized, result.image());
        }

        collaborators.notifier().tileRetrieved(normalized, cacheKey, result.status());
        return result;
    }

    private FetchedTile fetch(TileIdentity tile, List<SourceLocation> locations) {
        RetryBudget budget = retryBudget;
        if (locations.size() > 1) {
            FanOutResult fanOut = collaborators.fanOutCoordinator().fetchAll(tile, locations, budget);
            TileResult result = collaborators.compositor().composite(fanOut.layers())
                .map(image -> TileResult.fetched(tile, image))
                .orElseGet(() -> TileResult.absent(tile));
            return new FetchedTile(result, fanOut.complete());
        }

        FetchOutcome outcome = collaborators.fetchExecutor().fetch(locations.get(0), budget);
        TileResult result = switch (outcome.status()) {
            case SUCCESS -> TileResult.fetched(tile, outcome.image());
            // Default images only apply to single-layer sources; fan-out skips empty layers.
            case EMPTY -> defaultImages.lookup(tile.zoom())
                .map(image -> TileResult.defaultImage(tile, image))
                .orElseGet(() -> TileResult.absent(tile));
            case NOT_FOUND, TRANSIENT_FAILURE -> TileResult.absent(tile);
        };
        return new FetchedTile(result, true);
    }

    /** A fetched tile and whether every layer behind it reached a definite answer. */
    private record FetchedTile(TileResult result, boolean complete) {
    }

    public void addDefaultImage(TileImage image, int zoom) {
        defaultImages.register(zoom, image);
    }

    public Optional<TileImage> defaultImageForZoom(int zoom) {
        return defaultImages.lookup(zoom);
    }

    public void setRetryBudget(RetryBudget retryBudget) {
        this.retryBudget = Objects.requireNonNull(retryBudget, "retryBudget");
    }

    public int getRetryCount() {
        return retryBudget.retryCount();
    }

    public double getRequestTimeoutSeconds() {
        return retryBudget.totalTimeoutSeconds();
    }

    @Override
    public boolean isCacheable() {
        return cacheable;
    }

    public void setCacheable(boolean cacheable) {
        this.cacheable = cacheable;
    }

    @Override
    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }
}
