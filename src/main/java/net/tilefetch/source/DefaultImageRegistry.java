package net.tilefetch.source;

import net.tilefetch.model.TileImage;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-zoom fallback images used when a source explicitly answers "no content" for a tile.
 * Entries live as long as the owning source; there is no removal.
 */
public class DefaultImageRegistry {

    private final Map<Integer, TileImage> imagesByZoom = new ConcurrentHashMap<>();

    public void register(int zoom, TileImage image) {
        if (zoom < 0) {
            throw new IllegalArgumentException("Zoom level must be non-negative, got " + zoom);
        }
        imagesByZoom.put(zoom, Objects.requireNonNull(image, "image"));
    }

    public Optional<TileImage> lookup(int zoom) {
        return Optional.ofNullable(imagesByZoom.get(zoom));
    }
}
