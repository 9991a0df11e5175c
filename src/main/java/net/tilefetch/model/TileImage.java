/**
 * Decoded raster for a single tile
 *
 * Features:
 * - Wraps the decoded image together with its dimensions
 * - Produced by the codec from fetched bytes or taken from the default-image table
 * - Handed back to callers and stored in the tile cache as-is
 */
package net.tilefetch.model;

import java.awt.image.BufferedImage;
import java.util.Objects;

public record TileImage(BufferedImage image, int width, int height) {

    public TileImage {
        Objects.requireNonNull(image, "image");
    }

    public static TileImage of(BufferedImage image) {
        return new TileImage(image, image.getWidth(), image.getHeight());
    }
}
