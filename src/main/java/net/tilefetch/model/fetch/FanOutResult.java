package net.tilefetch.model.fetch;

import net.tilefetch.model.TileImage;

import java.util.List;
import java.util.Optional;

/**
 * Layers gathered for a multi-location tile.
 *
 * @param layers one entry per location in resolver order, empty where no image was obtained
 * @param complete {@code false} when any layer failed, was rejected or missed the deadline;
 *                 layers that answered "no content" or "not found" still count as complete
 */
public record FanOutResult(List<Optional<TileImage>> layers, boolean complete) {

    public FanOutResult {
        layers = List.copyOf(layers);
    }
}
