/**
 * Event fired right before a tile source goes to the network for a tile
 *
 * Features:
 * - Carries the packed tile key used by map views to track outstanding tiles
 * - Never fired for cache hits
 * - Always followed by a TileRetrievedEvent for the same key
 */
package net.tilefetch.service.event;

import net.tilefetch.model.TileIdentity;

public class TileRequestedEvent {
    private final long tileKey;
    private final TileIdentity tile;
    private final String sourceKey;

    public TileRequestedEvent(TileIdentity tile, String sourceKey) {
        this.tileKey = tile.key();
        this.tile = tile;
        this.sourceKey = sourceKey;
    }

    public long getTileKey() {
        return tileKey;
    }

    public TileIdentity getTile() {
        return tile;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    @Override
    public String toString() {
        return "TileRequestedEvent{" +
               "tileKey=" + tileKey +
               ", tile=" + tile +
               ", sourceKey='" + sourceKey + '\'' +
               '}';
    }
}
