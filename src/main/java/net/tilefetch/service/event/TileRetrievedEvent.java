package net.tilefetch.service.event;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.source.TileResultStatus;

/**
 * Event fired when a tile fetch has finished, whether or not it produced an image.
 */
public class TileRetrievedEvent {
    private final long tileKey;
    private final TileIdentity tile;
    private final String sourceKey;
    private final TileResultStatus status;

    public TileRetrievedEvent(TileIdentity tile, String sourceKey, TileResultStatus status) {
        this.tileKey = tile.key();
        this.tile = tile;
        this.sourceKey = sourceKey;
        this.status = status;
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

    public TileResultStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "TileRetrievedEvent{" +
               "tileKey=" + tileKey +
               ", tile=" + tile +
               ", sourceKey='" + sourceKey + '\'' +
               ", status=" + status +
               '}';
    }
}
