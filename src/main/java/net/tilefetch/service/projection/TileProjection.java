package net.tilefetch.service.projection;

import net.tilefetch.model.TileIdentity;

/**
 * Projection / tile-index collaborator.
 */
public interface TileProjection {

    /**
     * Brings a tile into canonical form (wrapping, clamping) before any lookup or fetch.
     */
    TileIdentity normalize(TileIdentity tile);

    /**
     * Whether the pyramid contains the (normalized) tile at all.
     */
    boolean tileExists(TileIdentity tile);
}
