package net.tilefetch.model;

/**
 * Address of one tile in the quad-tree pyramid.
 *
 * <p>Coordinates are only meaningful after normalization by a
 * {@link net.tilefetch.service.projection.TileProjection}; every cache, fetch and
 * notification path works on normalized identities.</p>
 *
 * @param x column index
 * @param y row index
 * @param zoom zoom level, zero being the single world tile
 */
public record TileIdentity(int x, int y, int zoom) {

    private static final long COORDINATE_MASK = 0xFFFFFFFL;

    public TileIdentity {
        if (zoom < 0) {
            throw new IllegalArgumentException("Zoom level must be non-negative, got " + zoom);
        }
    }

    public static TileIdentity of(int x, int y, int zoom) {
        return new TileIdentity(x, y, zoom);
    }

    /**
     * Packs the tile into a single opaque key: zoom in the top byte, then 28 bits
     * each for x and y. Used as the notification payload and for log correlation.
     *
     * @return deterministic key for this tile
     */
    public long key() {
        return ((long) zoom << 56) | ((x & COORDINATE_MASK) << 28) | (y & COORDINATE_MASK);
    }

    @Override
    public String toString() {
        return zoom + "/" + x + "/" + y;
    }
}
