package net.tilefetch.service.projection;

import net.tilefetch.model.TileIdentity;

/**
 * Standard spherical-mercator tile pyramid: {@code 2^zoom} tiles per axis, x wraps around
 * the antimeridian, y does not wrap. Only zoom levels inside {@code [minZoom, maxZoom]} exist.
 */
public class WebMercatorTileProjection implements TileProjection {

    public static final int MAX_SUPPORTED_ZOOM = 28;

    private final int minZoom;
    private final int maxZoom;

    public WebMercatorTileProjection(int minZoom, int maxZoom) {
        if (minZoom < 0 || maxZoom > MAX_SUPPORTED_ZOOM || minZoom > maxZoom) {
            throw new IllegalArgumentException(
                "Zoom range must satisfy 0 <= minZoom <= maxZoom <= " + MAX_SUPPORTED_ZOOM
                    + ", got [" + minZoom + ", " + maxZoom + "]");
        }
        this.minZoom = minZoom;
        this.maxZoom = maxZoom;
    }

    @Override
    public TileIdentity normalize(TileIdentity tile) {
        if (tile.zoom() > MAX_SUPPORTED_ZOOM) {
            return tile;
        }
        int tilesPerAxis = 1 << tile.zoom();
        int x = Math.floorMod(tile.x(), tilesPerAxis);
        return x == tile.x() ? tile : new TileIdentity(x, tile.y(), tile.zoom());
    }

    @Override
    public boolean tileExists(TileIdentity tile) {
        if (tile.zoom() < minZoom || tile.zoom() > maxZoom) {
            return false;
        }
        long tilesPerAxis = 1L << tile.zoom();
        return tile.x() >= 0 && tile.x() < tilesPerAxis
            && tile.y() >= 0 && tile.y() < tilesPerAxis;
    }
}
