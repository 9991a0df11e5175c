package net.tilefetch.source;

/**
 * How a tile request ended.
 */
public enum TileResultStatus {
    /** Served from the tile cache without network activity. */
    CACHED,
    /** Fetched (and, for multi-layer sources, composited) from the network. */
    FETCHED,
    /** Source answered no-content; the registered default image for the zoom was used. */
    DEFAULT_IMAGE,
    /** No image could be obtained: no locations, not found, exhausted retries, or hidden source. */
    ABSENT,
    /** The tile lies outside the source's pyramid. Callers may try a neighbouring zoom instead. */
    NO_SUCH_TILE
}
