package net.tilefetch.exception;

/**
 * Fetched bytes could not be decoded into an image (truncated body, HTML error page, unknown format).
 * RETRYABLE: Yes (a truncated download usually succeeds on the next attempt)
 */
public class TileDecodeException extends TileFetchException {
    public TileDecodeException(String location, String reason) {
        super("Failed to decode tile image from " + location + ": " + reason, null);
    }

    public TileDecodeException(String location, Throwable cause) {
        super("Failed to decode tile image from " + location, cause);
    }
}
