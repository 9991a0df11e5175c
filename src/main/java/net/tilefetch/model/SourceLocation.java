package net.tilefetch.model;

import java.net.URI;
import java.util.Objects;

/**
 * A resolved network address for one layer of a tile.
 *
 * @param uri absolute address to fetch
 */
public record SourceLocation(URI uri) {

    public SourceLocation {
        Objects.requireNonNull(uri, "uri");
    }

    public static SourceLocation of(String uri) {
        return new SourceLocation(URI.create(uri));
    }

    @Override
    public String toString() {
        return uri.toString();
    }
}
