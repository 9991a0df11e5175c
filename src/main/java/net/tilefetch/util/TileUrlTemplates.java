package net.tilefetch.util;

import net.tilefetch.exception.TileSourceConfigurationException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;

import java.net.URI;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Expansion of slippy-map URL templates such as {@code https://{s}.tile.example.org/{z}/{x}/{y}.png}.
 *
 * <p>Supported placeholders: {@code {z}}, {@code {x}}, {@code {y}} and {@code {s}}. The
 * subdomain is picked from {@code (x + y) mod n}, so the same tile always maps to the
 * same host.</p>
 */
public final class TileUrlTemplates {

    static final String ZOOM = "{z}";
    static final String X = "{x}";
    static final String Y = "{y}";
    static final String SUBDOMAIN = "{s}";

    private static final String CACHE_KEY_PREFIX = "web-";
    private static final int CACHE_KEY_HASH_LENGTH = 16;

    private TileUrlTemplates() {
    }

    /**
     * @throws TileSourceConfigurationException when the template lacks a coordinate placeholder,
     * uses {@code {s}} without subdomains, or does not form an absolute URI
     */
    public static void validate(String template, List<String> subdomains) {
        if (template == null || template.isBlank()) {
            throw new TileSourceConfigurationException("Tile URL template must not be blank");
        }
        for (String placeholder : List.of(ZOOM, X, Y)) {
            if (!template.contains(placeholder)) {
                throw new TileSourceConfigurationException(
                    "Tile URL template '" + template + "' is missing placeholder " + placeholder);
            }
        }
        if (template.contains(SUBDOMAIN) && (subdomains == null || subdomains.isEmpty())) {
            throw new TileSourceConfigurationException(
                "Tile URL template '" + template + "' uses {s} but no subdomains are configured");
        }
        URI probe = toUri(expandRaw(template, new TileIdentity(0, 0, 0), subdomains));
        if (!probe.isAbsolute()) {
            throw new TileSourceConfigurationException("Tile URL template '" + template + "' is not an absolute URL");
        }
    }

    public static SourceLocation expand(String template, TileIdentity tile, List<String> subdomains) {
        return new SourceLocation(toUri(expandRaw(template, tile, subdomains)));
    }

    /**
     * Stable cache key for a set of templates: the same templates always give the same key.
     */
    public static String cacheKeyFor(List<String> templates) {
        try {
            String digest = HashUtils.sha256Hex(String.join("\n", templates));
            return CACHE_KEY_PREFIX + digest.substring(0, CACHE_KEY_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String expandRaw(String template, TileIdentity tile, List<String> subdomains) {
        String url = template
            .replace(ZOOM, Integer.toString(tile.zoom()))
            .replace(X, Integer.toString(tile.x()))
            .replace(Y, Integer.toString(tile.y()));
        if (url.contains(SUBDOMAIN)) {
            String subdomain = subdomains.get(Math.floorMod(tile.x() + tile.y(), subdomains.size()));
            url = url.replace(SUBDOMAIN, subdomain);
        }
        return url;
    }

    private static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new TileSourceConfigurationException("Invalid tile URL '" + url + "'", e);
        }
    }
}
