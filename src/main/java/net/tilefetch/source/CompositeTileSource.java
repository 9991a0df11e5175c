package net.tilefetch.source;

import net.tilefetch.exception.TileSourceConfigurationException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.util.TileUrlTemplates;

import java.util.List;

/**
 * Layered web source: a base template followed by overlay templates, drawn bottom to top.
 */
public class CompositeTileSource extends AbstractWebTileSource {

    private final List<String> layerTemplates;
    private final List<String> subdomains;
    private final String cacheKey;

    /**
     * @param layerTemplates URL templates, base layer first
     * @param cacheKey unique cache key, or {@code null} to derive one from the templates
     */
    public CompositeTileSource(List<String> layerTemplates,
                               List<String> subdomains,
                               String cacheKey,
                               TileSourceCollaborators collaborators) {
        super(collaborators);
        if (layerTemplates == null || layerTemplates.isEmpty()) {
            throw new TileSourceConfigurationException("A composite tile source needs at least one layer template");
        }
        this.subdomains = subdomains != null ? List.copyOf(subdomains) : List.of();
        layerTemplates.forEach(template -> TileUrlTemplates.validate(template, this.subdomains));
        this.layerTemplates = List.copyOf(layerTemplates);
        this.cacheKey = cacheKey != null && !cacheKey.isBlank()
            ? cacheKey
            : TileUrlTemplates.cacheKeyFor(this.layerTemplates);
    }

    @Override
    public List<SourceLocation> resolve(TileIdentity tile) {
        return layerTemplates.stream()
            .map(template -> TileUrlTemplates.expand(template, tile, subdomains))
            .toList();
    }

    @Override
    public String uniqueTileCacheKey() {
        return cacheKey;
    }
}
