package net.tilefetch.source;

import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.util.TileUrlTemplates;

import java.util.List;

/**
 * Single-layer web source addressed by one URL template.
 */
public class TemplateTileSource extends AbstractWebTileSource {

    private final String urlTemplate;
    private final List<String> subdomains;
    private final String cacheKey;

    public TemplateTileSource(String urlTemplate, TileSourceCollaborators collaborators) {
        this(urlTemplate, List.of(), null, collaborators);
    }

    /**
     * @param cacheKey unique cache key, or {@code null} to derive one from the template
     */
    public TemplateTileSource(String urlTemplate,
                              List<String> subdomains,
                              String cacheKey,
                              TileSourceCollaborators collaborators) {
        super(collaborators);
        this.subdomains = subdomains != null ? List.copyOf(subdomains) : List.of();
        TileUrlTemplates.validate(urlTemplate, this.subdomains);
        this.urlTemplate = urlTemplate;
        this.cacheKey = cacheKey != null && !cacheKey.isBlank()
            ? cacheKey
            : TileUrlTemplates.cacheKeyFor(List.of(urlTemplate));
    }

    @Override
    protected SourceLocation resolveLocation(TileIdentity tile) {
        return TileUrlTemplates.expand(urlTemplate, tile, subdomains);
    }

    @Override
    public String uniqueTileCacheKey() {
        return cacheKey;
    }
}
