package net.tilefetch.controller;

import lombok.extern.slf4j.Slf4j;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.service.image.TileImageCodec;
import net.tilefetch.source.TileResult;
import net.tilefetch.source.TileSource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.time.Duration;

/**
 * Slippy-map endpoint serving tiles from the configured tile source as PNG.
 *
 * <ul>
 *   <li>200 with the image for cached, fetched and default-image results</li>
 *   <li>204 when the source has no image for the tile</li>
 *   <li>404 when the tile is outside the source's pyramid</li>
 * </ul>
 */
@RestController
@RequestMapping("/tiles")
@Slf4j
public class TileController {

    private static final Duration CLIENT_CACHE_MAX_AGE = Duration.ofHours(1);

    private final TileSource tileSource;
    private final TileImageCodec codec;

    public TileController(TileSource tileSource, TileImageCodec codec) {
        this.tileSource = tileSource;
        this.codec = codec;
    }

    @GetMapping("/{z}/{x}/{y}.png")
    public ResponseEntity<byte[]> getTile(@PathVariable("z") int z,
                                          @PathVariable("x") int x,
                                          @PathVariable("y") int y) {
        TileIdentity tile;
        try {
            tile = TileIdentity.of(x, y, z);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }

        TileResult result = tileSource.imageForTile(tile);
        switch (result.status()) {
            case NO_SUCH_TILE -> {
                return ResponseEntity.notFound().build();
            }
            case ABSENT -> {
                return ResponseEntity.noContent().build();
            }
            default -> {
                return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .cacheControl(CacheControl.maxAge(CLIENT_CACHE_MAX_AGE))
                    .header("X-Tile-Status", result.status().name())
                    .body(encode(result));
            }
        }
    }

    private byte[] encode(TileResult result) {
        try {
            return codec.encodePng(result.image());
        } catch (IOException ex) {
            log.error("Failed to encode tile {} as PNG: {}", result.tile(), ex.getMessage(), ex);
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to encode tile " + result.tile(), ex);
        }
    }
}
