package net.tilefetch.service.image;

import net.tilefetch.exception.TileDecodeException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileImage;

import java.io.IOException;

/**
 * Image codec collaborator: turns fetched bytes into a {@link TileImage} and back.
 */
public interface TileImageCodec {

    /**
     * @throws TileDecodeException when the bytes are not a readable image
     */
    TileImage decode(byte[] bytes, SourceLocation location);

    byte[] encodePng(TileImage image) throws IOException;
}
