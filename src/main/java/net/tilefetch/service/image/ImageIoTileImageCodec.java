package net.tilefetch.service.image;

import net.tilefetch.exception.TileDecodeException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileImage;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Codec backed by the JDK {@link ImageIO} readers and writers
 *
 * Features:
 * - Decodes whatever formats the installed ImageIO plugins understand (PNG, JPEG, GIF, BMP)
 * - Rejects empty bodies, unreadable payloads and plugin failures with {@link TileDecodeException}
 * - Encodes composited tiles as PNG so transparency survives
 */
@Service
public class ImageIoTileImageCodec implements TileImageCodec {

    private static final String PNG_FORMAT = "png";

    @Override
    public TileImage decode(byte[] bytes, SourceLocation location) {
        String origin = location != null ? location.toString() : "unknown";
        if (bytes == null || bytes.length == 0) {
            throw new TileDecodeException(origin, "empty body");
        }
        BufferedImage image;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes)) {
            image = ImageIO.read(bais);
        } catch (IOException e) {
            throw new TileDecodeException(origin, e);
        } catch (RuntimeException e) {
            // ImageIO plugins throw unchecked exceptions for hostile headers such as oversized dimensions
            throw new TileDecodeException(origin, e);
        }
        if (image == null) {
            throw new TileDecodeException(origin, "unsupported or corrupt image data (" + bytes.length + " bytes)");
        }
        return TileImage.of(image);
    }

    @Override
    public byte[] encodePng(TileImage image) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image.image(), PNG_FORMAT, baos)) {
                throw new IOException("No PNG writer available");
            }
            return baos.toByteArray();
        }
    }
}
