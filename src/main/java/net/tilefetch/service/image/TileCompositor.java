package net.tilefetch.service.image;

import net.tilefetch.model.TileImage;
import org.springframework.stereotype.Component;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges the layers of a multi-location tile into a single image.
 *
 * <p>Layers are drawn in list order at the origin with source-over blending, so
 * index 0 is the base and later layers cover earlier ones wherever they are
 * opaque. The canvas takes the dimensions of the first present layer.</p>
 */
@Component
public class TileCompositor {

    public Optional<TileImage> composite(List<Optional<TileImage>> layers) {
        List<TileImage> present = layers.stream()
            .filter(Objects::nonNull)
            .flatMap(Optional::stream)
            .toList();

        if (present.isEmpty()) {
            return Optional.empty();
        }
        if (present.size() == 1) {
            return Optional.of(present.get(0));
        }

        TileImage base = present.get(0);
        BufferedImage canvas = new BufferedImage(base.width(), base.height(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            for (TileImage layer : present) {
                g.drawImage(layer.image(), 0, 0, null);
            }
        } finally {
            g.dispose();
        }
        return Optional.of(TileImage.of(canvas));
    }
}
