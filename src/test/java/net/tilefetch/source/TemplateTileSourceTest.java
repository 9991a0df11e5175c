package net.tilefetch.source;

import net.tilefetch.exception.TileSourceConfigurationException;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.fetch.TransportResponse;
import net.tilefetch.service.TileLifecycleNotifier;
import net.tilefetch.service.cache.CaffeineTileCache;
import net.tilefetch.testutil.ScriptedTransport;
import net.tilefetch.testutil.TestImages;
import net.tilefetch.testutil.TestSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Color;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class TemplateTileSourceTest {

    @Mock
    private TileLifecycleNotifier notifier;

    private ScriptedTransport transport;
    private TileSourceCollaborators collaborators;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        collaborators = TestSources.collaborators(transport, CaffeineTileCache.create(10, Duration.ofMinutes(1)),
            Runnable::run, notifier);
    }

    @Test
    void should_ResolveSingleLocationFromTemplate() {
        TemplateTileSource source = new TemplateTileSource(
            "https://{s}.tile.example.org/{z}/{x}/{y}.png", List.of("a", "b"), "osm", collaborators);

        assertThat(source.resolve(TileIdentity.of(1, 2, 3)))
            .containsExactly(SourceLocation.of("https://b.tile.example.org/3/1/2.png"));
        assertThat(source.uniqueTileCacheKey()).isEqualTo("osm");
    }

    @Test
    void should_DeriveCacheKeyFromTemplate_When_NoneGiven() {
        TemplateTileSource first = new TemplateTileSource("https://tile.example.org/{z}/{x}/{y}.png", collaborators);
        TemplateTileSource same = new TemplateTileSource("https://tile.example.org/{z}/{x}/{y}.png", List.of(), " ", collaborators);
        TemplateTileSource other = new TemplateTileSource("https://sat.example.org/{z}/{x}/{y}.png", collaborators);

        assertThat(first.uniqueTileCacheKey()).isEqualTo(same.uniqueTileCacheKey());
        assertThat(first.uniqueTileCacheKey()).isNotEqualTo(other.uniqueTileCacheKey());
    }

    @Test
    void should_FetchTileThroughTemplate() {
        transport.on("https://tile.example.org/4/3/2.png", TransportResponse.success(TestImages.solidPng(Color.RED), 200));
        TemplateTileSource source = new TemplateTileSource("https://tile.example.org/{z}/{x}/{y}.png", collaborators);

        TileResult result = source.imageForTile(TileIdentity.of(3, 2, 4));

        assertThat(result.status()).isEqualTo(TileResultStatus.FETCHED);
        assertThat(transport.callsTo("https://tile.example.org/4/3/2.png")).isEqualTo(1);
    }

    @Test
    void should_RejectMalformedTemplate() {
        assertThatThrownBy(() -> new TemplateTileSource("https://tile.example.org/{z}/{x}.png", collaborators))
            .isInstanceOf(TileSourceConfigurationException.class);
    }
}
