package net.tilefetch.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.service.event.TileRequestedEvent;
import net.tilefetch.service.event.TileRetrievedEvent;
import net.tilefetch.source.TileResultStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TileLifecycleMetricsListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TileLifecycleMetricsListener listener = new TileLifecycleMetricsListener(registry);

    @Test
    void should_CountRequestsPerSource() {
        listener.onTileRequested(new TileRequestedEvent(TileIdentity.of(0, 0, 1), "osm"));
        listener.onTileRequested(new TileRequestedEvent(TileIdentity.of(1, 0, 1), "osm"));
        listener.onTileRequested(new TileRequestedEvent(TileIdentity.of(0, 0, 1), "satellite"));

        assertThat(registry.get(TileLifecycleMetricsListener.REQUESTED_METRIC).tag("source", "osm").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(TileLifecycleMetricsListener.REQUESTED_METRIC).tag("source", "satellite").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void should_CountRetrievalsPerStatus() {
        listener.onTileRetrieved(new TileRetrievedEvent(TileIdentity.of(0, 0, 1), "osm", TileResultStatus.FETCHED));
        listener.onTileRetrieved(new TileRetrievedEvent(TileIdentity.of(1, 0, 1), "osm", TileResultStatus.ABSENT));
        listener.onTileRetrieved(new TileRetrievedEvent(TileIdentity.of(1, 1, 1), "osm", TileResultStatus.FETCHED));

        assertThat(registry.get(TileLifecycleMetricsListener.RETRIEVED_METRIC)
            .tags("source", "osm", "status", "FETCHED").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(TileLifecycleMetricsListener.RETRIEVED_METRIC)
            .tags("source", "osm", "status", "ABSENT").counter().count()).isEqualTo(1.0);
    }
}
