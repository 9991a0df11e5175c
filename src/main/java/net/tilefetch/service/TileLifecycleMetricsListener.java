package net.tilefetch.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import net.tilefetch.service.event.TileRequestedEvent;
import net.tilefetch.service.event.TileRetrievedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts tile lifecycle events per source and, for retrievals, per result status.
 */
@Component
public class TileLifecycleMetricsListener {

    private static final Logger logger = LoggerFactory.getLogger(TileLifecycleMetricsListener.class);

    static final String REQUESTED_METRIC = "tiles.requested";
    static final String RETRIEVED_METRIC = "tiles.retrieved";

    private final MeterRegistry meterRegistry;

    public TileLifecycleMetricsListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @EventListener
    public void onTileRequested(TileRequestedEvent event) {
        logger.trace("Tile {} requested from {}", event.getTile(), event.getSourceKey());
        Counter.builder(REQUESTED_METRIC)
            .description("Tiles that required network activity")
            .tag("source", String.valueOf(event.getSourceKey()))
            .register(meterRegistry)
            .increment();
    }

    @EventListener
    public void onTileRetrieved(TileRetrievedEvent event) {
        logger.trace("Tile {} retrieved from {} with status {}", event.getTile(), event.getSourceKey(), event.getStatus());
        Counter.builder(RETRIEVED_METRIC)
            .description("Tile fetches that completed, by result status")
            .tag("source", String.valueOf(event.getSourceKey()))
            .tag("status", event.getStatus().name())
            .register(meterRegistry)
            .increment();
    }
}
