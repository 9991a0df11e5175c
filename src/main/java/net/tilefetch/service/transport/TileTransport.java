package net.tilefetch.service.transport;

import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.fetch.TransportResponse;

import java.time.Duration;

/**
 * Low-level "fetch bytes at location" collaborator.
 *
 * <p>Implementations never throw for network or HTTP failures; they classify them
 * into a {@link TransportResponse}. Every call is expected to reach the network,
 * bypassing any HTTP-layer cache.</p>
 */
@FunctionalInterface
public interface TileTransport {

    /**
     * Performs a single attempt.
     *
     * @param location address to fetch
     * @param timeout hard timeout for this attempt
     * @return classified response, never {@code null}
     */
    TransportResponse fetch(SourceLocation location, Duration timeout);
}
