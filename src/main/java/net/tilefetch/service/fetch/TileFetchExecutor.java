package net.tilefetch.service.fetch;

import net.tilefetch.exception.TileDecodeException;
import net.tilefetch.model.RetryBudget;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileImage;
import net.tilefetch.model.fetch.FetchOutcome;
import net.tilefetch.model.fetch.TransportResponse;
import net.tilefetch.service.image.TileImageCodec;
import net.tilefetch.service.transport.TileTransport;
import net.tilefetch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fetches a single source location with a fixed number of attempts.
 *
 * <p>Retry rules:</p>
 * <ul>
 *   <li>404 stops immediately with {@code NOT_FOUND}, remaining attempts unused</li>
 *   <li>204 stops immediately with {@code EMPTY}</li>
 *   <li>transient errors, other 4xx answers, empty bodies and undecodable bodies consume an attempt</li>
 * </ul>
 * <p>There is no backoff between attempts; each one is bounded by the per-attempt timeout.</p>
 */
@Component
public class TileFetchExecutor {

    private static final Logger log = LoggerFactory.getLogger(TileFetchExecutor.class);

    private final TileTransport transport;
    private final TileImageCodec codec;

    public TileFetchExecutor(TileTransport transport, TileImageCodec codec) {
        this.transport = transport;
        this.codec = codec;
    }

    public FetchOutcome fetch(SourceLocation location, RetryBudget budget) {
        return fetch(location, budget.perAttemptTimeout(), budget.retryCount());
    }

    public FetchOutcome fetch(SourceLocation location, Duration perAttemptTimeout, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }

        Throwable lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            TransportResponse response = transport.fetch(location, perAttemptTimeout);

            switch (response.status()) {
                case NOT_FOUND -> {
                    log.debug("Tile not found at {} (attempt {}/{})", location, attempt, maxAttempts);
                    return FetchOutcome.notFound(attempt);
                }
                case NO_CONTENT -> {
                    log.debug("No content at {} (attempt {}/{})", location, attempt, maxAttempts);
                    return FetchOutcome.empty(attempt);
                }
                case SUCCESS -> {
                    if (!response.hasBody()) {
                        lastError = new IllegalStateException("Empty body (HTTP " + response.httpStatus() + ")");
                        break;
                    }
                    try {
                        TileImage image = codec.decode(response.body(), location);
                        return FetchOutcome.success(image, attempt);
                    } catch (TileDecodeException ex) {
                        lastError = ex;
                    }
                }
                case CLIENT_ERROR, TRANSIENT -> lastError = response.error() != null
                    ? response.error()
                    : new IllegalStateException("HTTP " + response.httpStatus());
            }

            log.debug("Attempt {}/{} for {} failed: {}", attempt, maxAttempts, location,
                LoggingUtils.summarize(lastError));
        }

        log.warn("Giving up on {} after {} attempts: {}", location, maxAttempts, LoggingUtils.summarize(lastError));
        return FetchOutcome.transientFailure(maxAttempts, lastError);
    }
}
