/**
 * Publishes tile lifecycle events off the fetching thread
 *
 * Features:
 * - Hands each event to a dedicated notification executor and returns immediately
 * - Fire-and-forget: no acknowledgement, no delivery guarantee
 * - Listener failures and executor saturation are logged, never propagated to the fetch path
 */
package net.tilefetch.service;

import net.tilefetch.model.TileIdentity;
import net.tilefetch.service.event.TileRequestedEvent;
import net.tilefetch.service.event.TileRetrievedEvent;
import net.tilefetch.source.TileResultStatus;
import net.tilefetch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class TileLifecycleNotifier {

    private static final Logger logger = LoggerFactory.getLogger(TileLifecycleNotifier.class);

    private final ApplicationEventPublisher eventPublisher;
    private final Executor notificationExecutor;

    public TileLifecycleNotifier(ApplicationEventPublisher eventPublisher,
                                 @Qualifier("tileNotificationExecutor") Executor notificationExecutor) {
        this.eventPublisher = eventPublisher;
        this.notificationExecutor = notificationExecutor;
    }

    public void tileRequested(TileIdentity tile, String sourceKey) {
        dispatch(new TileRequestedEvent(tile, sourceKey));
    }

    public void tileRetrieved(TileIdentity tile, String sourceKey, TileResultStatus status) {
        dispatch(new TileRetrievedEvent(tile, sourceKey, status));
    }

    private void dispatch(Object event) {
        try {
            notificationExecutor.execute(() -> publishQuietly(event));
        } catch (RejectedExecutionException ex) {
            LoggingUtils.warn(logger, ex, "Dropping tile event {}: notification executor saturated", event);
        }
    }

    private void publishQuietly(Object event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            LoggingUtils.warn(logger, ex, "Tile event listener failed for {}", event);
        }
    }
}
