package net.tilefetch.service.fetch;

import net.tilefetch.model.RetryBudget;
import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.TileIdentity;
import net.tilefetch.model.TileImage;
import net.tilefetch.model.fetch.FanOutResult;
import net.tilefetch.model.fetch.FetchOutcome;
import net.tilefetch.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fetches every layer of a multi-location tile concurrently.
 *
 * <p>One task per location runs its own retry loop through {@link TileFetchExecutor}.
 * Results land in a slot array indexed by location position, so the returned list
 * is in resolver order whatever order the tasks finish in. The coordinator waits
 * at most the tile's total timeout; tasks still running after that are left alone
 * and whatever they write later is dropped. Callers learn whether every layer
 * finished so that a partially assembled tile is not cached.</p>
 */
@Component
public class FanOutCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FanOutCoordinator.class);

    private final TileFetchExecutor fetchExecutor;
    private final Executor executor;

    public FanOutCoordinator(TileFetchExecutor fetchExecutor,
                             @Qualifier("tileFanOutExecutor") Executor executor) {
        this.fetchExecutor = fetchExecutor;
        this.executor = executor;
    }

    /**
     * @return one layer per location in resolver order, plus whether every layer reached a definite answer
     */
    public FanOutResult fetchAll(TileIdentity tile, List<SourceLocation> locations, RetryBudget budget) {
        ResultSlots slots = new ResultSlots(locations.size());
        List<CompletableFuture<Void>> tasks = new ArrayList<>(locations.size());

        for (int i = 0; i < locations.size(); i++) {
            final int index = i;
            SourceLocation location = locations.get(i);
            try {
                tasks.add(CompletableFuture.runAsync(
                    () -> slots.fill(index, fetchExecutor.fetch(location, budget)), executor));
            } catch (RejectedExecutionException ex) {
                LoggingUtils.warn(log, ex, "Fetch task for tile {} layer {} ({}) was rejected", tile, index, location);
            }
        }

        awaitAll(tile, tasks, budget);

        FanOutResult result = slots.close();
        if (!result.complete()) {
            log.debug("Tile {}: fan-out incomplete, {} of {} layers have an image", tile,
                result.layers().stream().filter(Optional::isPresent).count(), result.layers().size());
        }
        return result;
    }

    private void awaitAll(TileIdentity tile, List<CompletableFuture<Void>> tasks, RetryBudget budget) {
        if (tasks.isEmpty()) {
            return;
        }
        long deadlineNanos = budget.totalTimeout().toNanos();
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]))
                .get(deadlineNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException ex) {
            log.warn("Tile {}: fan-out deadline of {} ms reached, compositing the layers received so far",
                tile, TimeUnit.NANOSECONDS.toMillis(deadlineNanos));
        } catch (ExecutionException ex) {
            LoggingUtils.warn(log, ex.getCause(), "Tile {}: a layer fetch task failed unexpectedly", tile);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("Tile {}: interrupted while waiting for layer fetches", tile);
        }
    }

    /**
     * Index-addressed results guarded by a single lock. After {@link #close()} the
     * slots are frozen and late writes from abandoned tasks are ignored. A slot that is
     * still unfilled at close time makes the result incomplete.
     */
    static final class ResultSlots {
        private final FetchOutcome[] outcomes;
        private final ReentrantLock lock = new ReentrantLock();
        private boolean closed;

        ResultSlots(int size) {
            this.outcomes = new FetchOutcome[size];
        }

        boolean fill(int index, FetchOutcome outcome) {
            lock.lock();
            try {
                if (closed) {
                    return false;
                }
                outcomes[index] = outcome;
                return true;
            } finally {
                lock.unlock();
            }
        }

        FanOutResult close() {
            lock.lock();
            try {
                closed = true;
                List<Optional<TileImage>> images = new ArrayList<>(outcomes.length);
                boolean complete = true;
                for (FetchOutcome outcome : outcomes) {
                    if (outcome == null || outcome.isFailure()) {
                        complete = false;
                    }
                    images.add(outcome != null && outcome.isSuccess()
                        ? outcome.imageIfPresent()
                        : Optional.empty());
                }
                return new FanOutResult(images, complete);
            } finally {
                lock.unlock();
            }
        }
    }
}
