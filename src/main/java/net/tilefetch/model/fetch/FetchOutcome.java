package net.tilefetch.model.fetch;

import net.tilefetch.model.TileImage;

import java.util.Optional;

/**
 * Tagged result of fetching a single source location.
 *
 * @param status outcome tag
 * @param image decoded image on success, {@code null} otherwise
 * @param attempts number of attempts that were made
 * @param error last observed error for transient failures, may be {@code null}
 */
public record FetchOutcome(FetchStatus status, TileImage image, int attempts, Throwable error) {

    public static FetchOutcome success(TileImage image, int attempts) {
        return new FetchOutcome(FetchStatus.SUCCESS, image, attempts, null);
    }

    public static FetchOutcome empty(int attempts) {
        return new FetchOutcome(FetchStatus.EMPTY, null, attempts, null);
    }

    public static FetchOutcome notFound(int attempts) {
        return new FetchOutcome(FetchStatus.NOT_FOUND, null, attempts, null);
    }

    public static FetchOutcome transientFailure(int attempts, Throwable lastError) {
        return new FetchOutcome(FetchStatus.TRANSIENT_FAILURE, null, attempts, lastError);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == FetchStatus.TRANSIENT_FAILURE;
    }

    public Optional<TileImage> imageIfPresent() {
        return Optional.ofNullable(image);
    }
}
