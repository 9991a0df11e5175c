package net.tilefetch.exception;

/**
 * Base exception for failures while obtaining a tile from one source location.
 * Subclasses indicate specific failure types for retry decisions and logging.
 */
public abstract class TileFetchException extends RuntimeException {

    protected TileFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
