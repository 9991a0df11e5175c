package net.tilefetch.exception;

/**
 * A tile source is used without being configured for it: the base source was asked to resolve
 * locations without a subclass providing them, or its templates are malformed.
 * RETRYABLE: No (programmer or configuration error)
 */
public class TileSourceConfigurationException extends IllegalStateException {
    public TileSourceConfigurationException(String message) {
        super(message);
    }

    public TileSourceConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
