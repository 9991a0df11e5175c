/**
 * Classification of a single transport round trip
 * - Collapses raw HTTP status codes into the cases the fetch loop acts on
 * - Lets the fetch executor decide between stopping and retrying without
 *   inspecting protocol details
 */
package net.tilefetch.model.fetch;

public enum TransportStatus {
    /**
     * Body received (HTTP 2xx other than 204)
     */
    SUCCESS,

    /**
     * Server explicitly answered with no body (HTTP 204)
     */
    NO_CONTENT,

    /**
     * Tile does not exist at the source (HTTP 404)
     */
    NOT_FOUND,

    /**
     * Any other 4xx answer
     */
    CLIENT_ERROR,

    /**
     * Connection, timeout, 5xx or otherwise retryable failure
     */
    TRANSIENT
}
