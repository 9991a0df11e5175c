package net.tilefetch.model.fetch;

import java.util.Arrays;

/**
 * Result of one transport call.
 *
 * @param body response body, {@code null} unless the call succeeded
 * @param status classified outcome
 * @param httpStatus raw status code, or {@code -1} when no response was received
 * @param error cause for failed calls, may be {@code null}
 */
public record TransportResponse(byte[] body, TransportStatus status, int httpStatus, Throwable error) {

    public static final int NO_HTTP_STATUS = -1;

    public TransportResponse {
        if (body != null) {
            body = Arrays.copyOf(body, body.length);
        }
    }

    public static TransportResponse success(byte[] body, int httpStatus) {
        return new TransportResponse(body, TransportStatus.SUCCESS, httpStatus, null);
    }

    public static TransportResponse noContent() {
        return new TransportResponse(null, TransportStatus.NO_CONTENT, 204, null);
    }

    public static TransportResponse notFound() {
        return new TransportResponse(null, TransportStatus.NOT_FOUND, 404, null);
    }

    public static TransportResponse clientError(int httpStatus) {
        return new TransportResponse(null, TransportStatus.CLIENT_ERROR, httpStatus, null);
    }

    public static TransportResponse transientFailure(int httpStatus, Throwable error) {
        return new TransportResponse(null, TransportStatus.TRANSIENT, httpStatus, error);
    }

    public static TransportResponse transientFailure(Throwable error) {
        return transientFailure(NO_HTTP_STATUS, error);
    }

    @Override
    public byte[] body() {
        return body == null ? null : Arrays.copyOf(body, body.length);
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }
}
