package net.tilefetch.service.transport;

import net.tilefetch.model.SourceLocation;
import net.tilefetch.model.fetch.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link TileTransport} backed by the shared reactive {@link WebClient}.
 *
 * <p>Each call is blocking from the caller's point of view (the fetch executor
 * already runs on a worker thread) and bounded by the supplied timeout. Status
 * codes are classified here so nothing above this class deals with HTTP.</p>
 */
@Component
public class WebClientTileTransport implements TileTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientTileTransport.class);

    private final WebClient webClient;

    public WebClientTileTransport(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public TransportResponse fetch(SourceLocation location, Duration timeout) {
        try {
            TransportResponse response = webClient.get()
                .uri(location.uri())
                .header(HttpHeaders.CACHE_CONTROL, CacheControl.noCache().getHeaderValue())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .exchangeToMono(WebClientTileTransport::classify)
                .timeout(timeout)
                .block();
            if (response == null) {
                return TransportResponse.transientFailure(
                    new IllegalStateException("Transport completed without a response for " + location));
            }
            return response;
        } catch (RuntimeException ex) {
            // block() wraps checked failures such as TimeoutException
            Throwable cause = Exceptions.unwrap(ex);
            log.debug("Transport failure for {} (timeout {} ms): {}", location, timeout.toMillis(), cause.toString());
            return TransportResponse.transientFailure(cause);
        }
    }

    static Mono<TransportResponse> classify(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        int code = status.value();

        if (code == HttpStatus.NO_CONTENT.value()) {
            return response.releaseBody().thenReturn(TransportResponse.noContent());
        }
        if (code == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().thenReturn(TransportResponse.notFound());
        }
        if (status.is2xxSuccessful()) {
            return response.bodyToMono(byte[].class)
                .map(body -> TransportResponse.success(body, code))
                .defaultIfEmpty(TransportResponse.success(new byte[0], code));
        }
        if (status.is4xxClientError()) {
            return response.releaseBody().thenReturn(TransportResponse.clientError(code));
        }
        return response.createException()
            .map(ex -> TransportResponse.transientFailure(code, ex));
    }
}
