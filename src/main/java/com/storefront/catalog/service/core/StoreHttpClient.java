package com.storefront.catalog.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.exception.CatalogPipelineException;
import com.storefront.catalog.exception.DecodeException;
import com.storefront.catalog.exception.FetchException;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * <h2>StoreHttpClient</h2>
 *
 * <p>Single-GET fetch layer shared by every extraction strategy.</p>
 *
 * <ul>
 *   <li>Every request first waits for its domain slot at the
 *       {@link DomainRateLimiter}.</li>
 *   <li>Non-2xx responses, connection errors and timeouts surface as
 *       {@link FetchException}; a JSON body that does not parse surfaces as
 *       {@link DecodeException}.</li>
 *   <li>Nothing is retried unless a {@link Retry} policy is supplied, and
 *       that policy only ever sees {@link FetchException}s.</li>
 * </ul>
 */
@Slf4j
public class StoreHttpClient {

    private final WebClient webClient;

    private final DomainRateLimiter limiter;

    private final ObjectMapper mapper;

    @Nullable
    private final Retry retry;

    private final Map<String, String> defaultHeaders;

    public StoreHttpClient(final WebClient webClient,
                           final DomainRateLimiter limiter,
                           final ObjectMapper mapper,
                           @Nullable final Retry retry,
                           final Map<String, String> defaultHeaders) {
        this.webClient = webClient;
        this.limiter = limiter;
        this.mapper = mapper;
        this.retry = retry;
        this.defaultHeaders = Map.copyOf(defaultHeaders);
    }

    /**
     * Downloads a text resource, decoded with the charset of its
     * {@code Content-Type} (UTF-8 when none is declared).
     *
     * @param uri     absolute resource URI
     * @param headers request headers, overriding the defaults
     * @return the body, empty string for an empty body
     */
    public Mono<String> fetchText(final URI uri, final Map<String, String> headers) {
        return guarded(uri, get(uri, headers)
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    /**
     * Downloads and parses a JSON resource.
     *
     * @param uri     absolute resource URI
     * @param headers request headers, overriding the defaults
     * @return the parsed tree
     */
    public Mono<JsonNode> fetchJson(final URI uri, final Map<String, String> headers) {
        return guarded(uri, get(uri, headers)
                .bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(bytes -> decode(uri, bytes)));
    }

    private WebClient.ResponseSpec get(final URI uri, final Map<String, String> headers) {
        return webClient.get()
                .uri(uri)
                .headers(h -> {
                    defaultHeaders.forEach(h::set);
                    headers.forEach(h::set);
                })
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(),
                        resp -> Mono.error(new FetchException(uri, resp.statusCode().value())));
    }

    /**
     * Rate-limits, translates transport errors and applies the retry policy
     * around one request; the limiter is awaited again on every attempt.
     */
    private <T> Mono<T> guarded(final URI uri, final Mono<T> request) {
        Mono<T> attempt = limiter.acquire(uri.getHost())
                .then(request)
                .onErrorMap(ex -> !(ex instanceof CatalogPipelineException),
                        ex -> new FetchException(uri, ex));
        if (retry != null) {
            attempt = attempt.transformDeferred(RetryOperator.of(retry));
        }
        return attempt.doOnError(ex -> log.debug("GET {} failed: {}", uri, ex.toString()));
    }

    private JsonNode decode(final URI uri, final byte[] bytes) {
        if (bytes.length == 0) {
            throw new DecodeException(uri, new IOException("empty body"));
        }
        try {
            return mapper.readTree(bytes);
        } catch (IOException ex) {
            throw new DecodeException(uri, ex);
        }
    }
}
