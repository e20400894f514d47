package com.storefront.catalog.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.service.core.DomainRateLimiter;
import com.storefront.catalog.service.core.StoreHttpClient;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory storefront answering GETs from canned bodies; unknown URLs answer 404.
 */
public final class StubStorefront {

    private final Map<URI, String> html = new ConcurrentHashMap<>();

    private final Map<URI, String> json = new ConcurrentHashMap<>();

    private final List<URI> requested = new CopyOnWriteArrayList<>();

    public StubStorefront page(final String uri, final String body) {
        html.put(URI.create(uri), body);
        return this;
    }

    public StubStorefront api(final String uri, final String body) {
        json.put(URI.create(uri), body);
        return this;
    }

    public List<URI> requested() {
        return requested;
    }

    public StoreHttpClient client() {
        WebClient web = WebClient.builder()
                .exchangeFunction(req -> {
                    URI uri = req.url();
                    requested.add(uri);
                    if (json.containsKey(uri)) {
                        return Mono.just(respond(HttpStatus.OK, MediaType.APPLICATION_JSON, json.get(uri)));
                    }
                    if (html.containsKey(uri)) {
                        return Mono.just(respond(HttpStatus.OK, MediaType.TEXT_HTML, html.get(uri)));
                    }
                    return Mono.just(respond(HttpStatus.NOT_FOUND, MediaType.TEXT_PLAIN, "not found"));
                })
                .build();
        return new StoreHttpClient(web, new DomainRateLimiter(Duration.ZERO, Schedulers.immediate()),
                new ObjectMapper(), null, Map.of(HttpHeaders.USER_AGENT, "catalog-test"));
    }

    private static ClientResponse respond(final HttpStatus status, final MediaType type, final String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, type.toString() + ";charset=UTF-8")
                .body(body)
                .build();
    }

    /**
     * @param body script contents
     * @return a listing page carrying {@code body} as embedded page state
     */
    public static String withEmbedded(final String body) {
        return "<html><body><script id=\"__NEXT_DATA__\" type=\"application/json\">" + body + "</script></body></html>";
    }

    /**
     * @param embedded embedded page state
     * @param ldJson   JSON-LD block
     * @return a listing page carrying both payloads
     */
    public static String withBoth(final String embedded, final String ldJson) {
        return "<html><head><script type=\"application/ld+json\">" + ldJson + "</script></head>"
                + "<body><script id=\"__NEXT_DATA__\" type=\"application/json\">" + embedded + "</script></body></html>";
    }
}
