package com.storefront.catalog.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.exception.DecodeException;
import com.storefront.catalog.exception.FetchException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StoreHttpClientTest {

    private static final URI API = URI.create("https://api.example.com/search?q=a");

    private static final Map<String, String> DEFAULT_HEADERS = Map.of(
            HttpHeaders.USER_AGENT, "catalog-test",
            HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");

    private static ClientResponse response(final HttpStatus status, final MediaType type, final String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, type.toString())
                .body(body)
                .build();
    }

    private static StoreHttpClient client(final ExchangeFunction exchange, final Retry retry) {
        WebClient web = WebClient.builder().exchangeFunction(exchange).build();
        DomainRateLimiter unpaced = new DomainRateLimiter(Duration.ZERO, Schedulers.immediate());
        return new StoreHttpClient(web, unpaced, new ObjectMapper(), retry, DEFAULT_HEADERS);
    }

    @Test
    void should_ParseJson_When_ResponseIsValid() {
        StoreHttpClient client = client(req -> Mono.just(
                response(HttpStatus.OK, MediaType.APPLICATION_JSON, "{\"products\":[{\"title\":\"Tetris\"}]}")), null);

        StepVerifier.create(client.fetchJson(API, Map.of()))
                .assertNext(json -> assertThat(json.at("/products/0/title").asText()).isEqualTo("Tetris"))
                .verifyComplete();
    }

    @Test
    void should_RaiseDecodeException_When_JsonIsMalformed() {
        StoreHttpClient client = client(req -> Mono.just(
                response(HttpStatus.OK, MediaType.APPLICATION_JSON, "{\"products\": [")), null);

        StepVerifier.create(client.fetchJson(API, Map.of()))
                .expectErrorSatisfies(ex -> assertThat(ex)
                        .isInstanceOf(DecodeException.class)
                        .hasMessageContaining(API.toString()))
                .verify();
    }

    @Test
    void should_RaiseFetchExceptionWithStatus_When_ResponseIsNot2xx() {
        StoreHttpClient client = client(req -> Mono.just(
                response(HttpStatus.NOT_FOUND, MediaType.TEXT_HTML, "<h1>gone</h1>")), null);

        StepVerifier.create(client.fetchText(API, Map.of()))
                .expectErrorSatisfies(ex -> {
                    assertThat(ex).isInstanceOf(FetchException.class);
                    assertThat(((FetchException) ex).getStatus()).isEqualTo(404);
                    assertThat(((FetchException) ex).getUri()).isEqualTo(API);
                })
                .verify();
    }

    @Test
    void should_RaiseFetchException_When_TransportFails() {
        StoreHttpClient client = client(req -> Mono.error(new IOException("connection reset")), null);

        StepVerifier.create(client.fetchText(API, Map.of()))
                .expectErrorSatisfies(ex -> {
                    assertThat(ex).isInstanceOf(FetchException.class).hasRootCauseInstanceOf(IOException.class);
                    assertThat(((FetchException) ex).getStatus()).isEqualTo(-1);
                })
                .verify();
    }

    @Test
    void should_SendDefaultHeaders_When_CallDoesNotOverrideThem() {
        List<ClientRequest> seen = new CopyOnWriteArrayList<>();
        StoreHttpClient client = client(req -> {
            seen.add(req);
            return Mono.just(response(HttpStatus.OK, MediaType.TEXT_HTML, "<html>Pokémon</html>"));
        }, null);

        StepVerifier.create(client.fetchText(API, Map.of(HttpHeaders.ACCEPT_LANGUAGE, "fr-FR")))
                .expectNext("<html>Pokémon</html>")
                .verifyComplete();

        HttpHeaders headers = seen.get(0).headers();
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("catalog-test");
        assertThat(headers.get(HttpHeaders.ACCEPT_LANGUAGE)).containsExactly("fr-FR");
    }

    @Test
    void should_RetryFetchFailuresOnly_When_RetryPolicyIsSet() {
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(FetchException.class)
                .build());

        AtomicInteger calls = new AtomicInteger();
        StoreHttpClient flaky = client(req -> Mono.just(calls.incrementAndGet() < 3
                ? response(HttpStatus.SERVICE_UNAVAILABLE, MediaType.TEXT_PLAIN, "busy")
                : response(HttpStatus.OK, MediaType.APPLICATION_JSON, "{\"items\":[]}")), retry);

        StepVerifier.create(flaky.fetchJson(API, Map.of()))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(calls).hasValue(3);

        AtomicInteger decodeCalls = new AtomicInteger();
        StoreHttpClient broken = client(req -> {
            decodeCalls.incrementAndGet();
            return Mono.just(response(HttpStatus.OK, MediaType.APPLICATION_JSON, "not json"));
        }, retry);

        StepVerifier.create(broken.fetchJson(API, Map.of()))
                .expectError(DecodeException.class)
                .verify();
        assertThat(decodeCalls).hasValue(1);
    }
}
