package com.storefront.catalog.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.model.Store;
import io.github.resilience4j.retry.Retry;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;
import java.util.Map;

/**
 * Opens one pooled {@link StoreHttpClient} per crawl run.
 */
@Slf4j
@Component
public class StoreHttpClientFactory {

    private static final Duration POOL_ACQUIRE_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient.Builder builder;

    private final DomainRateLimiter limiter;

    private final ObjectMapper mapper;

    private final Retry fetchRetry;

    private final CatalogProperties.Fetch fetch;

    public StoreHttpClientFactory(final WebClient.Builder builder,
                                  final DomainRateLimiter limiter,
                                  @Qualifier("catalogObjectMapper") final ObjectMapper mapper,
                                  final Retry fetchRetry,
                                  final CatalogProperties properties) {
        this.builder = builder;
        this.limiter = limiter;
        this.mapper = mapper;
        this.fetchRetry = fetchRetry;
        this.fetch = properties.getFetch();
    }

    /**
     * @param store  store the run crawls, names the pool
     * @param region region of the run, sets {@code Accept-Language}
     * @return a lease the caller must close when the run ends
     */
    public HttpClientLease open(final Store store, final AdapterConfig region) {
        ConnectionProvider pool = ConnectionProvider.builder("catalog-" + store.id())
                .maxConnections(fetch.getMaxConnections())
                .pendingAcquireTimeout(POOL_ACQUIRE_TIMEOUT)
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .compress(true)
                .followRedirect(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.getConnectTimeout().toMillis())
                .responseTimeout(fetch.getResponseTimeout())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG,
                        AdvancedByteBufFormat.TEXTUAL);

        WebClient client = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();

        Map<String, String> headers = Map.of(
                HttpHeaders.USER_AGENT, fetch.getUserAgent(),
                HttpHeaders.ACCEPT_LANGUAGE, region.locale() + ",en;q=0.5");

        log.debug("Opened HTTP pool catalog-{} (max {} connections)", store.id(), fetch.getMaxConnections());
        return new HttpClientLease(new StoreHttpClient(client, limiter, mapper, fetchRetry, headers), pool);
    }
}
