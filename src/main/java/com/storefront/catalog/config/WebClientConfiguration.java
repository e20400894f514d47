package com.storefront.catalog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Base {@link WebClient.Builder} for storefront requests.
 * <p>
 * No connector is set here: every crawl run clones the builder and plugs
 * in a connection pool of its own, disposed when the run ends.
 * </p>
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("catalogObjectMapper") final ObjectMapper mapper,
                                              final CatalogProperties properties) {

        int maxInMemory = (int) properties.getFetch().getMaxInMemorySize().toBytes();

        /* --- JSON codecs wired to the catalog ObjectMapper ----------------- */
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> {
                    cfg.defaultCodecs()
                            .jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs()
                            .jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    cfg.defaultCodecs().maxInMemorySize(maxInMemory);
                })
                .build();

        return WebClient.builder()
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().contentType().orElse(null));
            return Mono.just(res);
        });
    }
}
