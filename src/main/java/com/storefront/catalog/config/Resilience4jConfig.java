package com.storefront.catalog.config;

import com.storefront.catalog.exception.FetchException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * The crawl pipeline itself never retries: a failed page is skipped and the
 * crawl moves on. A retry policy can still be layered under the fetch layer
 * through {@code catalog.fetch.retry.*}; with the default of one attempt the
 * policy is a pass-through.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link RetryRegistry} which holds all configured
     * {@link Retry} instances.
     *
     * @return a registry pre‐populated with default retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Defines the named {@link Retry} policy applied to storefront requests.
     * <p>
     * Only {@link FetchException}s are retried: a body that is not JSON will
     * not become JSON on a second attempt.
     * </p>
     *
     * @param registry   the global {@link RetryRegistry} to register with
     * @param properties crawler configuration
     * @return a {@link Retry} registered under the name "storefrontFetch"
     */
    @Bean
    public Retry fetchRetry(final RetryRegistry registry, final CatalogProperties properties) {
        CatalogProperties.Retry cfg = properties.getFetch().getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(cfg.getMaxAttempts())
                .waitDuration(cfg.getWaitDuration())
                .retryExceptions(FetchException.class)
                .build();
        return registry.retry("storefrontFetch", config);
    }

}
