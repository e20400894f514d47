package com.storefront.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the storefront catalog crawler.
 *
 * <p>The application crawls digital game storefronts and writes one
 * letter-bucketed JSON catalog per store. A crawl is started either with
 * <code>POST /api/crawl</code> or, with
 * <code>catalog.crawl.on-startup=true</code>, once at startup for the
 * stores listed under <code>catalog.crawl.stores</code>.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run -Dspring-boot.run.arguments="--catalog.crawl.on-startup=true --catalog.crawl.stores=nintendo"
 * }</pre>
 */
@SpringBootApplication
public class CatalogCrawlerApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(CatalogCrawlerApplication.class, args);
    }
}
