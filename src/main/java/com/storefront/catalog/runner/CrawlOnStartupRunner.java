package com.storefront.catalog.runner;

import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.service.CatalogCrawlService;
import com.storefront.catalog.service.CrawlResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Crawls {@code catalog.crawl.stores} once when the application starts.
 * Active only with {@code catalog.crawl.on-startup=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "catalog.crawl", name = "on-startup", havingValue = "true")
public class CrawlOnStartupRunner implements ApplicationRunner {

    private final CatalogCrawlService crawlService;

    private final CatalogProperties properties;

    @Override
    public void run(final ApplicationArguments args) {
        List<String> stores = properties.getCrawl().getStores();
        if (stores.isEmpty()) {
            log.warn("catalog.crawl.on-startup is set but catalog.crawl.stores is empty");
            return;
        }
        List<CrawlResult> results = crawlService
                .crawlAll(stores, properties.region(), properties.getOutputDir())
                .block();
        if (results != null) {
            results.forEach(r -> log.info("{}: {} ({} records, {} titles){}",
                    r.store(), r.status(), r.recordCount(), r.clusterCount(),
                    r.error() == null ? "" : " - " + r.error()));
        }
    }
}
