package com.storefront.catalog.runner;

import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.service.CatalogCrawlService;
import com.storefront.catalog.service.CrawlResult;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CrawlOnStartupRunnerTest {

    @Test
    void should_CrawlConfiguredStores() {
        CatalogCrawlService service = mock(CatalogCrawlService.class);
        CatalogProperties properties = new CatalogProperties();
        properties.getCrawl().setStores(List.of("nintendo", "gog"));
        when(service.crawlAll(anyCollection(), any(), any())).thenReturn(Mono.just(List.of(
                CrawlResult.completed("nintendo", 3, 3, "out/nintendo", 10),
                CrawlResult.skipped("gog", "Unknown store: gog"))));

        new CrawlOnStartupRunner(service, properties).run(new DefaultApplicationArguments());

        verify(service).crawlAll(eq(List.of("nintendo", "gog")), eq(properties.region()), eq(properties.getOutputDir()));
    }

    @Test
    void should_DoNothing_When_NoStoresAreListed() {
        CatalogCrawlService service = mock(CatalogCrawlService.class);

        new CrawlOnStartupRunner(service, new CatalogProperties()).run(new DefaultApplicationArguments());

        verifyNoInteractions(service);
    }
}
