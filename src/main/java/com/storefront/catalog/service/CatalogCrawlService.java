package com.storefront.catalog.service;

import com.storefront.catalog.dedup.CatalogClusterer;
import com.storefront.catalog.exception.UnknownStoreException;
import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.model.CanonicalRecord;
import com.storefront.catalog.service.core.CrawlSession;
import com.storefront.catalog.service.core.StoreAdapter;
import com.storefront.catalog.service.store.StoreAdapterRegistry;
import com.storefront.catalog.writer.CatalogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * <h2>CatalogCrawlService</h2>
 *
 * <p>Runs store crawls end to end: open a session, drain its records,
 * collapse duplicate pages, write the letter files, report.</p>
 *
 * <p>Stores are crawled concurrently and independently. A store that fails
 * is reported as {@link CrawlStatus#FAILED} and never cancels the others;
 * a name that resolves to no configured store is reported as
 * {@link CrawlStatus#SKIPPED}. Nothing is written for a store until its
 * record stream has completed.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogCrawlService {

    private final StoreAdapterRegistry registry;

    private final CatalogClusterer clusterer;

    private final CatalogWriter writer;

    /**
     * Crawls one store and writes its catalog under {@code outDir}.
     * The session is closed on completion, error and cancellation.
     *
     * @param adapter store to crawl
     * @param outDir  output root
     * @return the result; failures are reported, never signalled
     */
    public Mono<CrawlResult> crawl(final StoreAdapter adapter, final Path outDir) {
        String store = adapter.store().id();
        return Mono.defer(() -> {
            long started = System.nanoTime();
            log.info("Crawling {} (pagination: {}, partial prices: {})", store,
                    adapter.capabilities().pagination(), adapter.capabilities().returnsPartialPrice());
            return Flux.using(adapter::open, CrawlSession::iterateRecords, CrawlSession::close)
                    .collectList()
                    .publishOn(Schedulers.boundedElastic())
                    .map(records -> persist(adapter, outDir, records, started))
                    .onErrorResume(Exception.class, ex -> {
                        log.error("Crawl of {} failed", store, ex);
                        return Mono.just(CrawlResult.failed(store, ex, millisSince(started)));
                    });
        });
    }

    /**
     * Crawls several stores concurrently; results follow the order of
     * {@code storeNames}, repeated names are crawled once.
     *
     * @param storeNames store identifiers, case-insensitive
     * @param region     region of every adapter
     * @param outDir     output root
     * @return one result per distinct name
     */
    public Mono<List<CrawlResult>> crawlAll(final Collection<String> storeNames,
                                            final AdapterConfig region,
                                            final Path outDir) {
        return Flux.fromIterable(storeNames)
                .distinct(n -> n.trim().toLowerCase(Locale.ROOT))
                .flatMapSequential(name -> crawlNamed(name, region, outDir))
                .collectList();
    }

    private Mono<CrawlResult> crawlNamed(final String name, final AdapterConfig region, final Path outDir) {
        StoreAdapter adapter;
        try {
            adapter = registry.create(name, region);
        } catch (UnknownStoreException ex) {
            log.warn("Skipping store '{}': {}", name, ex.getMessage());
            return Mono.just(CrawlResult.skipped(name, ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Cannot set up store '{}'", name, ex);
            return Mono.just(CrawlResult.failed(name, ex, 0L));
        }
        return crawl(adapter, outDir);
    }

    private CrawlResult persist(final StoreAdapter adapter,
                                final Path outDir,
                                final List<CanonicalRecord> records,
                                final long started) {
        String store = adapter.store().id();
        List<CanonicalRecord> unique = clusterer.collapseDuplicates(records);
        int clusters = clusterer.cluster(unique).size();
        Path dir = writer.write(outDir, adapter.store(), unique);
        long elapsed = millisSince(started);
        log.info("Finished {}: {} records ({} duplicates dropped), {} titles, {} ms",
                store, unique.size(), records.size() - unique.size(), clusters, elapsed);
        return CrawlResult.completed(store, unique.size(), clusters, dir.toString(), elapsed);
    }

    private static long millisSince(final long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
