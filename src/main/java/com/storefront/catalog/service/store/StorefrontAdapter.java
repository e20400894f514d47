package com.storefront.catalog.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.config.StoreProfile;
import com.storefront.catalog.exception.UnknownStoreException;
import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.model.CanonicalRecord;
import com.storefront.catalog.model.Capabilities;
import com.storefront.catalog.model.EndpointConfig;
import com.storefront.catalog.model.Store;
import com.storefront.catalog.normalize.RecordNormalizer;
import com.storefront.catalog.normalize.StoreDefaults;
import com.storefront.catalog.parser.EmbeddedDataParser;
import com.storefront.catalog.parser.ItemCoercer;
import com.storefront.catalog.parser.LinkedDataParser;
import com.storefront.catalog.parser.ListingPageParser;
import com.storefront.catalog.service.core.CrawlSession;
import com.storefront.catalog.service.core.HttpClientLease;
import com.storefront.catalog.service.core.ListingPageScraper;
import com.storefront.catalog.service.core.PaginationStopPolicy;
import com.storefront.catalog.service.core.SearchApiPaginator;
import com.storefront.catalog.service.core.StoreAdapter;
import com.storefront.catalog.service.core.StoreHttpClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <h2>StorefrontAdapter</h2>
 *
 * <p>Generic {@link StoreAdapter} driven by a {@link StoreProfile}. A crawl
 * run first walks the store's search API (when one is configured) and then
 * scrapes its listing pages; every item of both strategies goes through the
 * same {@link RecordNormalizer}.</p>
 *
 * <p>Endpoints, store fallbacks and paging parameters are resolved once, when
 * the adapter is built, so a misconfigured profile fails before any request
 * is sent.</p>
 */
@Slf4j
public class StorefrontAdapter implements StoreAdapter {

    private final Store store;

    private final Capabilities capabilities;

    private final EndpointConfig endpoints;

    private final StoreDefaults defaults;

    private final SearchApiPaginator.Settings paging;

    private final Duration seedPageDelay;

    private final List<ListingPageParser> parsers;

    private final StoreHttpClientFactory clientFactory;

    private final ItemCoercer coercer;

    private final RecordNormalizer normalizer;

    private final PaginationStopPolicy stopPolicy;

    private final Scheduler scheduler;

    /**
     * @throws UnknownStoreException if the profile lacks a placeholder image or store root URL
     */
    public StorefrontAdapter(final Store store,
                             final StoreProfile profile,
                             final AdapterConfig region,
                             final Collaborators collaborators) {
        requireSetting(store, "placeholder-image", profile.getPlaceholderImage());
        requireSetting(store, "store-root-url", profile.getStoreRootUrl());

        this.store = store;
        this.capabilities = new Capabilities(profile.isPagination(), profile.isReturnsPartialPrice());
        this.endpoints = EndpointConfig.of(profile.getSearchApi(), profile.getSeedPages(), region);
        this.defaults = new StoreDefaults(
                store,
                region,
                profile.getPlaceholderImage(),
                StringUtils.trimToNull(profile.getProductUrlTemplate()),
                EndpointConfig.expandRegion(profile.getStoreRootUrl(), region).toString(),
                profile.getDefaultPlatforms(),
                capabilities.returnsPartialPrice());
        this.paging = new SearchApiPaginator.Settings(
                profile.getQueryTokens(),
                profile.getPageSize(),
                profile.getPageDelay(),
                profile.getQueryDelay(),
                capabilities.pagination());
        this.seedPageDelay = profile.getSeedPageDelay();
        this.parsers = List.of(
                new EmbeddedDataParser(collaborators.mapper(), profile.getEmbeddedScriptId()),
                new LinkedDataParser(collaborators.mapper()));
        this.clientFactory = collaborators.clientFactory();
        this.coercer = collaborators.coercer();
        this.normalizer = collaborators.normalizer();
        this.stopPolicy = collaborators.stopPolicy();
        this.scheduler = collaborators.scheduler();
    }

    @Override
    public Store store() {
        return store;
    }

    @Override
    public Capabilities capabilities() {
        return capabilities;
    }

    EndpointConfig endpoints() {
        return endpoints;
    }

    @Override
    public CrawlSession open() {
        log.debug("Opening {} session ({} seed pages, search API {})",
                store.id(), endpoints.seedPages().size(), endpoints.hasSearchApi() ? "on" : "off");
        return new Session(clientFactory.open(store, endpoints.region()));
    }

    private static void requireSetting(final Store store, final String key, final String value) {
        if (StringUtils.isBlank(value)) {
            throw new UnknownStoreException(store.id(), "catalog.stores." + store.id() + "." + key + " is not set");
        }
    }

    /**
     * Shared components every adapter is assembled from.
     *
     * @param clientFactory opens the per-run fetch layer
     * @param mapper        JSON reader of the page parsers
     * @param coercer       maps scraped items onto API field names
     * @param normalizer    turns items into records
     * @param stopPolicy    decides when a search query is exhausted
     * @param scheduler     runs pacing delays
     */
    public record Collaborators(StoreHttpClientFactory clientFactory,
                                ObjectMapper mapper,
                                ItemCoercer coercer,
                                RecordNormalizer normalizer,
                                PaginationStopPolicy stopPolicy,
                                Scheduler scheduler) {
    }

    /* ------------------------------------------------------------------ */
    /* one crawl run                                                      */
    /* ------------------------------------------------------------------ */

    private final class Session implements CrawlSession {

        private final HttpClientLease lease;

        private final AtomicBoolean closed = new AtomicBoolean();

        private Session(final HttpClientLease lease) {
            this.lease = lease;
        }

        @Override
        public Flux<CanonicalRecord> iterateRecords() {
            SearchApiPaginator api = new SearchApiPaginator(lease.client(), endpoints, paging, stopPolicy, scheduler);
            ListingPageScraper pages = new ListingPageScraper(lease.client(), parsers, coercer, seedPageDelay, scheduler);
            return Flux.concat(api.items(), pages.items(endpoints.seedPages()))
                    .mapNotNull(item -> normalizer.normalize(item, defaults).orElse(null));
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                lease.close();
                log.debug("Closed {} session", store.id());
            }
        }
    }
}
