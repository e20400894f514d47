package com.storefront.catalog.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.catalog.exception.CatalogPipelineException;
import com.storefront.catalog.model.EndpointConfig;
import com.storefront.catalog.model.ExtractedItem;
import com.storefront.catalog.model.ItemSource;
import com.storefront.catalog.model.RawItem;
import com.storefront.catalog.parser.ApiItemLocator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * <h2>SearchApiPaginator</h2>
 *
 * <p>Walks a store's JSON search API: one query per token, each query paged
 * from index 0 until the {@link PaginationStopPolicy} reports the last page.
 * Queries and pages are fetched strictly one after the other, with a pause
 * between two pages and a longer one between two queries.</p>
 *
 * <p>A page that cannot be fetched or decoded ends its query with a WARN;
 * the remaining queries still run.</p>
 */
@Slf4j
public class SearchApiPaginator {

    private static final Map<String, String> JSON_HEADERS =
            Map.of(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

    /**
     * Paging parameters of one store.
     *
     * @param queryTokens tokens sent as {@code {query}}, one query each
     * @param pageSize    requested items per page
     * @param pageDelay   pause between two pages of a query
     * @param queryDelay  pause between two queries
     * @param pagination  whether pages beyond the first may be requested
     */
    public record Settings(List<String> queryTokens,
                           int pageSize,
                           Duration pageDelay,
                           Duration queryDelay,
                           boolean pagination) {

        public Settings {
            queryTokens = List.copyOf(queryTokens);
            if (pageSize < 1) {
                throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            }
        }
    }

    /** One fetched page. */
    private record Page(int index, List<ExtractedItem> items, boolean last) {
    }

    private final StoreHttpClient client;

    private final EndpointConfig endpoints;

    private final Settings settings;

    private final PaginationStopPolicy stopPolicy;

    private final Scheduler scheduler;

    public SearchApiPaginator(final StoreHttpClient client,
                              final EndpointConfig endpoints,
                              final Settings settings,
                              final PaginationStopPolicy stopPolicy,
                              final Scheduler scheduler) {
        this.client = client;
        this.endpoints = endpoints;
        this.settings = settings;
        this.stopPolicy = stopPolicy;
        this.scheduler = scheduler;
    }

    /**
     * @return API items of every query, in fetch order; empty when the store
     * has no search API
     */
    public Flux<ExtractedItem> items() {
        if (!endpoints.hasSearchApi()) {
            return Flux.empty();
        }
        return Flux.fromIterable(settings.queryTokens())
                .index()
                .concatMap(t -> t.getT1() == 0
                        ? query(t.getT2())
                        : Mono.delay(settings.queryDelay(), scheduler).thenMany(query(t.getT2())));
    }

    /**
     * @param token query token
     * @return items of every page of that query
     */
    Flux<ExtractedItem> query(final String token) {
        return fetchPage(token, 0)
                .expand(page -> page.last()
                        ? Mono.empty()
                        : Mono.delay(settings.pageDelay(), scheduler).then(fetchPage(token, page.index() + 1)))
                .concatMapIterable(Page::items);
    }

    private Mono<Page> fetchPage(final String token, final int index) {
        return Mono.defer(() -> {
            URI uri = endpoints.searchUri(token, settings.pageSize(), index)
                    .orElseThrow(() -> new IllegalStateException("no search API configured"));
            return client.fetchJson(uri, JSON_HEADERS)
                    .map(json -> toPage(uri, index, json))
                    .doOnNext(p -> log.debug("Query '{}' page {}: {} items", token, index, p.items().size()))
                    .onErrorResume(CatalogPipelineException.class, ex -> {
                        log.warn("Query '{}' stopped at page {}: {}", token, index, ex.getMessage());
                        return Mono.empty();
                    });
        });
    }

    private Page toPage(final URI uri, final int index, final JsonNode json) {
        List<JsonNode> located = ApiItemLocator.locate(json);
        List<ExtractedItem> items = located.stream()
                .map(n -> new ExtractedItem(RawItem.from(n), ItemSource.API, uri))
                .toList();
        boolean last = !settings.pagination() || stopPolicy.isLastPage(located.size(), settings.pageSize());
        return new Page(index, items, last);
    }
}
