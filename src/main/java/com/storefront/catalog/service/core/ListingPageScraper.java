package com.storefront.catalog.service.core;

import com.storefront.catalog.exception.CatalogPipelineException;
import com.storefront.catalog.exception.ParseException;
import com.storefront.catalog.model.ExtractedItem;
import com.storefront.catalog.parser.ItemCoercer;
import com.storefront.catalog.parser.ListingPageParser;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <h2>ListingPageScraper</h2>
 *
 * <p>Scrapes listing pages one by one: each page is fetched, parsed with
 * jsoup and handed to every {@link ListingPageParser}. The items of all
 * parsers are concatenated, coerced to the API field names and emitted in
 * page order.</p>
 *
 * <ul>
 *   <li>A page that cannot be fetched is skipped with a WARN.</li>
 *   <li>A parser that fails on a page contributes nothing for that page;
 *       the other parsers still run.</li>
 * </ul>
 */
@Slf4j
public class ListingPageScraper {

    private static final Map<String, String> HTML_HEADERS =
            Map.of(HttpHeaders.ACCEPT, MediaType.TEXT_HTML_VALUE + ",application/xhtml+xml;q=0.9,*/*;q=0.8");

    private final StoreHttpClient client;

    private final List<ListingPageParser> parsers;

    private final ItemCoercer coercer;

    private final Duration seedPageDelay;

    private final Scheduler scheduler;

    public ListingPageScraper(final StoreHttpClient client,
                              final List<ListingPageParser> parsers,
                              final ItemCoercer coercer,
                              final Duration seedPageDelay,
                              final Scheduler scheduler) {
        this.client = client;
        this.parsers = List.copyOf(parsers);
        this.coercer = coercer;
        this.seedPageDelay = seedPageDelay;
        this.scheduler = scheduler;
    }

    /**
     * @param seedPages listing pages in crawl order
     * @return coerced items of every page
     */
    public Flux<ExtractedItem> items(final List<URI> seedPages) {
        return Flux.fromIterable(seedPages)
                .index()
                .concatMap(t -> t.getT1() == 0
                        ? scrape(t.getT2())
                        : Mono.delay(seedPageDelay, scheduler).thenMany(scrape(t.getT2())));
    }

    /**
     * @param page listing page URL
     * @return coerced items of that page; empty when the page cannot be fetched
     */
    Flux<ExtractedItem> scrape(final URI page) {
        return client.fetchText(page, HTML_HEADERS)
                .map(html -> extract(page, Jsoup.parse(html, page.toString())))
                .onErrorResume(CatalogPipelineException.class, ex -> {
                    log.warn("Skipping listing page {}: {}", page, ex.getMessage());
                    return Mono.empty();
                })
                .flatMapIterable(items -> items);
    }

    /**
     * Runs every parser over one parsed page.
     *
     * @param page     URL the document was loaded from
     * @param document parsed page
     * @return coerced items, parser by parser in registration order
     */
    List<ExtractedItem> extract(final URI page, final Document document) {
        List<ExtractedItem> out = new ArrayList<>();
        for (ListingPageParser parser : parsers) {
            try {
                int before = out.size();
                parser.parse(document).forEach(raw ->
                        out.add(new ExtractedItem(coercer.coerce(raw), parser.source(), page)));
                log.debug("{} parser found {} items on {}", parser.source().label(), out.size() - before, page);
            } catch (ParseException ex) {
                log.warn("{} parser failed on {}: {}", parser.source().label(), page, ex.getMessage());
            }
        }
        return out;
    }
}
