package com.storefront.catalog.controller;

import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.dto.CrawlRequest;
import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.service.CatalogCrawlService;
import com.storefront.catalog.service.CrawlResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST controller that starts crawl runs.
 * <p>
 * Endpoint: <code>POST /api/crawl</code><br>
 * Consumes: <code>application/json</code><br>
 * Produces: <code>application/json</code>
 * </p>
 *
 * <h3>Example Request</h3>
 * <pre>{@code
 * POST /api/crawl
 * Content-Type: application/json
 *
 * {
 *   "stores": ["nintendo", "steam"],
 *   "country": "US",
 *   "locale": "en-US"
 * }
 * }</pre>
 *
 * <h3>Example Response</h3>
 * <pre>{@code
 * [
 *   { "store": "nintendo", "status": "COMPLETED", "recordCount": 412, "clusterCount": 398,
 *     "outputDir": "out/nintendo", "elapsedMillis": 61234 },
 *   { "store": "steam", "status": "SKIPPED", "recordCount": 0, "clusterCount": 0,
 *     "error": "Store steam unavailable: disabled by configuration", "elapsedMillis": 0 }
 * ]
 * }</pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/crawl")
@RequiredArgsConstructor
public class CrawlController {

    private final CatalogCrawlService crawlService;

    private final CatalogProperties properties;

    /**
     * Crawls the requested stores and answers once every store has finished.
     *
     * @param request stores and optional region override
     * @return one result per distinct store name, in request order
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<CrawlResult>> crawl(@RequestBody @Validated final CrawlRequest request) {
        AdapterConfig region = new AdapterConfig(
                StringUtils.defaultIfBlank(request.country(), properties.getCountry()),
                StringUtils.defaultIfBlank(request.locale(), properties.getLocale()));
        return crawlService.crawlAll(request.stores(), region, properties.getOutputDir());
    }

    /**
     * @param ex the exception containing the error details
     * @return a {@link ResponseEntity} with HTTP 400 and a JSON body {"error": "..."}
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(final IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", String.valueOf(ex.getMessage())));
    }
}
