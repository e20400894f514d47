package com.storefront.catalog.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.lang.Nullable;

/**
 * Summary of one store's crawl.
 *
 * @param store         store identifier as requested
 * @param status        outcome
 * @param recordCount   records written after duplicate collapsing
 * @param clusterCount  distinct canonical titles among those records
 * @param outputDir     directory holding the letter files, when written
 * @param error         failure or skip reason
 * @param elapsedMillis wall time of the crawl
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlResult(String store,
                          CrawlStatus status,
                          int recordCount,
                          int clusterCount,
                          @Nullable String outputDir,
                          @Nullable String error,
                          long elapsedMillis) {

    public static CrawlResult completed(final String store, final int records, final int clusters,
                                        final String outputDir, final long elapsedMillis) {
        return new CrawlResult(store, CrawlStatus.COMPLETED, records, clusters, outputDir, null, elapsedMillis);
    }

    public static CrawlResult skipped(final String store, final String reason) {
        return new CrawlResult(store, CrawlStatus.SKIPPED, 0, 0, null, reason, 0);
    }

    public static CrawlResult failed(final String store, final Throwable cause, final long elapsedMillis) {
        return new CrawlResult(store, CrawlStatus.FAILED, 0, 0, null, cause.toString(), elapsedMillis);
    }
}
