package com.storefront.catalog.config;

import com.storefront.catalog.model.AdapterConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the crawler configuration from <code>application.yml</code> under
 * the <code>catalog</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * catalog:
 *   country: US
 *   locale: en-US
 *   output-dir: ./out
 *   rate-limit:
 *     min-interval: 2s
 *   stores:
 *     nintendo:
 *       seed-pages:
 *         - https://www.nintendo.com/{localePath}/store/games
 * }</pre>
 */
@Component
@Validated
@ConfigurationProperties(prefix = "catalog")
@Getter
@Setter
public class CatalogProperties {

    /** Region code passed into every URL template. */
    @NotBlank
    private String country = "US";

    /** Language-region tag passed into every URL template. */
    @NotBlank
    private String locale = "en-US";

    /** Root directory receiving one sub-directory per store. */
    @NotNull
    private Path outputDir = Path.of("out");

    @Valid
    private Crawl crawl = new Crawl();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Fetch fetch = new Fetch();

    private Output output = new Output();

    /**
     * Store profiles keyed by store id, preserving declaration order.
     */
    @Valid
    private final Map<String, StoreProfile> stores = new LinkedHashMap<>();

    /**
     * @return the region of a run that does not override it
     */
    public AdapterConfig region() {
        return new AdapterConfig(country, locale);
    }

    @Data
    public static class Crawl {

        /** Crawl {@link #stores} once when the application starts. */
        private boolean onStartup = false;

        /** Stores crawled on startup. */
        private List<String> stores = new ArrayList<>();
    }

    @Data
    public static class RateLimit {

        /** Minimum spacing between two requests to the same domain. */
        @NotNull
        private Duration minInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class Fetch {

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Per-request response timeout. */
        private Duration responseTimeout = Duration.ofSeconds(30);

        @Min(1)
        private int maxConnections = 20;

        /** Listing pages routinely exceed the codec default of 256 KB. */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(16);

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
                + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";

        @Valid
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {

        /** Total attempts per request; 1 disables retrying. */
        @Min(1)
        private int maxAttempts = 1;

        private Duration waitDuration = Duration.ofSeconds(1);
    }

    @Data
    public static class Output {

        /** Indent the per-letter JSON files. */
        private boolean pretty = false;
    }
}
