package com.storefront.catalog.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file from the working directory and adds its entries
 * as a high-priority property source, so that `CATALOG_COUNTRY=CA` or
 * `CATALOG_CRAWL_STORES=nintendo,psn` configure a run without touching
 * application.yml.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "catalogDotenv";

    /** highest precedence so .env entries override everything else */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env,
                                       SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(".env")
                .ignoreIfMissing()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));
        if (map.isEmpty()) {
            return;
        }

        // environment-style source: CATALOG_OUTPUT_DIR binds to catalog.output-dir
        env.getPropertySources()
                .addFirst(new SystemEnvironmentPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}
