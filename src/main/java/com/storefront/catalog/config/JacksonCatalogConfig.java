package com.storefront.catalog.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonCatalogConfig {

    /**
     * The {@link ObjectMapper} shared by the crawl pipeline.
     * <p>
     * • Reads storefront payloads leniently: unknown fields are expected,
     *   scraped JSON is walked as a tree rather than bound to classes.<br>
     * • Writes the catalog files and the crawl reports.
     *
     * @return ObjectMapper for the catalog pipeline
     */
    @Bean
    @Qualifier("catalogObjectMapper")
    public ObjectMapper catalogObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
