package com.storefront.catalog.model;

import com.storefront.catalog.exception.UnknownStoreException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndpointConfigTest {

    private static final AdapterConfig REGION = new AdapterConfig("US", "en_US");

    @Test
    void should_ExpandRegionPlaceholders_When_BuildingSeedPages() {
        EndpointConfig cfg = EndpointConfig.of(null,
                List.of("https://www.nintendo.com/{localePath}/store/games",
                        "https://store.example.com/browse?cc={country}&l={locale}"),
                REGION);

        assertThat(cfg.seedPages()).containsExactly(
                URI.create("https://www.nintendo.com/en-us/store/games"),
                URI.create("https://store.example.com/browse?cc=US&l=en_US"));
        assertThat(cfg.hasSearchApi()).isFalse();
        assertThat(cfg.searchUri("a", 60, 0)).isEmpty();
    }

    @Test
    void should_FillQueryAndPage_When_BuildingSearchUri() {
        EndpointConfig cfg = EndpointConfig.of(
                "https://api.example.com/search?q={query}&count={count}&page={page}&country={country}",
                List.of(), AdapterConfig.DEFAULT);

        assertThat(cfg.searchUri("zelda & link", 60, 2)).contains(
                URI.create("https://api.example.com/search?q=zelda%20%26%20link&count=60&page=2&country=US"));
    }

    @Test
    void should_TreatBlankTemplateAsNoApi() {
        assertThat(EndpointConfig.of("  ", List.of(), AdapterConfig.DEFAULT).hasSearchApi()).isFalse();
    }

    @Test
    void should_DeriveLocalePath() {
        assertThat(new AdapterConfig("US", "en-US").localePath()).isEqualTo("en-us");
        assertThat(REGION.localePath()).isEqualTo("en-us");
    }

    @Test
    void should_ResolveStoresIgnoringCase_When_NameIsKnown() {
        assertThat(Store.fromId(" Nintendo ")).isEqualTo(Store.NINTENDO);
        assertThatThrownBy(() -> Store.fromId("gog"))
                .isInstanceOf(UnknownStoreException.class)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gog");
    }
}
