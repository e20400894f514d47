package com.storefront.catalog.dedup;

import com.storefront.catalog.model.CanonicalRecord;
import com.storefront.catalog.model.Store;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogClustererTest {

    private final CatalogClusterer clusterer = new CatalogClusterer();

    private static CanonicalRecord record(final Store store, final String name, final String uuid, final String href) {
        return CanonicalRecord.builder()
                .store(store)
                .name(name)
                .image("https://img.example.com/cover.png")
                .href(href)
                .uuid(uuid)
                .platforms(List.of())
                .build();
    }

    @Test
    void should_ShareKey_When_TitlesDifferOnlyByNoise() {
        assertThat(CanonicalKeys.of("Halo: Infinite – Deluxe Edition")).isEqualTo("haloinfinite");
        assertThat(CanonicalKeys.of("HALO INFINITE")).isEqualTo("haloinfinite");
        assertThat(CanonicalKeys.of("Pokémon Violet")).isEqualTo("pokmonviolet");
    }

    @Test
    void should_GroupAcrossStoresInFirstSeenOrder() {
        CanonicalRecord haloXbox = record(Store.XBOX, "Halo: Infinite – Deluxe Edition", "x1", "https://xbox.example.com/halo");
        CanonicalRecord tetris = record(Store.NINTENDO, "Tetris", "n1", "https://nintendo.example.com/tetris");
        CanonicalRecord haloSteam = record(Store.STEAM, "HALO INFINITE", "s1", "https://steam.example.com/halo");

        Map<String, List<CanonicalRecord>> clusters = clusterer.cluster(List.of(haloXbox, tetris, haloSteam));

        assertThat(clusters.keySet()).containsExactly("haloinfinite", "tetris");
        assertThat(clusters.get("haloinfinite")).containsExactly(haloXbox, haloSteam);
    }

    @Test
    void should_DropRepeatedListings_When_KeyAndIdentityMatch() {
        CanonicalRecord first = record(Store.NINTENDO, "Super Game", "7001", "https://nintendo.example.com/a");
        CanonicalRecord samePageAgain = record(Store.NINTENDO, "Super Game", "7001", "https://nintendo.example.com/a");
        CanonicalRecord deluxe = record(Store.NINTENDO, "Super Game Deluxe", "7002", "https://nintendo.example.com/b");
        CanonicalRecord noIdA = record(Store.NINTENDO, "Tetris", null, "https://nintendo.example.com/tetris");
        CanonicalRecord noIdB = record(Store.NINTENDO, "TETRIS", null, "https://nintendo.example.com/tetris");
        CanonicalRecord otherStore = record(Store.XBOX, "Super Game", "7001", "https://nintendo.example.com/a");

        List<CanonicalRecord> out = clusterer.collapseDuplicates(
                List.of(first, samePageAgain, deluxe, noIdA, noIdB, otherStore));

        assertThat(out).containsExactly(first, deluxe, noIdA, otherStore);
    }
}
