package com.storefront.catalog.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalRecordTest {

    private static CanonicalRecord.CanonicalRecordBuilder base() {
        return CanonicalRecord.builder()
                .store(Store.NINTENDO)
                .name("Super Game")
                .price("$29.99")
                .image("https://assets.example.com/super-game.png")
                .href("https://www.nintendo.com/en-us/store/products/super-game/")
                .platforms(List.of("Switch"));
    }

    @Test
    void should_Reject_When_NameIsBlank() {
        assertThatThrownBy(() -> base().name("   ").build())
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> base().name(null).build())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void should_Reject_When_UrlsAreNotAbsoluteHttp() {
        assertThatThrownBy(() -> base().image("/img/cover.png").build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("image");
        assertThatThrownBy(() -> base().href("ftp://example.com/game").build())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("href");
        assertThat(base().href("HTTPS://Example.com/Game").build().href()).isEqualTo("HTTPS://Example.com/Game");
    }

    @Test
    void should_DefaultPrice_When_PriceIsBlank() {
        assertThat(base().price(null).build().price()).isEqualTo(CanonicalRecord.UNAVAILABLE);
        assertThat(base().price("  ").build().price()).isEqualTo("Unavailable");
        assertThat(base().price(" Free ").build().price()).isEqualTo("Free");
    }

    @Test
    void should_DedupePlatformsIgnoringCase_When_Built() {
        List<String> raw = new ArrayList<>(Arrays.asList("Switch", " switch ", "PC", null, "", "SWITCH", "pc"));

        CanonicalRecord r = base().platforms(raw).build();

        assertThat(r.platforms()).containsExactly("Switch", "PC");
        assertThatThrownBy(() -> r.platforms().add("Xbox")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void should_CopyExtraDefensively_When_Built() {
        Map<String, Object> extra = new HashMap<>();
        extra.put("source", "api");
        extra.put("slug", null);

        CanonicalRecord r = base().extra(extra).build();
        extra.put("late", "value");

        assertThat(r.extra()).containsExactly(Map.entry("source", "api"));
        assertThat(base().build().extra()).isEmpty();
    }

    @Test
    void should_WriteOutputFieldsInFixedOrder_When_Serialized() throws Exception {
        CanonicalRecord r = base().kind("game").rating(Rating.TEEN).build();

        JsonNode json = new ObjectMapper().valueToTree(r.toOutputItem());

        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("name", "type", "price", "image", "href", "platforms", "rating");
        assertThat(json.get("type").asText()).isEqualTo("game");
        assertThat(json.get("rating").asText()).isEqualTo("teen");
    }

    @Test
    void should_KeepEmptyPlatforms_When_Serialized() {
        CanonicalRecord r = base().platforms(List.of()).build();

        JsonNode json = new ObjectMapper().valueToTree(r.toOutputItem());

        assertThat(json.has("platforms")).isTrue();
        assertThat(json.get("platforms").isArray()).isTrue();
        assertThat(json.has("uuid")).isFalse();
        assertThat(json.has("type")).isFalse();
    }

    @Test
    void should_MatchRatingsCaseInsensitively() {
        assertThat(Rating.fromLabel(" Mature 17+ ")).contains(Rating.MATURE_17_PLUS);
        assertThat(Rating.fromLabel("E10+")).isEmpty();
        assertThat(Rating.fromLabel(null)).isEmpty();
    }
}
