package com.storefront.catalog.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storefront.catalog.exception.ParseException;
import com.storefront.catalog.model.ItemSource;
import com.storefront.catalog.model.RawItem;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddedDataParserTest {

    private static final String PAGE = "https://www.nintendo.com/en-us/store/games";

    private final ObjectMapper mapper = new ObjectMapper();

    private final EmbeddedDataParser parser = new EmbeddedDataParser(mapper, "__NEXT_DATA__");

    private static Document page(final String scriptBody) {
        return Jsoup.parse("<html><head></head><body><div id=\"app\"></div>"
                + "<script id=\"__NEXT_DATA__\" type=\"application/json\">" + scriptBody + "</script>"
                + "</body></html>", PAGE);
    }

    @Test
    void should_CollectEveryCandidateList_When_ListsAreNestedAtAnyDepth() {
        String json = """
                {"props":{"pageProps":{
                  "hero":{"tiles":[{"title":"Hero Game"}]},
                  "sections":[
                    {"products":[{"title":"Tetris"},{"title":"Zelda"},"not-an-object",42]},
                    {"module":{"results":[{"name":"Kirby"}]}}
                  ],
                  "items":[]
                }}}
                """;

        List<RawItem> items = parser.parse(page(json));

        assertThat(items)
                .extracting(i -> i.firstText("title", "name").orElse(""))
                .containsExactly("Hero Game", "Tetris", "Zelda", "Kirby");
    }

    @Test
    void should_ReturnNothing_When_ScriptIsAbsent() {
        Document doc = Jsoup.parse("<html><body><p>No data</p></body></html>", PAGE);

        assertThat(parser.parse(doc)).isEmpty();
    }

    @Test
    void should_ReadConfiguredScriptId() {
        EmbeddedDataParser custom = new EmbeddedDataParser(mapper, "store-state");
        Document doc = Jsoup.parse("<script id=\"store-state\">{\"items\":[{\"title\":\"Celeste\"}]}</script>", PAGE);

        assertThat(custom.parse(doc)).hasSize(1);
        assertThat(custom.source()).isEqualTo(ItemSource.EMBEDDED);
    }

    @Test
    void should_RaiseParseException_When_PayloadIsMalformed() {
        assertThatThrownBy(() -> parser.parse(page("{\"props\": {\"products\": [")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("__NEXT_DATA__");
    }

    @Test
    void should_WalkWithoutRecursion_When_TreeIsVeryDeep() {
        ArrayNode root = mapper.createArrayNode();
        ArrayNode cursor = root;
        for (int i = 0; i < 50_000; i++) {
            ArrayNode child = mapper.createArrayNode();
            cursor.add(child);
            cursor = child;
        }
        ObjectNode leaf = mapper.createObjectNode();
        leaf.putArray("products").addObject().put("title", "Deep");
        cursor.add(leaf);

        assertThat(parser.collect(root))
                .singleElement()
                .satisfies(i -> assertThat(i.firstText("title")).contains("Deep"));
    }
}
