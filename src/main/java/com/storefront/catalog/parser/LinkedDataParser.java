package com.storefront.catalog.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.exception.ParseException;
import com.storefront.catalog.model.ItemSource;
import com.storefront.catalog.model.RawItem;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * <h2>JSON-LD parser</h2>
 *
 * <p>Reads every {@code <script type="application/ld+json">} block of a page.
 * A block holds one object or an array of objects; an object is accepted when
 * its {@code @type} is {@code Product} or {@code VideoGame}, and an object
 * with an {@code @graph} array contributes the graph members that pass the
 * same test.</p>
 *
 * <p>A malformed block is skipped and the remaining blocks of the page are
 * still read. Only when every block of the page is malformed does the parser
 * report a {@link ParseException}.</p>
 */
@Slf4j
public class LinkedDataParser implements ListingPageParser {

    private static final String LD_JSON = "application/ld+json";

    private static final String TYPE = "@type";

    private static final String GRAPH = "@graph";

    private static final Set<String> PRODUCT_TYPES = Set.of("product", "videogame");

    private final ObjectMapper mapper;

    public LinkedDataParser(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<RawItem> parse(final Document page) {
        List<RawItem> out = new ArrayList<>();
        int blocks = 0;
        int malformed = 0;
        JsonProcessingException lastError = null;

        for (Element script : page.select("script[type]")) {
            if (!script.attr("type").trim().toLowerCase(Locale.ROOT).startsWith(LD_JSON)) {
                continue;
            }
            blocks++;
            JsonNode block;
            try {
                block = mapper.readTree(script.data());
            } catch (JsonProcessingException ex) {
                malformed++;
                lastError = ex;
                log.debug("Skipping malformed JSON-LD block #{} on {}: {}", blocks, page.location(),
                        ex.getOriginalMessage());
                continue;
            }
            Iterable<JsonNode> entities = block.isArray() ? block : List.of(block);
            for (JsonNode entity : entities) {
                accept(entity, out);
            }
        }

        if (blocks > 0 && malformed == blocks) {
            throw new ParseException("All " + blocks + " JSON-LD blocks malformed on " + page.location(), lastError);
        }
        return out;
    }

    @Override
    public ItemSource source() {
        return ItemSource.LINKED_DATA;
    }

    private void accept(final JsonNode entity, final List<RawItem> out) {
        if (!entity.isObject()) {
            return;
        }
        JsonNode graph = entity.get(GRAPH);
        if (graph != null && graph.isArray()) {
            for (JsonNode member : graph) {
                if (member.isObject() && isProduct(member)) {
                    out.add(RawItem.from(member));
                }
            }
        } else if (isProduct(entity)) {
            out.add(RawItem.from(entity));
        }
    }

    /**
     * {@code @type} may be a single name or a list of names.
     */
    static boolean isProduct(final JsonNode entity) {
        JsonNode type = entity.get(TYPE);
        if (type == null) {
            return false;
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (PRODUCT_TYPES.contains(t.asText().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
            return false;
        }
        return PRODUCT_TYPES.contains(type.asText().toLowerCase(Locale.ROOT));
    }
}
