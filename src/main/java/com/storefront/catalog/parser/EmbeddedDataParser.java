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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * <h2>Embedded page-state parser</h2>
 *
 * <p>Storefront listing pages built with server-side rendering inline their
 * whole page state as JSON in a script element (Next.js uses
 * {@code <script id="__NEXT_DATA__">}). This parser reads that payload and
 * walks the complete tree:</p>
 * <ul>
 *   <li>every array held under {@code products}, {@code items},
 *       {@code results} or {@code tiles}, at any depth, contributes its object
 *       elements as candidates;</li>
 *   <li>the walk does not stop at the first match, since listing pages nest
 *       several product modules;</li>
 *   <li>the walk uses an explicit stack, so hostile nesting depth cannot
 *       overflow the call stack.</li>
 * </ul>
 */
@Slf4j
public class EmbeddedDataParser implements ListingPageParser {

    /** Keys whose array values hold product candidates. */
    static final Set<String> LIST_KEYS = Set.of("products", "items", "results", "tiles");

    private final ObjectMapper mapper;

    private final String scriptId;

    /**
     * @param mapper   JSON reader
     * @param scriptId {@code id} attribute of the script element carrying the payload
     */
    public EmbeddedDataParser(final ObjectMapper mapper, final String scriptId) {
        this.mapper = mapper;
        this.scriptId = scriptId;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<RawItem> parse(final Document page) {
        Element script = page.getElementById(scriptId);
        if (script == null) {
            log.debug("No #{} script on {}", scriptId, page.location());
            return List.of();
        }

        JsonNode root;
        try {
            root = mapper.readTree(script.data());
        } catch (JsonProcessingException ex) {
            throw new ParseException("Malformed #" + scriptId + " payload on " + page.location(), ex);
        }
        return collect(root);
    }

    @Override
    public ItemSource source() {
        return ItemSource.EMBEDDED;
    }

    /**
     * Depth-first walk over objects and arrays, in document order.
     *
     * @param root payload root
     * @return every object found in a candidate list
     */
    List<RawItem> collect(final JsonNode root) {
        List<RawItem> out = new ArrayList<>();
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node.isObject()) {
                for (String key : fieldOrder(node)) {
                    JsonNode value = node.get(key);
                    if (LIST_KEYS.contains(key) && value.isArray()) {
                        value.forEach(el -> {
                            if (el.isObject()) {
                                out.add(RawItem.from(el));
                            }
                        });
                    }
                }
                pushChildren(stack, node);
            } else if (node.isArray()) {
                pushChildren(stack, node);
            }
        }
        return out;
    }

    private static List<String> fieldOrder(final JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    /** Pushes container children in reverse so they pop in document order. */
    private static void pushChildren(final Deque<JsonNode> stack, final JsonNode node) {
        List<JsonNode> children = new ArrayList<>();
        Iterator<JsonNode> it = node.elements();
        while (it.hasNext()) {
            JsonNode child = it.next();
            if (child.isContainerNode()) {
                children.add(child);
            }
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }
}
