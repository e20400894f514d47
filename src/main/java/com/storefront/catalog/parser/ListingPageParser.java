package com.storefront.catalog.parser;

import com.storefront.catalog.exception.ParseException;
import com.storefront.catalog.model.ItemSource;
import com.storefront.catalog.model.RawItem;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Pulls candidate product items out of a storefront listing page.
 */
public interface ListingPageParser {

    /**
     * @param page parsed HTML page, base URI set to the page URL
     * @return candidate items in document order, never {@code null}
     * @throws ParseException if the payload this parser reads is malformed
     */
    List<RawItem> parse(Document page);

    /**
     * @return the extraction path this parser stands for
     */
    ItemSource source();
}
