package com.storefront.catalog.model;

import java.net.URI;

/**
 * A raw item together with where it was found.
 *
 * @param item   the item, already coerced to the API field names
 * @param source extraction path
 * @param origin API page or listing page the item came from; relative links resolve against it
 */
public record ExtractedItem(RawItem item, ItemSource source, URI origin) {
}
