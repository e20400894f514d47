package com.storefront.catalog.normalize;

import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.model.Store;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Store-level fallbacks applied while normalizing items of one store.
 *
 * @param store              store the items belong to
 * @param region             region of the run, expands {@code productUrlTemplate}
 * @param placeholderImage   image of items that carry none
 * @param productUrlTemplate product page pattern with a {@code {slug}} placeholder, optional
 * @param storeRootUrl       link of items that carry nothing to build one from
 * @param defaultPlatforms   platforms of items that list none
 * @param preferDisplayPrice prefer the source's display string over a parsed amount
 */
public record StoreDefaults(Store store,
                            AdapterConfig region,
                            String placeholderImage,
                            @Nullable String productUrlTemplate,
                            String storeRootUrl,
                            List<String> defaultPlatforms,
                            boolean preferDisplayPrice) {

    public StoreDefaults {
        defaultPlatforms = List.copyOf(defaultPlatforms);
    }
}
