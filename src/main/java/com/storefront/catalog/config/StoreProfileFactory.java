package com.storefront.catalog.config;

import com.storefront.catalog.exception.UnknownStoreException;
import com.storefront.catalog.model.Store;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Factory component responsible for producing {@link StoreProfile} instances
 * for a given store. It delegates to {@link CatalogProperties} to look up the
 * <code>catalog.stores.{id}</code> section of <code>application.yml</code>.
 */
@Component
@RequiredArgsConstructor
public class StoreProfileFactory {

    private final CatalogProperties properties;

    /**
     * @param store the store to look up
     * @return the profile configured for that store
     * @throws UnknownStoreException if no section exists or the store is disabled
     */
    public StoreProfile forStore(final Store store) {
        StoreProfile profile = Optional.ofNullable(properties.getStores().get(store.id()))
                .orElseThrow(() -> new UnknownStoreException(store.id(),
                        "no <catalog.stores." + store.id() + "> section found in application.yml"));
        if (!profile.isEnabled()) {
            throw new UnknownStoreException(store.id(), "disabled by configuration");
        }
        return profile;
    }
}
