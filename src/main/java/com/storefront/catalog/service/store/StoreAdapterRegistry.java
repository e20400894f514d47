package com.storefront.catalog.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.config.StoreProfileFactory;
import com.storefront.catalog.exception.UnknownStoreException;
import com.storefront.catalog.model.AdapterConfig;
import com.storefront.catalog.model.Store;
import com.storefront.catalog.normalize.RecordNormalizer;
import com.storefront.catalog.parser.ItemCoercer;
import com.storefront.catalog.service.core.ShortPageStopPolicy;
import com.storefront.catalog.service.core.StoreAdapter;
import com.storefront.catalog.service.core.StoreHttpClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.List;

/**
 * Registry that builds the adapter of every configured store.
 * Inject this where a crawl needs a store-specific adapter.
 */
@Slf4j
@Component
public class StoreAdapterRegistry {

    private final StoreProfileFactory profiles;

    private final CatalogProperties properties;

    private final StorefrontAdapter.Collaborators collaborators;

    @Autowired
    public StoreAdapterRegistry(final StoreProfileFactory profiles,
                                final CatalogProperties properties,
                                final StoreHttpClientFactory clientFactory,
                                @Qualifier("catalogObjectMapper") final ObjectMapper mapper,
                                final ItemCoercer coercer,
                                final RecordNormalizer normalizer) {
        this(profiles, properties, new StorefrontAdapter.Collaborators(
                clientFactory, mapper, coercer, normalizer, new ShortPageStopPolicy(), Schedulers.parallel()));
    }

    public StoreAdapterRegistry(final StoreProfileFactory profiles,
                                final CatalogProperties properties,
                                final StorefrontAdapter.Collaborators collaborators) {
        this.profiles = profiles;
        this.properties = properties;
        this.collaborators = collaborators;
        log.info("Configured stores: {}", supportedStores());
    }

    /**
     * @param name   store identifier, case-insensitive
     * @param region region the adapter crawls
     * @return a ready adapter
     * @throws UnknownStoreException if the name matches no store, or the store
     *                               is not configured or disabled
     */
    public StoreAdapter create(final String name, final AdapterConfig region) {
        Store store = Store.fromId(name);
        return new StorefrontAdapter(store, profiles.forStore(store), region, collaborators);
    }

    /**
     * @return identifiers of the stores that are configured and enabled
     */
    public List<String> supportedStores() {
        return Arrays.stream(Store.values())
                .map(Store::id)
                .filter(id -> properties.getStores().containsKey(id) && properties.getStores().get(id).isEnabled())
                .toList();
    }
}
