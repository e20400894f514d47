package com.storefront.catalog.dedup;

import com.storefront.catalog.model.CanonicalRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups records that name the same game.
 */
@Slf4j
@Component
public class CatalogClusterer {

    /**
     * Buckets records by {@link CanonicalKeys canonical key}. Keys keep the
     * order in which they were first seen, and records keep arrival order
     * within a bucket. No representative is chosen.
     *
     * @param records records of one or several stores
     * @return canonical key → records sharing it
     */
    public Map<String, List<CanonicalRecord>> cluster(final List<CanonicalRecord> records) {
        Map<String, List<CanonicalRecord>> buckets = new LinkedHashMap<>();
        for (CanonicalRecord r : records) {
            buckets.computeIfAbsent(CanonicalKeys.of(r.name()), k -> new ArrayList<>()).add(r);
        }
        return buckets;
    }

    /**
     * Drops repeats of the same listing inside one store's record set, as
     * produced by overlapping search queries and pages. A record repeats an
     * earlier one when both share the canonical key and the same identity:
     * the native id when the record has one, its link otherwise.
     *
     * @param records records of one store in arrival order
     * @return first occurrences, arrival order kept
     */
    public List<CanonicalRecord> collapseDuplicates(final List<CanonicalRecord> records) {
        Set<String> seen = new HashSet<>();
        List<CanonicalRecord> out = new ArrayList<>(records.size());
        for (CanonicalRecord r : records) {
            String identity = r.uuid() != null ? "id:" + r.uuid() : "href:" + r.href();
            if (seen.add(r.store().id() + '|' + CanonicalKeys.of(r.name()) + '|' + identity)) {
                out.add(r);
            }
        }
        if (out.size() < records.size()) {
            log.debug("Collapsed {} duplicate records", records.size() - out.size());
        }
        return out;
    }
}
