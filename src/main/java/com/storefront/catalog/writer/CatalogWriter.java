package com.storefront.catalog.writer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.storefront.catalog.config.CatalogProperties;
import com.storefront.catalog.model.CanonicalRecord;
import com.storefront.catalog.model.OutputItem;
import com.storefront.catalog.model.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h2>CatalogWriter</h2>
 *
 * <p>Persists one store's record set as {@code <out>/<store>/_.json},
 * {@code a.json} … {@code z.json}. Each file is a JSON array of
 * {@link OutputItem}s in arrival order. All 27 files are written on every
 * run, empty buckets as {@code []}, so a re-run never leaves stale letters
 * behind.</p>
 *
 * <p>All 27 files are first written to temporary files next to their
 * targets. Only when every one of them is complete are they moved over the
 * previous catalog, so a failed serialization leaves that catalog untouched
 * and readers never observe a half-written file.</p>
 */
@Slf4j
@Component
public class CatalogWriter {

    private static final String SUFFIX = ".json";

    private final ObjectWriter writer;

    @Autowired
    public CatalogWriter(@Qualifier("catalogObjectMapper") final ObjectMapper mapper,
                         final CatalogProperties properties) {
        this(mapper, properties.getOutput().isPretty());
    }

    public CatalogWriter(final ObjectMapper mapper, final boolean pretty) {
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    /**
     * @param outDir  output root
     * @param store   store the records belong to
     * @param records records in arrival order
     * @return the store directory
     * @throws UncheckedIOException if a file cannot be written
     */
    public Path write(final Path outDir, final Store store, final List<CanonicalRecord> records) {
        Map<String, List<OutputItem>> buckets = partition(records);
        Path dir = outDir.resolve(store.id());
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            Files.createDirectories(dir);
            for (Map.Entry<String, List<OutputItem>> e : buckets.entrySet()) {
                Path target = dir.resolve(e.getKey() + SUFFIX);
                staged.put(target, stage(target, e.getValue()));
            }
            for (Map.Entry<Path, Path> e : staged.entrySet()) {
                Files.move(e.getValue(), e.getKey(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot write catalog of " + store.id() + " to " + dir, ex);
        } finally {
            staged.values().forEach(CatalogWriter::discard);
        }
        log.info("Wrote {} {} records to {}", records.size(), store.id(), dir);
        return dir;
    }

    /**
     * @return bucket key → items, every bucket present, catch-all first
     */
    public static Map<String, List<OutputItem>> partition(final List<CanonicalRecord> records) {
        Map<String, List<OutputItem>> buckets = new LinkedHashMap<>();
        LetterBuckets.ALL.forEach(k -> buckets.put(k, new ArrayList<>()));
        for (CanonicalRecord r : records) {
            buckets.get(LetterBuckets.bucketOf(r.name())).add(r.toOutputItem());
        }
        return buckets;
    }

    private Path stage(final Path target, final List<OutputItem> items) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
            writer.writeValue(out, items);
        } catch (IOException | RuntimeException ex) {
            discard(tmp);
            throw ex;
        }
        return tmp;
    }

    /** Removes a temporary file that was not moved into place. */
    private static void discard(final Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            log.warn("Cannot delete temporary file {}", tmp, ex);
        }
    }
}
