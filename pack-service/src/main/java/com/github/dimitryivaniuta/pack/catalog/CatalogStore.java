package com.github.dimitryivaniuta.pack.catalog;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ResourceLoader;

/**
 * Holds the current catalog snapshot. Readers take one snapshot per operation via
 * {@link #current()}; reloads swap the whole snapshot atomically, so an in-flight operation
 * never sees a mix of versions.
 */
@Slf4j
public class CatalogStore {

    private final CatalogLoader loader;
    private final ResourceLoader resourceLoader;
    private final String location;
    private final AtomicLong versions = new AtomicLong();
    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>();

    public CatalogStore(CatalogLoader loader, ResourceLoader resourceLoader, String location) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        this.location = Objects.requireNonNull(location, "location");
        reload();
    }

    public CatalogSnapshot current() {
        return current.get();
    }

    /**
     * Re-reads the configured location. A catalog that fails validation is rejected and the
     * previous snapshot stays in place.
     */
    public CatalogSnapshot reload() {
        CatalogSnapshot next = loader.load(resourceLoader.getResource(location), versions.incrementAndGet());
        return replace(next);
    }

    public CatalogSnapshot replace(CatalogSnapshot next) {
        Objects.requireNonNull(next, "next");
        CatalogSnapshot previous = current.getAndSet(next);
        if (previous != null) {
            log.info("Catalog swapped v{} -> v{}", previous.getVersion(), next.getVersion());
        }
        return next;
    }
}
