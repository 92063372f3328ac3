package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import java.util.List;

/** A single: one song's stems plus a cover. */
public record Single(String id, String name, List<String> stemIds, String coverId, String rewardCharacterId) {

    public Single {
        requireNonBlank(id, "single.id");
        stemIds = CatalogChecks.copyOrEmpty(stemIds);
    }
}
