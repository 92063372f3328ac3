package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import java.util.List;

/** A song inside a release; complete once every stem is owned. */
public record Song(String id, String name, List<String> stemIds, String rewardCharacterId) {

    public Song {
        requireNonBlank(id, "song.id");
        stemIds = CatalogChecks.copyOrEmpty(stemIds);
    }
}
