package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import java.util.List;

/** An EP: several songs plus a cover item. {@code coverId} may be null. */
public record Release(String id, String name, List<Song> songs, String coverId, String rewardCharacterId) {

    public Release {
        requireNonBlank(id, "release.id");
        songs = CatalogChecks.copyOrEmpty(songs);
    }
}
