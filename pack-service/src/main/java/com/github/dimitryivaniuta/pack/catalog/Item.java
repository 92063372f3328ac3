package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import java.util.Objects;

/** Packable catalog entry. Identity is the id; everything else is descriptive. */
public record Item(String id, String name, String rarity, ItemKind kind, String artUrl) {

    public Item {
        requireNonBlank(id, "item.id");
        name = name == null || name.isBlank() ? id : name;
        rarity = Rarities.normalize(rarity);
        Objects.requireNonNull(kind, "item.kind");
    }
}
