package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import java.util.List;

/** Fragments that together assemble one character. */
public record FragmentSet(String id, String name, List<String> fragmentIds, String rewardCharacterId) {

    public FragmentSet {
        requireNonBlank(id, "fragmentSet.id");
        fragmentIds = CatalogChecks.copyOrEmpty(fragmentIds);
    }
}
