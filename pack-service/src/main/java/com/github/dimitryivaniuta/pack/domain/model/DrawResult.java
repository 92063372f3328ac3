package com.github.dimitryivaniuta.pack.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.pack.catalog.Item;
import com.github.dimitryivaniuta.pack.catalog.ItemKind;

/**
 * One drawn slot of an opening.
 *
 * @param dupe       the owner already held the item before the opening started
 * @param pityForced the rarity came from the pity threshold
 * @param guaranteed the slot was filled by a guarantee token
 */
public record DrawResult(
        int slot,
        String itemId,
        String name,
        String rarity,
        ItemKind kind,
        String artUrl,
        @JsonProperty("isDupe") boolean dupe,
        boolean pityForced,
        boolean guaranteed
) {
    public static DrawResult of(int slot, Item item, boolean dupe, boolean pityForced, boolean guaranteed) {
        return new DrawResult(slot, item.id(), item.name(), item.rarity(), item.kind(), item.artUrl(),
                dupe, pityForced, guaranteed);
    }
}
