package com.github.dimitryivaniuta.pack.draw;

import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.Item;
import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks a concrete item for a drawn rarity.
 * <ol>
 *   <li>Guarantee active: an item of the rarity that is neither owned nor already drawn in this
 *       opening, else such an item of any rarity. A hit consumes the guarantee.</li>
 *   <li>An item of the rarity not yet drawn in this opening.</li>
 *   <li>Any item of the rarity (repeats inside an opening become possible).</li>
 * </ol>
 * A rarity with no items at all is a catalog error, never a skipped slot.
 */
@Slf4j
@RequiredArgsConstructor
public class ItemSelector {

    private final RandomSource random;

    public ItemSelection select(CatalogSnapshot catalog,
                                String rarity,
                                Set<String> ownedIds,
                                Set<String> drawnIds,
                                boolean guaranteeActive) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(ownedIds, "ownedIds");
        Objects.requireNonNull(drawnIds, "drawnIds");

        List<Item> pool = catalog.itemsOfRarity(rarity);
        if (pool.isEmpty()) {
            throw new CatalogConfigurationException("No catalog items of rarity '" + rarity + "'");
        }

        if (guaranteeActive) {
            Predicate<Item> unseen = i -> !ownedIds.contains(i.id()) && !drawnIds.contains(i.id());
            List<Item> fresh = pool.stream().filter(unseen).toList();
            if (fresh.isEmpty()) {
                fresh = catalog.items().stream().filter(unseen).toList();
            }
            if (!fresh.isEmpty()) {
                Item picked = pick(fresh);
                log.debug("Guarantee consumed: {} ({})", picked.id(), picked.rarity());
                return new ItemSelection(picked, true);
            }
            log.debug("Guarantee active but every catalog item is owned or drawn; falling back");
        }

        List<Item> notDrawn = pool.stream().filter(i -> !drawnIds.contains(i.id())).toList();
        return new ItemSelection(pick(notDrawn.isEmpty() ? pool : notDrawn), false);
    }

    private Item pick(List<Item> list) {
        return list.get(random.nextInt(list.size()));
    }
}
