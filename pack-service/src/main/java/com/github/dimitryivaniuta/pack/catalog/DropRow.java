package com.github.dimitryivaniuta.pack.catalog;

import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;

/**
 * One weighted row of a drop table. {@code pityEvery}, when present, forces this row's rarity
 * once that many consecutive draws have missed it.
 */
public record DropRow(String rarity, double weight, Integer pityEvery) {

    public DropRow {
        rarity = Rarities.normalize(rarity);
        if (!(weight > 0) || Double.isInfinite(weight)) {
            throw new CatalogConfigurationException("weight must be a positive number for rarity " + rarity);
        }
        if (pityEvery != null && pityEvery < 1) {
            throw new CatalogConfigurationException("pityEvery must be >= 1 for rarity " + rarity);
        }
    }

    public static DropRow of(String rarity, double weight) {
        return new DropRow(rarity, weight, null);
    }

    public boolean hasPity() { return pityEvery != null; }
}
