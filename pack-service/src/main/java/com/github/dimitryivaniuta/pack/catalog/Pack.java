package com.github.dimitryivaniuta.pack.catalog;

import static com.github.dimitryivaniuta.pack.catalog.CatalogChecks.requireNonBlank;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;

/** Purchasable pack: a price and the drop table its draws use. */
public record Pack(String id, String name, Money price, String tableId) {

    public Pack {
        requireNonBlank(id, "pack.id");
        name = name == null || name.isBlank() ? id : name;
        if (price == null) {
            throw new CatalogConfigurationException("Pack " + id + " has no price");
        }
        requireNonBlank(tableId, "pack.tableId");
    }
}
