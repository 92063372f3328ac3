package com.github.dimitryivaniuta.pack.api.dto;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.catalog.Pack;

/** Public view of a catalog pack. */
public record PackView(String id, String name, Money price) {

    public static PackView from(Pack pack) {
        return new PackView(pack.id(), pack.name(), pack.price());
    }
}
