package com.github.dimitryivaniuta.pack.catalog;

import java.util.Locale;

/** Rarity names are free-form catalog strings compared case-insensitively. */
public final class Rarities {

    private Rarities() {
    }

    public static String normalize(String rarity) {
        if (rarity == null || rarity.isBlank()) {
            throw new IllegalArgumentException("rarity must not be blank");
        }
        return rarity.trim().toLowerCase(Locale.ROOT);
    }
}
