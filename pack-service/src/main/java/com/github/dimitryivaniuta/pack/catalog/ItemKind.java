package com.github.dimitryivaniuta.pack.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of a packable catalog item; the code is the lowercase wire value. */
public enum ItemKind {
    CHARACTER("character", "legendary"),
    COVER("cover", "rare"),
    FRAGMENT("fragment", "common"),
    STEM("stem", "common"),
    UNRELEASED("unreleased", "epic");

    private final String code;
    private final String defaultRarity;

    ItemKind(String code, String defaultRarity) {
        this.code = code;
        this.defaultRarity = defaultRarity;
    }

    @JsonValue
    public String code() { return code; }

    /** Rarity assumed when a catalog entry of this kind does not declare one. */
    public String defaultRarity() { return defaultRarity; }

    @JsonCreator
    public static ItemKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("item kind must not be null");
        }
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (ItemKind k : values()) {
            if (k.code.equals(c)) return k;
        }
        throw new IllegalArgumentException("Unknown item kind: " + code);
    }
}
