package com.github.dimitryivaniuta.pack.draw;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Consecutive draws since the pity rarity last came up. Per owner. */
public record PityState(int sinceLastPity) {

    private static final PityState INITIAL = new PityState(0);

    @JsonCreator
    public PityState(@JsonProperty("sinceLastPity") int sinceLastPity) {
        if (sinceLastPity < 0) {
            throw new IllegalArgumentException("sinceLastPity must be >= 0");
        }
        this.sinceLastPity = sinceLastPity;
    }

    public static PityState initial() { return INITIAL; }

    public PityState advance() { return new PityState(sinceLastPity + 1); }

    public PityState reset() { return INITIAL; }
}
