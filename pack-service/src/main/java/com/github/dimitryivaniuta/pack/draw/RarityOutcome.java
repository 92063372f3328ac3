package com.github.dimitryivaniuta.pack.draw;

/**
 * Result of one rarity resolution.
 *
 * @param rarity     the rarity drawn
 * @param next       pity state after this draw
 * @param pityForced true when the pity threshold forced the rarity instead of the weighted roll
 */
public record RarityOutcome(String rarity, PityState next, boolean pityForced) {}
