package com.github.dimitryivaniuta.pack.api.dto;

/** Owner's pity counter after the opening, and which rarity it tracks (null if the table has none). */
public record PityView(int sinceLastPity, String pityRarity) {}
