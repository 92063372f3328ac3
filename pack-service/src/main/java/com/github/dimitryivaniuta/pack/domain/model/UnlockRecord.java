package com.github.dimitryivaniuta.pack.domain.model;

import java.time.Instant;

/** Character unlocked by completing a catalog node. Unique per (owner, character). */
public record UnlockRecord(String ownerId, String characterId, String source, Instant unlockedAt) {}
