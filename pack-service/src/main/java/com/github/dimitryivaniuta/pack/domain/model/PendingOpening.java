package com.github.dimitryivaniuta.pack.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** Drawn but not yet collected results of one opening. At most one live per owner. */
public record PendingOpening(
        String ownerId,
        String openingId,
        String packId,
        String idempotencyKey,
        Instant openedAt,
        List<DrawResult> results
) {
    public PendingOpening {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(openingId, "openingId");
        results = List.copyOf(results);
        if (results.isEmpty()) {
            throw new IllegalArgumentException("pending opening without results");
        }
    }
}
