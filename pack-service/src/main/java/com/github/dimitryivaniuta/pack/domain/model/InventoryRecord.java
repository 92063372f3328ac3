package com.github.dimitryivaniuta.pack.domain.model;

import com.github.dimitryivaniuta.pack.catalog.ItemKind;
import java.time.Instant;
import java.util.Objects;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Owned item line. One record per item id; repeats raise {@code quantity}. */
@Jacksonized
@Builder(toBuilder = true)
public record InventoryRecord(
        String itemId,
        String name,
        String rarity,
        ItemKind kind,
        String artUrl,
        int quantity,
        Instant acquiredAt,
        Instant lastAcquiredAt
) {
    public InventoryRecord {
        Objects.requireNonNull(itemId, "itemId");
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be >= 1");
        }
    }

    public static InventoryRecord first(DrawResult drawn, Instant at) {
        return InventoryRecord.builder()
                .itemId(drawn.itemId())
                .name(drawn.name())
                .rarity(drawn.rarity())
                .kind(drawn.kind())
                .artUrl(drawn.artUrl())
                .quantity(1)
                .acquiredAt(at)
                .lastAcquiredAt(at)
                .build();
    }

    public InventoryRecord increment(Instant at) {
        return toBuilder().quantity(Math.addExact(quantity, 1)).lastAcquiredAt(at).build();
    }
}
