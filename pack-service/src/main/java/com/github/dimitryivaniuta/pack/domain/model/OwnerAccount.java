package com.github.dimitryivaniuta.pack.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.github.dimitryivaniuta.pack.draw.PityState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the service persists for one owner: balance, inventory, pity counter, shard and
 * token counts, and unlocked characters. Loaded, mutated and saved as a whole under the
 * owner's lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OwnerAccount {

    private String ownerId;

    private boolean anonymous;

    @Builder.Default
    private Map<String, Long> balance = new LinkedHashMap<>();

    @Builder.Default
    private List<InventoryRecord> items = new ArrayList<>();

    @Builder.Default
    private PityState pity = PityState.initial();

    private int shards;

    private int guaranteeTokens;

    /** characterId -> record */
    @Builder.Default
    private Map<String, UnlockRecord> unlocks = new LinkedHashMap<>();

    private Instant createdAt;

    private Instant updatedAt;

    public static OwnerAccount fresh(OwnerId owner, Map<String, Long> startingBalance, Instant now) {
        return OwnerAccount.builder()
                .ownerId(owner.value())
                .anonymous(owner.anonymous())
                .balance(new LinkedHashMap<>(startingBalance))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public long balanceOf(String currency) {
        return balance.getOrDefault(currency, 0L);
    }

    @JsonIgnore
    public Set<String> getOwnedItemIds() {
        Set<String> ids = new LinkedHashSet<>();
        items.forEach(r -> ids.add(r.itemId()));
        return ids;
    }

    public Optional<InventoryRecord> findItem(String itemId) {
        return items.stream().filter(r -> r.itemId().equals(itemId)).findFirst();
    }

    /** Copy deep enough that mutating the copy never touches this instance. */
    public OwnerAccount copy() {
        return toBuilder()
                .balance(new LinkedHashMap<>(balance))
                .items(new ArrayList<>(items))
                .unlocks(new LinkedHashMap<>(unlocks))
                .build();
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
