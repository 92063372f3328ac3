package com.github.dimitryivaniuta.pack.api.dto;

import com.github.dimitryivaniuta.pack.domain.model.InventoryRecord;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.UnlockRecord;
import com.github.dimitryivaniuta.pack.progress.ProgressReport;
import java.util.List;
import java.util.Map;

/** Owner's balance, items and unlocks with collection progress. */
public record InventoryView(
        String ownerId,
        boolean anonymous,
        Map<String, Long> balance,
        List<InventoryRecord> items,
        int shards,
        int guaranteeTokens,
        int pitySinceLast,
        List<UnlockRecord> unlocks,
        ProgressReport progress
) {
    public static InventoryView of(OwnerAccount account, ProgressReport progress) {
        return new InventoryView(
                account.getOwnerId(),
                account.isAnonymous(),
                Map.copyOf(account.getBalance()),
                List.copyOf(account.getItems()),
                account.getShards(),
                account.getGuaranteeTokens(),
                account.getPity().sinceLastPity(),
                List.copyOf(account.getUnlocks().values()),
                progress);
    }
}
