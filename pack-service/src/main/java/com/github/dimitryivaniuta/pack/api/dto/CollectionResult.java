package com.github.dimitryivaniuta.pack.api.dto;

import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.InventoryRecord;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Inventory after a commit, plus what the commit changed. */
@Jacksonized
@Builder
public record CollectionResult(
        boolean ok,
        List<DrawResult> committed,
        Map<String, Long> balance,
        List<InventoryRecord> items,
        int shards,
        int guaranteeTokens,
        int shardsAccrued,
        int tokensMinted,
        int unlocksInserted
) {}
