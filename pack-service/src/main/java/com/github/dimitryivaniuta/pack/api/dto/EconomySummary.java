package com.github.dimitryivaniuta.pack.api.dto;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.economy.EconomyModel;
import java.util.Map;
import lombok.Builder;
import lombok.extern.jackson.Jacksonized;

/** Balance and reward state right after an opening. */
@Jacksonized
@Builder
public record EconomySummary(
        EconomyModel model,
        Map<String, Long> balance,
        Money charged,
        Money dupeCredit,
        int shards,
        int guaranteeTokens,
        boolean guaranteeUsed
) {}
