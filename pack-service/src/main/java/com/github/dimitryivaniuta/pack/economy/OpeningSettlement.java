package com.github.dimitryivaniuta.pack.economy;

import com.github.dimitryivaniuta.common.money.Money;

/** What the economy policy did to the account when an opening was drawn. */
public record OpeningSettlement(Money dupeCredit, boolean guaranteeUsed) {}
