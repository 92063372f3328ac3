package com.github.dimitryivaniuta.pack.economy;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.service.EconomyLedger;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Credits {@code creditPerDupe} for every dupe-flagged draw, once per opening. No guarantees. */
@Slf4j
@RequiredArgsConstructor
public class ImmediateDupeCreditPolicy implements EconomyPolicy {

    private final EconomyLedger ledger;
    private final Money creditPerDupe;

    @Override
    public EconomyModel model() {
        return EconomyModel.IMMEDIATE_DUPE_CREDIT;
    }

    @Override
    public boolean guaranteeAvailable(OwnerAccount account) {
        return false;
    }

    @Override
    public OpeningSettlement settleOpening(OwnerAccount account, List<DrawResult> results, boolean guaranteeConsumed) {
        long dupes = results.stream().filter(DrawResult::dupe).count();
        Money credit = creditPerDupe.times(dupes);
        if (!credit.isZero()) {
            ledger.credit(account, credit);
            log.debug("Dupe credit {} {} for owner={}", credit.amount(), credit.currency(), account.getOwnerId());
        }
        return new OpeningSettlement(credit, false);
    }

    @Override
    public CommitSettlement settleCommitted(OwnerAccount account, DrawResult committed, boolean alreadyOwned) {
        return CommitSettlement.NONE;
    }
}
