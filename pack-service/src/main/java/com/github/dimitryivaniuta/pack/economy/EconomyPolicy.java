package com.github.dimitryivaniuta.pack.economy;

import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import java.util.List;

/**
 * Duplicate-reward rules, chosen once at configuration time. Methods mutate the passed
 * account; the caller persists it.
 */
public interface EconomyPolicy {

    EconomyModel model();

    /** Whether the next opening should run the guaranteed-new-item path. */
    boolean guaranteeAvailable(OwnerAccount account);

    /** Applied after the draws of an opening, before it is staged. */
    OpeningSettlement settleOpening(OwnerAccount account, List<DrawResult> results, boolean guaranteeConsumed);

    /**
     * Applied per committed item, before it is added to the inventory.
     *
     * @param alreadyOwned the inventory already held the item when it was written
     */
    CommitSettlement settleCommitted(OwnerAccount account, DrawResult committed, boolean alreadyOwned);
}
