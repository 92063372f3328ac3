package com.github.dimitryivaniuta.pack.economy;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Deferred economy: one shard per duplicate accepted at commit; every {@code shardsPerToken}
 * shards become a guarantee token; an opening spends one token when its guaranteed slot fires.
 */
@Slf4j
public class ShardTokenPolicy implements EconomyPolicy {

    private final int shardsPerToken;
    private final String currency;

    public ShardTokenPolicy(int shardsPerToken, String currency) {
        if (shardsPerToken < 1) {
            throw new IllegalArgumentException("shardsPerToken must be >= 1");
        }
        this.shardsPerToken = shardsPerToken;
        this.currency = currency;
    }

    @Override
    public EconomyModel model() {
        return EconomyModel.SHARD_TOKENS;
    }

    @Override
    public boolean guaranteeAvailable(OwnerAccount account) {
        return account.getGuaranteeTokens() > 0;
    }

    @Override
    public OpeningSettlement settleOpening(OwnerAccount account, List<DrawResult> results, boolean guaranteeConsumed) {
        if (guaranteeConsumed) {
            account.setGuaranteeTokens(account.getGuaranteeTokens() - 1);
            log.info("Guarantee token spent by owner={} (left={})", account.getOwnerId(), account.getGuaranteeTokens());
        }
        return new OpeningSettlement(Money.zero(currency), guaranteeConsumed);
    }

    @Override
    public CommitSettlement settleCommitted(OwnerAccount account, DrawResult committed, boolean alreadyOwned) {
        if (!alreadyOwned) {
            return CommitSettlement.NONE;
        }
        int shards = account.getShards() + 1;
        int minted = 0;
        while (shards >= shardsPerToken) {
            shards -= shardsPerToken;
            minted++;
        }
        account.setShards(shards);
        if (minted > 0) {
            account.setGuaranteeTokens(account.getGuaranteeTokens() + minted);
            log.info("Minted {} guarantee token(s) for owner={}", minted, account.getOwnerId());
        }
        return new CommitSettlement(1, minted);
    }
}
