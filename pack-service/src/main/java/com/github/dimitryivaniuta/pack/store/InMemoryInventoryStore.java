package com.github.dimitryivaniuta.pack.store;

import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;

/** Process-local store; accounts are copied in and out so callers never share instances. */
@RequiredArgsConstructor
public class InMemoryInventoryStore implements InventoryStore {

    private final Map<String, Long> startingBalance;
    private final Clock clock;
    private final ConcurrentMap<String, OwnerAccount> accounts = new ConcurrentHashMap<>();

    @Override
    public OwnerAccount load(OwnerId owner) {
        return accounts
                .computeIfAbsent(owner.key(), k -> OwnerAccount.fresh(owner, startingBalance, clock.instant()))
                .copy();
    }

    @Override
    public void save(OwnerId owner, OwnerAccount account) {
        accounts.put(owner.key(), account.copy());
    }

    @Override
    public void delete(OwnerId owner) {
        accounts.remove(owner.key());
    }
}
