package com.github.dimitryivaniuta.pack.store;

import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;

/**
 * Per-owner account persistence. Both durable and anonymous owners are addressable; the two
 * never collide. Implementations are synchronous and may block; callers serialize access per
 * owner through {@link OwnerLocks}.
 */
public interface InventoryStore {

    /**
     * Returns a private copy of the owner's account, creating a fresh one with the starting
     * balance on first access.
     */
    OwnerAccount load(OwnerId owner);

    void save(OwnerId owner, OwnerAccount account);

    /** Drops the owner's account; the next {@link #load} starts fresh. */
    void delete(OwnerId owner);
}
