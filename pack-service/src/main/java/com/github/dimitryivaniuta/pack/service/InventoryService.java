package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.pack.api.dto.InventoryView;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.progress.ProgressEvaluator;
import com.github.dimitryivaniuta.pack.store.InventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Read side: balance, inventory and unlocks with progress against the current catalog. */
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final InventoryStore store;
    private final OwnerLocks locks;
    private final ProgressEvaluator evaluator;
    private final CatalogStore catalogStore;

    public Mono<InventoryView> inventory(final OwnerId owner) {
        return Mono.fromCallable(() -> locks.withLock(owner, () -> {
                    OwnerAccount account = store.load(owner);
                    return InventoryView.of(account, evaluator.compute(account.getOwnedItemIds(), catalogStore.current()));
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
