package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.pack.api.dto.CollectionResult;
import com.github.dimitryivaniuta.pack.api.dto.CommitCollectionRequest;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.InventoryRecord;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.domain.model.PendingOpening;
import com.github.dimitryivaniuta.pack.economy.CommitSettlement;
import com.github.dimitryivaniuta.pack.economy.EconomyPolicy;
import com.github.dimitryivaniuta.pack.error.ValidationException;
import com.github.dimitryivaniuta.pack.store.InventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Second phase of an opening: the owner picks which staged items to keep.
 *
 * <p>Under the owner lock the accepted items are written to the inventory, the economy policy
 * settles each one (shards for items already held), new unlocks are materialized, and only then
 * is the pending opening cleared. A failed write leaves the pending in place.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionService {

    private final PendingOpeningLedger pendingLedger;
    private final InventoryStore store;
    private final OwnerLocks locks;
    private final EconomyPolicy economyPolicy;
    private final UnlockService unlockService;
    private final CatalogStore catalogStore;
    private final Clock clock;

    public Mono<Optional<PendingOpening>> pending(final OwnerId owner) {
        return Mono.fromSupplier(() -> pendingLedger.peek(owner));
    }

    public Mono<CollectionResult> commit(final OwnerId owner, final CommitCollectionRequest req) {
        if (req == null || req.itemIds() == null || req.itemIds().isEmpty()) {
            return Mono.error(new ValidationException("itemIds must be a non-empty array"));
        }
        if (req.itemIds().stream().anyMatch(id -> id == null || id.isBlank())) {
            return Mono.error(new ValidationException("itemIds must not contain blank ids"));
        }
        final List<String> requested = req.itemIds().stream().map(String::trim).toList();

        return Mono.fromCallable(() -> locks.withLock(owner, () -> commitLocked(owner, requested)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private CollectionResult commitLocked(OwnerId owner, List<String> requested) {
        final AtomicReference<CollectionResult> out = new AtomicReference<>();

        List<DrawResult> committed = pendingLedger.commit(owner, requested, accepted -> {
            OwnerAccount account = store.load(owner);
            Instant now = clock.instant();
            int shardsAccrued = 0;
            int tokensMinted = 0;

            for (DrawResult drawn : accepted) {
                Optional<InventoryRecord> held = account.findItem(drawn.itemId());
                CommitSettlement settlement = economyPolicy.settleCommitted(account, drawn, held.isPresent());
                shardsAccrued += settlement.shardsAccrued();
                tokensMinted += settlement.tokensMinted();
                upsert(account, drawn, held, now);
            }

            int unlocks = unlockService.materialize(account, account.getOwnedItemIds(), catalogStore.current());
            account.touch(now);
            store.save(owner, account);

            out.set(CollectionResult.builder()
                    .ok(true)
                    .committed(List.copyOf(accepted))
                    .balance(Map.copyOf(account.getBalance()))
                    .items(List.copyOf(account.getItems()))
                    .shards(account.getShards())
                    .guaranteeTokens(account.getGuaranteeTokens())
                    .shardsAccrued(shardsAccrued)
                    .tokensMinted(tokensMinted)
                    .unlocksInserted(unlocks)
                    .build());
        });

        log.info("commit(): owner={} requested={} committed={} unlocks={}",
                owner, requested.size(), committed.size(), out.get().unlocksInserted());
        return out.get();
    }

    private static void upsert(OwnerAccount account, DrawResult drawn, Optional<InventoryRecord> held, Instant now) {
        if (held.isEmpty()) {
            account.getItems().add(InventoryRecord.first(drawn, now));
            return;
        }
        List<InventoryRecord> items = account.getItems();
        items.set(items.indexOf(held.get()), held.get().increment(now));
    }
}
