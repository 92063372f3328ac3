package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.pack.api.dto.EconomySummary;
import com.github.dimitryivaniuta.pack.api.dto.OpenPackRequest;
import com.github.dimitryivaniuta.pack.api.dto.OpeningResult;
import com.github.dimitryivaniuta.pack.api.dto.PackView;
import com.github.dimitryivaniuta.pack.api.dto.PityView;
import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.catalog.DropRow;
import com.github.dimitryivaniuta.pack.catalog.DropTable;
import com.github.dimitryivaniuta.pack.catalog.Item;
import com.github.dimitryivaniuta.pack.catalog.Pack;
import com.github.dimitryivaniuta.pack.config.PackProperties;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.domain.model.PendingOpening;
import com.github.dimitryivaniuta.pack.draw.DropTableResolver;
import com.github.dimitryivaniuta.pack.draw.ItemSelection;
import com.github.dimitryivaniuta.pack.draw.ItemSelector;
import com.github.dimitryivaniuta.pack.draw.PityState;
import com.github.dimitryivaniuta.pack.draw.RarityOutcome;
import com.github.dimitryivaniuta.pack.economy.EconomyPolicy;
import com.github.dimitryivaniuta.pack.economy.OpeningSettlement;
import com.github.dimitryivaniuta.pack.error.UnknownPackException;
import com.github.dimitryivaniuta.pack.error.ValidationException;
import com.github.dimitryivaniuta.pack.service.IdempotencyService.CachedResult;
import com.github.dimitryivaniuta.pack.store.InventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Orchestrates a pack opening:
 * idempotency lookup, debit, one rarity + item draw per slot, economy settlement, staging.
 *
 * <p>Everything after the idempotency lookup runs under the owner's lock. The debit is
 * persisted before the first draw; if anything fails afterwards the account is restored to its
 * pre-opening state (auto-refund) and the idempotency key becomes retryable.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackOpeningService {

    private final CatalogStore catalogStore;
    private final InventoryStore store;
    private final OwnerLocks locks;
    private final IdempotencyService idempotency;
    private final EconomyLedger ledger;
    private final EconomyPolicy economyPolicy;
    private final DropTableResolver resolver;
    private final ItemSelector selector;
    private final PendingOpeningLedger pendingLedger;
    private final PackProperties props;
    private final Clock clock;

    /* =========================================================================
       Public API
       ========================================================================= */

    public Flux<PackView> listPacks() {
        return Flux.fromIterable(catalogStore.current().getPacks()).map(PackView::from);
    }

    public Mono<OpeningResult> open(final OwnerId owner, final OpenPackRequest req) {
        if (req == null || isBlank(req.packId()) || isBlank(req.idempotencyKey())) {
            return Mono.error(new ValidationException("packId and idempotencyKey are required"));
        }
        final String packId = req.packId().trim();
        final String key = req.idempotencyKey().trim();

        Mono<OpeningResult> action = Mono
                .fromCallable(() -> locks.withLock(owner, () -> openLocked(owner, packId, key)))
                .subscribeOn(Schedulers.boundedElastic());

        return idempotency.execute(owner.key(), key, Map.of("packId", packId), action)
                .doOnNext(r -> {
                    if (r.isFromCache()) {
                        log.info("open(): replayed opening={} owner={} key={}", r.getBody().openingId(), owner, key);
                    }
                })
                .map(CachedResult::getBody);
    }

    /* =========================================================================
       Opening (caller holds the owner lock)
       ========================================================================= */

    private OpeningResult openLocked(OwnerId owner, String packId, String key) {
        final CatalogSnapshot catalog = catalogStore.current();
        final Pack pack = catalog.findPack(packId).orElseThrow(() -> new UnknownPackException(packId));
        final DropTable table = catalog.table(pack.tableId());

        final OwnerAccount before = store.load(owner);
        final OwnerAccount account = before.copy();

        ledger.debit(account, pack.price());
        store.save(owner, account);

        try {
            return drawAndStage(owner, key, catalog, pack, table, account);
        } catch (RuntimeException e) {
            refund(owner, before, pack, e);
            throw e;
        }
    }

    private OpeningResult drawAndStage(OwnerId owner, String key, CatalogSnapshot catalog,
                                       Pack pack, DropTable table, OwnerAccount account) {
        final Instant now = clock.instant();
        // Dupes are judged against the inventory as it was before this opening
        final Set<String> ownedBefore = Set.copyOf(account.getOwnedItemIds());
        final Set<String> drawn = new HashSet<>();
        final boolean guaranteeActive = economyPolicy.guaranteeAvailable(account);

        boolean guaranteeConsumed = false;
        PityState pity = account.getPity();
        List<DrawResult> results = new ArrayList<>(props.getPullsPerOpening());

        for (int slot = 0; slot < props.getPullsPerOpening(); slot++) {
            RarityOutcome outcome = resolver.resolve(table, pity);
            pity = outcome.next();

            ItemSelection selection = selector.select(catalog, outcome.rarity(), ownedBefore, drawn,
                    guaranteeActive && !guaranteeConsumed);
            guaranteeConsumed |= selection.guaranteeConsumed();

            Item item = selection.item();
            drawn.add(item.id());
            results.add(DrawResult.of(slot, item, ownedBefore.contains(item.id()),
                    outcome.pityForced(), selection.guaranteeConsumed()));
            log.debug("draw owner={} slot={} rarity={} item={} pityForced={}",
                    owner, slot, outcome.rarity(), item.id(), outcome.pityForced());
        }
        account.setPity(pity);

        OpeningSettlement settlement = economyPolicy.settleOpening(account, results, guaranteeConsumed);
        account.touch(now);
        store.save(owner, account);

        final String openingId = "op_" + UUID.randomUUID().toString().replace("-", "").substring(0, 10);
        boolean staged = pendingLedger.stage(owner,
                new PendingOpening(owner.value(), openingId, pack.id(), key, now, results));

        log.info("open(): opening={} owner={} pack={} charged={} {} staged={}",
                openingId, owner, pack.id(), pack.price().amount(), pack.price().currency(), staged);

        return OpeningResult.builder()
                .openingId(openingId)
                .pack(PackView.from(pack))
                .results(List.copyOf(results))
                .economy(EconomySummary.builder()
                        .model(economyPolicy.model())
                        .balance(Map.copyOf(account.getBalance()))
                        .charged(pack.price())
                        .dupeCredit(settlement.dupeCredit())
                        .shards(account.getShards())
                        .guaranteeTokens(account.getGuaranteeTokens())
                        .guaranteeUsed(settlement.guaranteeUsed())
                        .build())
                .pity(new PityView(pity.sinceLastPity(), table.pityRow().map(DropRow::rarity).orElse(null)))
                .staged(staged)
                .openedAt(now)
                .build();
    }

    /** Restores the pre-opening account: balance, pity and tokens all go back. */
    private void refund(OwnerId owner, OwnerAccount before, Pack pack, RuntimeException cause) {
        try {
            store.save(owner, before);
            log.warn("open(): refunded {} {} to owner={} after failure: {}",
                    pack.price().amount(), pack.price().currency(), owner, cause.toString());
        } catch (RuntimeException refundError) {
            cause.addSuppressed(refundError);
            log.error("open(): refund of {} {} to owner={} FAILED; manual correction needed",
                    pack.price().amount(), pack.price().currency(), owner, refundError);
        }
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
