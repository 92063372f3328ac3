package com.github.dimitryivaniuta.pack.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.config.PackProperties;
import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.InventoryRecord;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.draw.DropTableResolver;
import com.github.dimitryivaniuta.pack.draw.ItemSelector;
import com.github.dimitryivaniuta.pack.economy.EconomyPolicy;
import com.github.dimitryivaniuta.pack.economy.ImmediateDupeCreditPolicy;
import com.github.dimitryivaniuta.pack.progress.ProgressEvaluator;
import com.github.dimitryivaniuta.pack.service.CollectionService;
import com.github.dimitryivaniuta.pack.service.EconomyLedger;
import com.github.dimitryivaniuta.pack.service.IdempotencyService;
import com.github.dimitryivaniuta.pack.service.PackOpeningService;
import com.github.dimitryivaniuta.pack.service.PendingOpeningLedger;
import com.github.dimitryivaniuta.pack.service.PendingPolicy;
import com.github.dimitryivaniuta.pack.service.UnlockService;
import com.github.dimitryivaniuta.pack.store.InMemoryInventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.Function;

/** Core services wired by hand over the {@link TestCatalogs#starter()} catalog and an in-memory store. */
public class PackFixture {

    public final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    public final CatalogSnapshot catalog = TestCatalogs.starter();
    public final CatalogStore catalogStore = TestStores.catalogStore(catalog);
    public final InMemoryInventoryStore store = new InMemoryInventoryStore(Map.of("COIN", 1000L), clock);
    public final OwnerLocks locks = new OwnerLocks();
    public final EconomyLedger ledger = new EconomyLedger(clock);
    public final IdempotencyService idempotency =
            new IdempotencyService(new ObjectMapper(), clock, Duration.ofSeconds(2));
    public final PendingOpeningLedger pending = new PendingOpeningLedger(PendingPolicy.FIRST_WINS);
    public final ScriptedRandom random = new ScriptedRandom();
    public final UnlockService unlocks = new UnlockService(new ProgressEvaluator(), clock);

    public EconomyPolicy dupeCredit(long perDupe) {
        return new ImmediateDupeCreditPolicy(ledger, Money.of("COIN", perDupe));
    }

    public PackOpeningService openingService(EconomyPolicy policy) {
        return new PackOpeningService(catalogStore, store, locks, idempotency, ledger, policy,
                new DropTableResolver(random), new ItemSelector(random), pending, new PackProperties(), clock);
    }

    public CollectionService collectionService(EconomyPolicy policy) {
        return new CollectionService(pending, store, locks, policy, unlocks, catalogStore, clock);
    }

    /** Puts catalog items straight into the owner's inventory. */
    public void own(OwnerId owner, Iterable<String> itemIds) {
        update(owner, account -> {
            for (String id : itemIds) {
                DrawResult drawn = DrawResult.of(0, catalog.findItem(id).orElseThrow(), false, false, false);
                account.getItems().add(InventoryRecord.first(drawn, clock.instant()));
            }
            return account;
        });
    }

    public void update(OwnerId owner, Function<OwnerAccount, OwnerAccount> change) {
        store.save(owner, change.apply(store.load(owner)));
    }

    public long balance(OwnerId owner) {
        return store.load(owner).balanceOf("COIN");
    }
}
