package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.api.dto.GrantRequest;
import com.github.dimitryivaniuta.pack.catalog.CatalogSnapshot;
import com.github.dimitryivaniuta.pack.catalog.CatalogStore;
import com.github.dimitryivaniuta.pack.config.PackProperties;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.store.InventoryStore;
import com.github.dimitryivaniuta.pack.store.OwnerLocks;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Test helpers for local play: top up a balance, wipe an owner, reload the catalog.
 * Only registered with {@code pack.dev.enabled=true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pack.dev", name = "enabled", havingValue = "true")
public class DevToolsService {

    private static final long DEFAULT_GRANT = 1000L;

    private final InventoryStore store;
    private final OwnerLocks locks;
    private final EconomyLedger ledger;
    private final PendingOpeningLedger pendingLedger;
    private final CatalogStore catalogStore;
    private final PackProperties props;

    /** Credits {@code amount} (default 1000) of {@code currency} (default the economy currency). */
    public Mono<Map<String, Long>> grant(final OwnerId owner, final GrantRequest req) {
        final long amount = req == null || req.amount() == null ? DEFAULT_GRANT : req.amount();
        final String currency = req == null || req.currency() == null ? props.getEconomy().getCurrency() : req.currency();

        return Mono.fromCallable(() -> locks.withLock(owner, () -> {
                    OwnerAccount account = store.load(owner);
                    Map<String, Long> balance = ledger.credit(account, Money.of(currency, amount));
                    store.save(owner, account);
                    log.info("dev grant: owner={} +{} {}", owner, amount, currency);
                    return balance;
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Drops the owner's account and pending opening; the next access starts from the starting balance. */
    public Mono<Map<String, Object>> reset(final OwnerId owner) {
        return Mono.fromCallable(() -> locks.withLock(owner, () -> {
                    store.delete(owner);
                    pendingLedger.clear(owner);
                    OwnerAccount fresh = store.load(owner);
                    log.info("dev reset: owner={}", owner);
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("ok", true);
                    out.put("ownerId", owner.value());
                    out.put("balance", Map.copyOf(fresh.getBalance()));
                    return out;
                }))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<Map<String, Object>> reloadCatalog() {
        return Mono.fromCallable(() -> {
                    CatalogSnapshot snapshot = catalogStore.reload();
                    return Map.<String, Object>of(
                            "version", snapshot.getVersion(),
                            "packs", snapshot.getPacks().size(),
                            "items", snapshot.items().size());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
