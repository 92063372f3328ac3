package com.github.dimitryivaniuta.pack.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.error.InsufficientFundsException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EconomyLedgerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final EconomyLedger ledger = new EconomyLedger(clock);

    @Test
    void debitReducesBalance() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p1"), Map.of("COIN", 1000L), Instant.EPOCH);

        Map<String, Long> balance = ledger.debit(account, Money.of("COIN", 100));

        assertThat(balance).containsEntry("COIN", 900L);
        assertThat(account.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void debitBeyondBalanceChangesNothing() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p1"), Map.of("COIN", 99L), Instant.EPOCH);

        assertThatThrownBy(() -> ledger.debit(account, Money.of("COIN", 100)))
                .isInstanceOfSatisfying(InsufficientFundsException.class, e ->
                        assertThat(e.getDetails()).containsEntry("available", 99L).containsEntry("required", 100L));
        assertThat(account.balanceOf("COIN")).isEqualTo(99L);
    }

    @Test
    void debitOfUnknownCurrencyIsInsufficient() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p1"), Map.of("COIN", 1000L), Instant.EPOCH);

        assertThatThrownBy(() -> ledger.debit(account, Money.of("GEM", 1)))
                .isInstanceOf(InsufficientFundsException.class);
    }

    @Test
    void creditAddsAndCreatesCurrency() {
        OwnerAccount account = OwnerAccount.fresh(OwnerId.player("p1"), Map.of("COIN", 10L), Instant.EPOCH);

        ledger.credit(account, Money.of("COIN", 5));
        Map<String, Long> balance = ledger.credit(account, Money.of("GEM", 3));

        assertThat(balance).containsEntry("COIN", 15L).containsEntry("GEM", 3L);
    }
}
