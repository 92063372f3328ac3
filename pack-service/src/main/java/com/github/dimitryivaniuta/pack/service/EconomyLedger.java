package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.common.money.Money;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.error.InsufficientFundsException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * EconomyLedger moves currency on an owner account:
 * <ul>
 *   <li><b>Debit</b>: pack purchases; refused when the balance is short, so no partial charge.</li>
 *   <li><b>Credit</b>: dupe credits, refunds and dev grants.</li>
 * </ul>
 *
 * <p>The ledger mutates the account it is given and does no I/O; callers hold the owner lock
 * and persist the account together with the rest of the operation.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class EconomyLedger {

    private final Clock clock;

    /* ======================================================================
       PUBLIC API
       ====================================================================== */

    /** @return the balance after the debit */
    public Map<String, Long> debit(final OwnerAccount account, final Money amount) {
        requireNonNull(account, "account");
        requireNonNull(amount, "amount");

        final long available = account.balanceOf(amount.currency());
        if (available < amount.amount()) {
            throw new InsufficientFundsException(amount, available);
        }
        account.getBalance().put(amount.currency(), available - amount.amount());
        account.touch(clock.instant());

        log.debug("Ledger debit owner={} {} {} (was {})",
                account.getOwnerId(), amount.amount(), amount.currency(), available);
        return Map.copyOf(account.getBalance());
    }

    /** @return the balance after the credit */
    public Map<String, Long> credit(final OwnerAccount account, final Money amount) {
        requireNonNull(account, "account");
        requireNonNull(amount, "amount");

        account.getBalance().merge(amount.currency(), amount.amount(), Math::addExact);
        account.touch(clock.instant());

        log.debug("Ledger credit owner={} {} {}", account.getOwnerId(), amount.amount(), amount.currency());
        return Map.copyOf(account.getBalance());
    }

    /* ======================================================================
       INTERNALS
       ====================================================================== */

    private static <T> T requireNonNull(T value, String name) {
        return Objects.requireNonNull(value, () -> name + " must not be null");
    }
}
