package com.github.dimitryivaniuta.pack.error;

import com.github.dimitryivaniuta.common.money.Money;
import java.util.Map;

/** Balance below the price. Checked before the debit, so nothing was charged. */
public class InsufficientFundsException extends PackException {
    public InsufficientFundsException(Money required, long available) {
        super(PackErrorCode.INSUFFICIENT_FUNDS, "Insufficient funds",
                Map.of("currency", required.currency(), "required", required.amount(), "available", available),
                null);
    }
}
