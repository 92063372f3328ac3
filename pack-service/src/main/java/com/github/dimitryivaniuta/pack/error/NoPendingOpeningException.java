package com.github.dimitryivaniuta.pack.error;

import java.util.Map;

public class NoPendingOpeningException extends PackException {
    public NoPendingOpeningException(String ownerId) {
        super(PackErrorCode.NO_PENDING, "No pending items to collect.", Map.of("ownerId", ownerId), null);
    }
}
