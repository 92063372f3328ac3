package com.github.dimitryivaniuta.pack.error;

import java.util.Map;

public class UnknownPackException extends PackException {
    public UnknownPackException(String packId) {
        super(PackErrorCode.UNKNOWN_PACK, "Unknown packId: " + packId, Map.of("packId", packId), null);
    }
}
