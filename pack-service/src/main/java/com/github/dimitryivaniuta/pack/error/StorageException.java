package com.github.dimitryivaniuta.pack.error;

import java.util.Map;

/** An inventory store read or write failed. */
public class StorageException extends PackException {
    public StorageException(String message, Throwable cause) {
        super(PackErrorCode.STORAGE_FAILURE, message, Map.of(), cause);
    }
}
