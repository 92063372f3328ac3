package com.github.dimitryivaniuta.pack.error;

import java.util.Map;
import lombok.Getter;

/** Base class of every business error raised by the pack service. */
@Getter
public abstract class PackException extends RuntimeException {

    private final PackErrorCode code;
    private final transient Map<String, Object> details;

    protected PackException(PackErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    protected PackException(PackErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
