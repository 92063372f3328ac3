package com.github.dimitryivaniuta.pack.error;

/** Missing or malformed input; raised before any side effect. */
public class ValidationException extends PackException {
    public ValidationException(String message) {
        super(PackErrorCode.VALIDATION, message);
    }
}
