package com.github.dimitryivaniuta.pack.error;

/** Stable error codes surfaced in {@code ApiError.code}. */
public enum PackErrorCode {
    CATALOG_MISCONFIGURED,
    IDEMPOTENCY_CONFLICT,
    IDEMPOTENCY_IN_PROGRESS,
    INSUFFICIENT_FUNDS,
    NO_MATCHING_ITEMS,
    NO_PENDING,
    STORAGE_FAILURE,
    UNKNOWN_PACK,
    VALIDATION
}
