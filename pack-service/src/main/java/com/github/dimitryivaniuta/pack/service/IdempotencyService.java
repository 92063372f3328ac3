package com.github.dimitryivaniuta.pack.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.pack.error.PackErrorCode;
import com.github.dimitryivaniuta.pack.error.PackException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * In-process idempotency cache for pack openings.
 *
 * Usage pattern in a service:
 * <pre>
 * return idempotency.execute(
 *     owner.key(),                   // keys are scoped per owner
 *     idempotencyKeyFromRequest,
 *     Map.of("packId", packId),      // used only to compute request fingerprint
 *     actionMono                     // Mono<T> that performs the work
 * ).map(CachedResult::getBody);      // or inspect .isFromCache()
 * </pre>
 *
 * <p>The first caller for a key inserts an in-flight placeholder (atomic insert-if-absent) and
 * starts the action; concurrent callers with the same fingerprint wait for that result instead of
 * running the action again. Once started the action runs to completion even if every caller
 * cancels; only a failed action releases its key. Entries live for the lifetime of the process.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotencyService {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration inFlightTimeout;

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    /** Encapsulates the outcome of execute(): the body and whether it was replayed. */
    @Value
    public static class CachedResult<T> {
        T body;
        boolean fromCache;
    }

    /** Reused key with a different fingerprint. Map to HTTP 409. */
    public static class IdempotencyConflictException extends PackException {
        public IdempotencyConflictException(String message) {
            super(PackErrorCode.IDEMPOTENCY_CONFLICT, message);
        }
    }

    /** Key exists but the first request has not produced its response within the wait budget. */
    public static class IdempotencyInProgressException extends PackException {
        public IdempotencyInProgressException(String message) {
            super(PackErrorCode.IDEMPOTENCY_IN_PROGRESS, message);
        }
    }

    private record Entry(String requestFingerprint, Instant createdAt, CompletableFuture<Object> response) {}

    /**
     * Execute an operation with idempotency. If a response exists for the same key and
     * fingerprint, return it. Otherwise run {@code action}, store the response, and return it.
     * A failed action leaves no entry behind, so the key can be retried.
     *
     * @param scope          Owner key the idempotency key is scoped to
     * @param idempotencyKey Client-supplied key (hashed before storing)
     * @param requestObject  Semantically relevant request fields (canonical JSON fingerprint)
     * @param action         The work to perform if not cached
     */
    @SuppressWarnings("unchecked")
    public <T> Mono<CachedResult<T>> execute(String scope, String idempotencyKey, Object requestObject, Mono<T> action) {
        Objects.requireNonNull(action, "action");
        final String s = requireNonBlank(scope, "scope");
        final String key = requireNonBlank(idempotencyKey, "idempotencyKey");

        final String keyHash = sha256Hex(s + ":" + key);
        final String fingerprint = sha256Hex(canonicalize(requestObject));

        return Mono.defer(() -> {
            final Entry fresh = new Entry(fingerprint, clock.instant(), new CompletableFuture<>());
            final Entry existing = entries.putIfAbsent(keyHash, fresh);

            if (existing == null) {
                // We are the winner -> run the action once, detached from this subscriber.
                // Cancelling a caller does not stop it and does not release the key.
                action
                        .switchIfEmpty(Mono.error(() -> new IllegalStateException("Idempotent action produced no response")))
                        .subscribe(
                                result -> fresh.response().complete(result),
                                err -> {
                                    entries.remove(keyHash, fresh);
                                    fresh.response().completeExceptionally(err);
                                    log.warn("Idempotent action failed; keyHash={}", keyHash, err);
                                });
                return Mono.fromFuture(fresh.response(), true)
                        .map(body -> new CachedResult<>((T) body, false));
            }

            // Existing entry -> check fingerprint and either replay or raise conflict.
            if (!fingerprint.equals(existing.requestFingerprint())) {
                return Mono.error(new IdempotencyConflictException(
                        "Idempotency key reused with a different request"));
            }
            log.debug("Replaying idempotent response; keyHash={}", keyHash);
            return Mono.fromFuture(existing.response(), true)
                    .timeout(inFlightTimeout, Mono.error(() -> new IdempotencyInProgressException(
                            "Idempotent request is in progress; try again")))
                    .map(body -> new CachedResult<>((T) body, true));
        });
    }

    /** Number of stored keys, in-flight ones included. */
    public int size() {
        return entries.size();
    }

    /* ======================================================================
       Fingerprinting & hashing
       ====================================================================== */

    /** Canonicalize an object to stable JSON for fingerprinting (null-safe). */
    private String canonicalize(Object o) {
        try {
            if (o == null) return "null";
            if (o instanceof CharSequence cs) return cs.toString();
            // Maps are sorted so field order never changes the fingerprint
            if (o instanceof Map<?, ?> m) return objectMapper.writeValueAsString(new TreeMap<Object, Object>(m));
            return objectMapper.writeValueAsString(objectMapper.valueToTree(o));
        } catch (Exception e) {
            throw new IllegalArgumentException("Request is not serializable for fingerprinting", e);
        }
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(dig);
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String requireNonBlank(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
        return v;
    }
}
