package com.github.dimitryivaniuta.pack.service;

import com.github.dimitryivaniuta.pack.domain.model.DrawResult;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.domain.model.PendingOpening;
import com.github.dimitryivaniuta.pack.error.NoMatchingItemsException;
import com.github.dimitryivaniuta.pack.error.NoPendingOpeningException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds at most one staged opening per owner until it is committed.
 *
 * <p>A commit accepts the requested ids that were drawn, in request order. An id may be
 * requested more than once; every instance is accepted and adds one unit of quantity. A
 * successful commit always clears the pending opening; items that were not selected are gone.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class PendingOpeningLedger {

    private final PendingPolicy policy;
    private final ConcurrentMap<String, PendingOpening> pending = new ConcurrentHashMap<>();

    /** @return true if {@code opening} is now the owner's pending opening */
    public boolean stage(OwnerId owner, PendingOpening opening) {
        Objects.requireNonNull(opening, "opening");
        if (policy == PendingPolicy.LATEST_WINS) {
            PendingOpening replaced = pending.put(owner.key(), opening);
            if (replaced != null) {
                log.warn("Pending opening {} of owner={} replaced by {}", replaced.openingId(), owner, opening.openingId());
            }
            return true;
        }
        PendingOpening existing = pending.putIfAbsent(owner.key(), opening);
        if (existing != null) {
            log.warn("Owner={} already has pending opening {}; {} not staged",
                    owner, existing.openingId(), opening.openingId());
            return false;
        }
        return true;
    }

    public Optional<PendingOpening> peek(OwnerId owner) {
        return Optional.ofNullable(pending.get(owner.key()));
    }

    /**
     * Validates {@code requestedItemIds} against the pending opening, hands the accepted results
     * to {@code writer}, then clears the pending. If the writer throws, the pending stays.
     */
    public List<DrawResult> commit(OwnerId owner, List<String> requestedItemIds, Consumer<List<DrawResult>> writer) {
        PendingOpening opening = pending.get(owner.key());
        if (opening == null) {
            throw new NoPendingOpeningException(owner.value());
        }

        List<DrawResult> accepted = accept(opening, requestedItemIds == null ? List.of() : requestedItemIds);
        if (accepted.isEmpty()) {
            throw new NoMatchingItemsException(requestedItemIds == null ? List.of() : requestedItemIds);
        }

        writer.accept(accepted);
        pending.remove(owner.key(), opening);
        log.info("Committed {}/{} items of opening {} for owner={}",
                accepted.size(), opening.results().size(), opening.openingId(), owner);
        return accepted;
    }

    /** Drops the owner's pending opening, if any. */
    public void clear(OwnerId owner) {
        pending.remove(owner.key());
    }

    private static List<DrawResult> accept(PendingOpening opening, List<String> requested) {
        Map<String, DrawResult> drawn = new HashMap<>();
        for (DrawResult r : opening.results()) {
            drawn.putIfAbsent(r.itemId(), r);
        }
        List<DrawResult> accepted = new ArrayList<>();
        for (String id : requested) {
            DrawResult r = drawn.get(id);
            if (r != null) {
                accepted.add(r);
            }
        }
        return accepted;
    }
}
