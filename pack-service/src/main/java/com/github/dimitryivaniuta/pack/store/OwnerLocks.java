package com.github.dimitryivaniuta.pack.store;

import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per owner; every read-modify-write of an owner's state runs inside it.
 * An entry exists only while some thread holds or waits for the owner's lock.
 */
public class OwnerLocks {

    private final ConcurrentMap<String, Slot> locks = new ConcurrentHashMap<>();

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }

    public <T> T withLock(OwnerId owner, Supplier<T> work) {
        final String key = owner.key();
        Slot slot = locks.compute(key, (k, s) -> {
            Slot held = s == null ? new Slot() : s;
            held.users++;
            return held;
        });
        slot.lock.lock();
        try {
            return work.get();
        } finally {
            slot.lock.unlock();
            locks.computeIfPresent(key, (k, s) -> --s.users == 0 ? null : s);
        }
    }

    /** Owners with a lock currently held or awaited. */
    public int size() {
        return locks.size();
    }
}
