package com.github.dimitryivaniuta.pack.service;

/** What staging does when the owner already has an uncollected opening. */
public enum PendingPolicy {
    /** Keep the earlier pending; the new stage is a no-op. */
    FIRST_WINS,
    /** Replace the earlier pending; its items are discarded. */
    LATEST_WINS
}
