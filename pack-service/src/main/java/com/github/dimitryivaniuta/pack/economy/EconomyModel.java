package com.github.dimitryivaniuta.pack.economy;

/** Reward model for duplicates; exactly one is active per deployment. */
public enum EconomyModel {
    /** Each dupe-flagged draw credits a fixed amount when the pack is opened. */
    IMMEDIATE_DUPE_CREDIT,
    /** Duplicates accepted at commit accrue shards; shards mint guarantee tokens. */
    SHARD_TOKENS
}
