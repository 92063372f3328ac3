package com.github.dimitryivaniuta.pack.economy;

/** Shards and tokens gained while writing committed items. */
public record CommitSettlement(int shardsAccrued, int tokensMinted) {

    public static final CommitSettlement NONE = new CommitSettlement(0, 0);
}
