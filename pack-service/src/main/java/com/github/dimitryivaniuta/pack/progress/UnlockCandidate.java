package com.github.dimitryivaniuta.pack.progress;

/** A reward character earned by a completed node; {@code source} names the node, e.g. {@code release:ep1}. */
public record UnlockCandidate(String characterId, String source) {}
