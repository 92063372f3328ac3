package com.github.dimitryivaniuta.pack.domain.model;

import com.github.dimitryivaniuta.pack.error.ValidationException;
import java.util.regex.Pattern;

/**
 * Opaque owner identifier. Anonymous owners live in a separate address space from durable
 * identities, so "anon" the player and the anonymous owner never share an account.
 */
public record OwnerId(String value, boolean anonymous) {

    public static final String ANONYMOUS = "anon";

    private static final Pattern ID_RE = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    public OwnerId {
        if (value == null || !ID_RE.matcher(value).matches() || ".".equals(value) || "..".equals(value)) {
            throw new ValidationException("Invalid owner id");
        }
    }

    public static OwnerId player(String value) {
        return new OwnerId(value, false);
    }

    public static OwnerId anonymous(String value) {
        return new OwnerId(value, true);
    }

    /** Key used for locks and in-memory maps; unique across both address spaces. */
    public String key() {
        return (anonymous ? "anon:" : "player:") + value;
    }

    @Override
    public String toString() {
        return key();
    }
}
