package com.github.dimitryivaniuta.pack.error;

import java.util.List;
import java.util.Map;

public class NoMatchingItemsException extends PackException {
    public NoMatchingItemsException(List<String> requested) {
        super(PackErrorCode.NO_MATCHING_ITEMS, "No matching pending items.",
                Map.of("requested", List.copyOf(requested)), null);
    }
}
