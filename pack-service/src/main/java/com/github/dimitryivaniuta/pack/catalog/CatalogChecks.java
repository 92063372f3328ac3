package com.github.dimitryivaniuta.pack.catalog;

import com.github.dimitryivaniuta.pack.error.CatalogConfigurationException;
import java.util.List;

final class CatalogChecks {

    private CatalogChecks() {
    }

    static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new CatalogConfigurationException(name + " must not be blank");
        }
        return value;
    }

    static <T> List<T> copyOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
