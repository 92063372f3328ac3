package com.github.dimitryivaniuta.pack.error;

import java.util.Map;

/** The catalog cannot serve a draw: bad table, undrawable rarity, dangling reference. */
public class CatalogConfigurationException extends PackException {
    public CatalogConfigurationException(String message) {
        super(PackErrorCode.CATALOG_MISCONFIGURED, message);
    }

    public CatalogConfigurationException(String message, Throwable cause) {
        super(PackErrorCode.CATALOG_MISCONFIGURED, message, Map.of(), cause);
    }
}
